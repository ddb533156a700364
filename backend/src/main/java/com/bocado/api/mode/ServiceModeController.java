/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.api.mode;

import com.bocado.application.mode.ServiceModeService;
import com.bocado.domain.model.ServiceModeState;
import com.bocado.domain.model.ServiceModeTransition;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/service-mode")
public class ServiceModeController {
    private final ServiceModeService serviceModeService;

    public ServiceModeController(ServiceModeService serviceModeService) {
        this.serviceModeService = serviceModeService;
    }

    @GetMapping
    public ResponseEntity<ServiceModeState> current() {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(serviceModeService.current());
    }

    @GetMapping("/history")
    public List<ServiceModeTransition> history(@RequestParam(value = "limit", defaultValue = "20") int limit) {
        return serviceModeService.history(limit);
    }
}
