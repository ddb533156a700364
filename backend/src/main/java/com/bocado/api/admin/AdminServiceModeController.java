/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.api.admin;

import com.bocado.application.mode.ServiceModeService;
import com.bocado.domain.model.ServiceMode;
import com.bocado.domain.model.ServiceModeState;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/service-mode")
public class AdminServiceModeController {
    private final ServiceModeService serviceModeService;

    public AdminServiceModeController(ServiceModeService serviceModeService) {
        this.serviceModeService = serviceModeService;
    }

    @PostMapping("/override")
    public ServiceModeState override(@Valid @RequestBody OverrideRequest request) {
        return serviceModeService.override(request.mode(), request.reason());
    }

    @DeleteMapping("/override")
    public ServiceModeState clearOverride() {
        return serviceModeService.clearOverride();
    }

    @PostMapping("/recompute")
    public ServiceModeState recompute() {
        return serviceModeService.recompute();
    }

    public record OverrideRequest(@NotNull ServiceMode mode, @NotBlank @Size(max = 200) String reason) {}
}
