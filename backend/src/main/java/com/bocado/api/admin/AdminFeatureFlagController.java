/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.api.admin;

import com.bocado.application.flags.FeatureFlagService;
import com.bocado.domain.model.FeatureFlag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/feature-flags")
public class AdminFeatureFlagController {
    private final FeatureFlagService featureFlagService;

    public AdminFeatureFlagController(FeatureFlagService featureFlagService) {
        this.featureFlagService = featureFlagService;
    }

    @GetMapping
    public List<FeatureFlag> list() {
        return featureFlagService.list();
    }

    @PutMapping("/{key}")
    public FeatureFlag set(@PathVariable("key") String key, @Valid @RequestBody SetFlagRequest request) {
        return featureFlagService.set(key, request.enabled(), request.reason());
    }

    @PostMapping("/init-defaults")
    public Map<String, Integer> initDefaults() {
        return Map.of("created", featureFlagService.initDefaults());
    }

    public record SetFlagRequest(@NotNull Boolean enabled, @Size(max = 200) String reason) {}
}
