/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application;

import com.bocado.application.flags.FeatureFlagService;
import com.bocado.application.mode.ServiceModeService;
import com.bocado.config.GatewayProperties;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class GatewayBootstrap {
    private final FeatureFlagService featureFlagService;
    private final ServiceModeService serviceModeService;
    private final boolean seedFeatureFlags;

    public GatewayBootstrap(FeatureFlagService featureFlagService, ServiceModeService serviceModeService, GatewayProperties properties) {
        this.featureFlagService = featureFlagService;
        this.serviceModeService = serviceModeService;
        this.seedFeatureFlags = properties.serviceMode().seedFeatureFlags();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (seedFeatureFlags) {
            featureFlagService.initDefaults();
        }
        serviceModeService.initialize();
    }
}
