/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.mode;

import com.bocado.domain.model.ServiceModeState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the mode as detail only. The gateway keeps serving in every mode, so health stays UP.
 */
@Component("serviceMode")
public class ServiceModeHealthIndicator implements HealthIndicator {
    private final ServiceModeService serviceModeService;

    public ServiceModeHealthIndicator(ServiceModeService serviceModeService) {
        this.serviceModeService = serviceModeService;
    }

    @Override
    public Health health() {
        ServiceModeState state = serviceModeService.current();
        return Health.up()
                .withDetail("mode", state.currentMode())
                .withDetail("reason", state.reason())
                .withDetail("enteredAt", state.enteredAt())
                .withDetail("manualOverride", state.manualOverride())
                .build();
    }
}
