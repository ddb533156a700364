/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.mode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "bocado.service-mode", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class ServiceModeScheduler {
    private static final Logger log = LoggerFactory.getLogger(ServiceModeScheduler.class);

    private final ServiceModeService serviceModeService;

    public ServiceModeScheduler(ServiceModeService serviceModeService) {
        this.serviceModeService = serviceModeService;
    }

    @Scheduled(
            initialDelayString = "${bocado.service-mode.evaluation-interval:PT5S}",
            fixedDelayString = "${bocado.service-mode.evaluation-interval:PT5S}"
    )
    public void evaluate() {
        try {
            serviceModeService.recompute();
        } catch (DataAccessException e) {
            log.warn("Scheduled service mode evaluation failed", e);
        }
    }
}
