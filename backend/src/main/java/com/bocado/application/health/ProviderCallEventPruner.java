/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.health;

import com.bocado.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

@Component
@ConditionalOnProperty(prefix = "bocado.provider-health", name = "pruner-enabled", havingValue = "true", matchIfMissing = true)
public class ProviderCallEventPruner {
    private static final Logger log = LoggerFactory.getLogger(ProviderCallEventPruner.class);

    private final ProviderHealthService providerHealthService;
    private final GatewayProperties.ProviderHealth config;
    private final Clock clock;

    public ProviderCallEventPruner(ProviderHealthService providerHealthService, GatewayProperties properties, Clock clock) {
        this.providerHealthService = providerHealthService;
        this.config = properties.providerHealth();
        this.clock = clock;
    }

    @Scheduled(cron = "${bocado.provider-health.prune-cron:0 15 3 * * *}", zone = "UTC")
    public void prune() {
        Instant cutoff = clock.instant().minus(config.eventRetention());
        try {
            int deleted = providerHealthService.pruneOlderThan(cutoff);
            log.info("Provider call events pruned deleted={} cutoff={}", deleted, cutoff);
        } catch (DataAccessException e) {
            log.warn("Provider call event pruning failed cutoff={}", cutoff, e);
        }
    }
}
