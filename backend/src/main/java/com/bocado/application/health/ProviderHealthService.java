/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.health;

import com.bocado.config.GatewayProperties;
import com.bocado.domain.model.EndpointClass;
import com.bocado.infrastructure.persistence.entity.ProviderCallEventEntity;
import com.bocado.infrastructure.persistence.repository.ProviderCallEventRepository;
import com.bocado.infrastructure.provider.ProviderErrorType;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Provider error rate and latency derived from the provider call log.
 */
@Service
public class ProviderHealthService {
    private final ProviderCallEventRepository providerCallEventRepository;
    private final GatewayProperties.ProviderHealth config;
    private final Clock clock;

    public ProviderHealthService(
            ProviderCallEventRepository providerCallEventRepository,
            GatewayProperties properties,
            Clock clock
    ) {
        this.providerCallEventRepository = providerCallEventRepository;
        this.config = properties.providerHealth();
        this.clock = clock;
    }

    public void recordCall(EndpointClass endpointClass, boolean success, Integer statusCode, ProviderErrorType errorType, long latencyMs) {
        ProviderCallEventEntity event = new ProviderCallEventEntity();
        event.setEndpointClass(endpointClass.key());
        event.setSuccess(success);
        event.setStatusCode(statusCode);
        event.setErrorType(errorType == null ? null : errorType.name());
        event.setLatencyMs(Math.max(0, latencyMs));
        event.setCreatedAt(clock.instant());
        providerCallEventRepository.save(event);
    }

    public ProviderHealthReport report() {
        Instant now = clock.instant();

        long total = providerCallEventRepository.countSince(now.minus(config.errorWindow()));
        long failures = providerCallEventRepository.countFailuresSince(now.minus(config.errorWindow()));
        double errorRate = total == 0 ? 0 : (double) failures / (double) total;
        boolean providerHealthy = total < config.minSamples() || errorRate <= config.errorRateThreshold();

        long p95 = p95(providerCallEventRepository.findSuccessLatenciesSince(now.minus(config.latencyWindow())));
        boolean latencyOk = p95 <= config.latencyP95Threshold().toMillis();

        return new ProviderHealthReport(total, errorRate, p95, providerHealthy, latencyOk);
    }

    @Transactional
    public int pruneOlderThan(Instant cutoff) {
        return providerCallEventRepository.deleteOlderThan(cutoff);
    }

    /**
     * Nearest-rank p95 over latencies sorted ascending; 0 without samples.
     */
    static long p95(List<Long> sortedLatencies) {
        if (sortedLatencies.isEmpty()) return 0;
        int index = (int) Math.ceil(0.95 * sortedLatencies.size()) - 1;
        if (index < 0) index = 0;
        if (index >= sortedLatencies.size()) index = sortedLatencies.size() - 1;
        return sortedLatencies.get(index);
    }
}
