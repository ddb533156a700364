/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.config;

import com.bocado.domain.model.EndpointClass;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "bocado")
public record GatewayProperties(
        String environment,
        Frontend frontend,
        Provider provider,
        Media media,
        CircuitBreaker circuitBreaker,
        Budget budget,
        ServiceMode serviceMode,
        ProviderHealth providerHealth,
        Admin admin,
        State state
) {
    public record Frontend(String baseUrl) {}

    public record Provider(
            String baseUrl,
            String apiKey,
            Duration connectTimeout,
            Duration responseTimeout
    ) {}

    public record Media(
            String signingSecret,
            List<String> previousSigningSecrets,
            Duration urlTtl,
            Duration resolveTimeout,
            Duration fetchTimeout,
            int maxPayloadBytes,
            long photoCost,
            Cache cache
    ) {
        public record Cache(Duration browserMaxAge, Duration cdnMaxAge, Duration staleWhileRevalidate) {}
    }

    public record CircuitBreaker(
            int failureThreshold,
            Duration coolDown,
            Duration maxCoolDown,
            Duration probeTimeout
    ) {}

    public record Budget(Duration window, long defaultLimit, Map<EndpointClass, Long> limits) {
        public long limitFor(EndpointClass endpointClass) {
            Long configured = limits == null ? null : limits.get(endpointClass);
            return configured == null ? defaultLimit : configured;
        }
    }

    public record ServiceMode(
            Duration minDwell,
            Duration evaluationInterval,
            boolean manageFeatureFlags,
            boolean schedulerEnabled,
            boolean seedFeatureFlags
    ) {}

    public record ProviderHealth(
            Duration errorWindow,
            Duration latencyWindow,
            double errorRateThreshold,
            int minSamples,
            Duration latencyP95Threshold,
            Duration eventRetention,
            boolean prunerEnabled,
            String pruneCron
    ) {}

    public record Admin(String apiKeySha256) {}

    public record State(int maxAttempts) {}
}
