/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.domain.model;

public record ServiceModeTriggers(
        boolean providerHealthy,
        boolean budgetOk,
        boolean latencyOk,
        boolean circuitBreakerClosed
) {
    private static final int PROVIDER_HEALTHY = 1;
    private static final int BUDGET_OK = 1 << 1;
    private static final int LATENCY_OK = 1 << 2;
    private static final int CIRCUIT_BREAKER_CLOSED = 1 << 3;

    public static ServiceModeTriggers allClear() {
        return new ServiceModeTriggers(true, true, true, true);
    }

    public int toMask() {
        int mask = 0;
        if (providerHealthy) mask |= PROVIDER_HEALTHY;
        if (budgetOk) mask |= BUDGET_OK;
        if (latencyOk) mask |= LATENCY_OK;
        if (circuitBreakerClosed) mask |= CIRCUIT_BREAKER_CLOSED;
        return mask;
    }

    public static ServiceModeTriggers fromMask(int mask) {
        return new ServiceModeTriggers(
                (mask & PROVIDER_HEALTHY) != 0,
                (mask & BUDGET_OK) != 0,
                (mask & LATENCY_OK) != 0,
                (mask & CIRCUIT_BREAKER_CLOSED) != 0
        );
    }
}
