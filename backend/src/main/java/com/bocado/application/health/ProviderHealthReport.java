/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.health;

public record ProviderHealthReport(
        long sampleCount,
        double errorRate,
        long p95LatencyMs,
        boolean providerHealthy,
        boolean latencyOk
) {}
