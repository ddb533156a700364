/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.domain.model;

import java.time.Instant;

public record CircuitBreakerSnapshot(
        EndpointClass endpointClass,
        CircuitStatus status,
        int consecutiveFailures,
        int openCount,
        Instant openedAt,
        Instant nextProbeAt
) {
    public static CircuitBreakerSnapshot closed(EndpointClass endpointClass) {
        return new CircuitBreakerSnapshot(endpointClass, CircuitStatus.CLOSED, 0, 0, null, null);
    }

    public boolean isClosed() {
        return status == CircuitStatus.CLOSED;
    }
}
