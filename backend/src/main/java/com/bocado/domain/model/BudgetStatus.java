/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.domain.model;

import java.time.Instant;

public record BudgetStatus(
        EndpointClass endpointClass,
        Instant windowStart,
        Instant windowEnd,
        long spent,
        long limit
) {
    public boolean ok() {
        return spent < limit;
    }

    public long remaining() {
        return Math.max(0, limit - spent);
    }
}
