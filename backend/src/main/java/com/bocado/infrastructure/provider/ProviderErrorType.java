/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.provider;

public enum ProviderErrorType {
    NOT_FOUND(false),
    RATE_LIMITED(true),
    HTTP_4XX(true),
    HTTP_5XX(true),
    TIMEOUT(true),
    CONNECTION(true),
    INVALID_RESPONSE(true),
    PAYLOAD_TOO_LARGE(true),
    UNKNOWN(true);

    private final boolean breakerFailure;

    ProviderErrorType(boolean breakerFailure) {
        this.breakerFailure = breakerFailure;
    }

    /**
     * A missing resource is a healthy answer from the provider and does not trip the breaker.
     */
    public boolean countsAsBreakerFailure() {
        return breakerFailure;
    }
}
