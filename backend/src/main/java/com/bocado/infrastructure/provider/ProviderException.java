/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.provider;

import com.bocado.domain.model.EndpointClass;

public class ProviderException extends RuntimeException {
    private final EndpointClass endpointClass;
    private final ProviderErrorType type;
    private final Integer statusCode;
    private final Long retryAfterSeconds;
    private final String safeMessage;

    public ProviderException(
            EndpointClass endpointClass,
            ProviderErrorType type,
            Integer statusCode,
            Long retryAfterSeconds,
            String safeMessage,
            Throwable cause
    ) {
        super(safeMessage, cause);
        this.endpointClass = endpointClass;
        this.type = type;
        this.statusCode = statusCode;
        this.retryAfterSeconds = retryAfterSeconds;
        this.safeMessage = safeMessage;
    }

    public ProviderException(EndpointClass endpointClass, ProviderErrorType type, Integer statusCode, String safeMessage) {
        this(endpointClass, type, statusCode, null, safeMessage, null);
    }

    public ProviderException(EndpointClass endpointClass, ProviderErrorType type, String safeMessage, Throwable cause) {
        this(endpointClass, type, null, null, safeMessage, cause);
    }

    public EndpointClass getEndpointClass() {
        return endpointClass;
    }

    public ProviderErrorType getType() {
        return type;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public String getSafeMessage() {
        return safeMessage;
    }
}
