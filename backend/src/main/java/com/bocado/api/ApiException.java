/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.api;

import org.springframework.http.HttpStatus;

public class ApiException extends RuntimeException {
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String AUTH_ERROR = "AUTH_ERROR";
    public static final String FEATURE_DISABLED = "FEATURE_DISABLED";
    public static final String SERVICE_DEGRADED = "SERVICE_DEGRADED";
    public static final String SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String UPSTREAM_RATE_LIMITED = "UPSTREAM_RATE_LIMITED";
    public static final String UPSTREAM_ERROR = "UPSTREAM_ERROR";
    public static final String TIMEOUT = "TIMEOUT";

    private final HttpStatus status;
    private final String code;
    private final String reason;
    private final Long retryAfterSeconds;

    public ApiException(HttpStatus status, String code, String message, String reason, Long retryAfterSeconds) {
        super(message);
        this.status = status;
        this.code = code;
        this.reason = reason;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public ApiException(HttpStatus status, String code, String message) {
        this(status, code, message, null, null);
    }

    public static ApiException validation(String message) {
        return new ApiException(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, message);
    }

    public static ApiException forbidden(String reason, String message) {
        return new ApiException(HttpStatus.FORBIDDEN, AUTH_ERROR, message, reason, null);
    }

    public static ApiException unavailable(String code, String reason, String message, long retryAfterSeconds) {
        return new ApiException(HttpStatus.SERVICE_UNAVAILABLE, code, message, reason, retryAfterSeconds);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
