/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.api;

import com.bocado.config.RequestIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Every error leaves as {@link ApiErrorResponse} with {@code Cache-Control: no-store}.
 * Upstream bodies and exception messages from outside this package are never echoed.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex, HttpServletRequest request) {
        if (ex.getStatus().is5xxServerError()) {
            log.warn("API error requestId={} status={} code={} reason={}",
                    RequestIdFilter.currentRequestId(request), ex.getStatus().value(), ex.getCode(), ex.getReason());
        }
        return respond(request, ex.getStatus(), ex.getCode(), ex.getMessage(), ex.getReason(), ex.getRetryAfterSeconds());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(request, HttpStatus.BAD_REQUEST, ApiException.VALIDATION_ERROR, ex.getMessage(), null, null);
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            ConstraintViolationException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex, HttpServletRequest request) {
        return respond(request, HttpStatus.BAD_REQUEST, ApiException.VALIDATION_ERROR, "Invalid request", null, null);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(request, HttpStatus.NOT_FOUND, ApiException.NOT_FOUND, "Not found", null, null);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiErrorResponse> handleMethod(HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        return respond(request, HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", "Method not allowed", null, null);
    }

    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public ResponseEntity<ApiErrorResponse> handleAsyncTimeout(AsyncRequestTimeoutException ex, HttpServletRequest request) {
        log.warn("Async request timed out requestId={}", RequestIdFilter.currentRequestId(request));
        return respond(request, HttpStatus.GATEWAY_TIMEOUT, ApiException.TIMEOUT, "Request timed out", "request_timeout", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception requestId={} type={}",
                RequestIdFilter.currentRequestId(request), ex.getClass().getName(), ex);
        return respond(request, HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL", "Unexpected error", null, null);
    }

    // ---------- helpers ----------

    private ResponseEntity<ApiErrorResponse> respond(
            HttpServletRequest request,
            HttpStatus status,
            String code,
            String message,
            String reason,
            Long retryAfterSeconds
    ) {
        ApiErrorResponse body = new ApiErrorResponse(
                status.name(),
                code,
                message,
                reason,
                RequestIdFilter.currentRequestId(request)
        );
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status)
                .cacheControl(CacheControl.noStore());
        if (retryAfterSeconds != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        }
        return builder.body(body);
    }
}
