/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application;

import com.bocado.application.budget.BudgetTracker;
import com.bocado.application.circuit.CircuitBreakerService;
import com.bocado.application.health.ProviderHealthService;
import com.bocado.domain.model.EndpointClass;
import com.bocado.infrastructure.provider.ProviderErrorType;
import com.bocado.infrastructure.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeoutException;

/**
 * Feeds provider call outcomes into the breaker, the call log and the budget.
 * Each write is independent; a failing one is logged and the others still run.
 */
@Service
public class ProviderCallRecorder {
    private static final Logger log = LoggerFactory.getLogger(ProviderCallRecorder.class);

    private final CircuitBreakerService circuitBreakerService;
    private final ProviderHealthService providerHealthService;
    private final BudgetTracker budgetTracker;

    public ProviderCallRecorder(
            CircuitBreakerService circuitBreakerService,
            ProviderHealthService providerHealthService,
            BudgetTracker budgetTracker
    ) {
        this.circuitBreakerService = circuitBreakerService;
        this.providerHealthService = providerHealthService;
        this.budgetTracker = budgetTracker;
    }

    public void recordSuccess(EndpointClass endpointClass, long latencyMs, long cost) {
        bookkeep("circuit", endpointClass, () -> circuitBreakerService.recordSuccess(endpointClass));
        bookkeep("call_log", endpointClass, () -> providerHealthService.recordCall(endpointClass, true, 200, null, latencyMs));
        if (cost > 0) {
            bookkeep("budget", endpointClass, () -> budgetTracker.recordSpend(endpointClass, cost));
        }
    }

    public void recordFailure(EndpointClass endpointClass, Throwable error, long latencyMs) {
        ProviderErrorType type = classify(error);
        Integer status = error instanceof ProviderException pe ? pe.getStatusCode() : null;
        boolean breakerFailure = type.countsAsBreakerFailure();

        bookkeep("circuit", endpointClass, () -> {
            if (breakerFailure) circuitBreakerService.recordFailure(endpointClass);
            else circuitBreakerService.recordSuccess(endpointClass);
        });
        bookkeep("call_log", endpointClass, () -> providerHealthService.recordCall(endpointClass, !breakerFailure, status, type, latencyMs));
    }

    public static ProviderErrorType classify(Throwable error) {
        if (error instanceof ProviderException pe) return pe.getType();
        if (error instanceof TimeoutException) return ProviderErrorType.TIMEOUT;
        return ProviderErrorType.UNKNOWN;
    }

    private void bookkeep(String what, EndpointClass endpointClass, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Provider bookkeeping failed what={} endpointClass={}", what, endpointClass.key(), e);
        }
    }
}
