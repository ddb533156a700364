/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.mode;

import com.bocado.domain.model.ServiceMode;
import com.bocado.domain.model.ServiceModeState;
import com.bocado.domain.model.ServiceModeTriggers;

import java.time.Duration;
import java.time.Instant;

/**
 * Pure mode arithmetic: trigger precedence plus hysteresis. Holds no state of its own.
 */
public final class ServiceModePolicy {
    public static final String REASON_CIRCUIT_OPEN = "circuit_open";
    public static final String REASON_BUDGET_EXCEEDED = "budget_exceeded";
    public static final String REASON_PROVIDER_UNHEALTHY = "provider_unhealthy";
    public static final String REASON_ELEVATED_LATENCY = "elevated_latency";

    private final Duration minDwell;

    public ServiceModePolicy(Duration minDwell) {
        if (minDwell == null || minDwell.isNegative()) {
            throw new IllegalArgumentException("minDwell must not be negative");
        }
        this.minDwell = minDwell;
    }

    /**
     * Most severe applicable mode for a trigger set.
     */
    public static Resolution resolve(ServiceModeTriggers triggers) {
        if (!triggers.circuitBreakerClosed()) return new Resolution(ServiceMode.OUTAGE, REASON_CIRCUIT_OPEN);
        if (!triggers.budgetOk()) return new Resolution(ServiceMode.DEGRADED, REASON_BUDGET_EXCEEDED);
        if (!triggers.providerHealthy()) return new Resolution(ServiceMode.DEGRADED, REASON_PROVIDER_UNHEALTHY);
        if (!triggers.latencyOk()) return new Resolution(ServiceMode.WATCH, REASON_ELEVATED_LATENCY);
        return new Resolution(ServiceMode.NOMINAL, ServiceModeState.REASON_NOMINAL);
    }

    /**
     * Escalations commit at once. A relaxation commits only after the same trigger set has been
     * observed for {@code minDwell}; any other trigger set restarts the wait.
     */
    public ModeDecision decide(ServiceModeState current, PendingRelaxation pending, ServiceModeTriggers observed, Instant now) {
        Resolution target = resolve(observed);
        ServiceMode committed = current.currentMode();

        if (target.mode().isMoreSevereThan(committed)) {
            return commit(target, observed, now);
        }
        if (target.mode() == committed) {
            ServiceModeState same = new ServiceModeState(committed, target.reason(), current.enteredAt(), observed, false, now);
            return new ModeDecision(same, null, false);
        }

        PendingRelaxation waiting = pending != null && pending.triggers().equals(observed)
                ? pending
                : new PendingRelaxation(observed, now);
        if (!now.isBefore(waiting.since().plus(minDwell))) {
            return commit(target, observed, now);
        }
        ServiceModeState held = new ServiceModeState(committed, current.reason(), current.enteredAt(), observed, false, now);
        return new ModeDecision(held, waiting, false);
    }

    private static ModeDecision commit(Resolution target, ServiceModeTriggers observed, Instant now) {
        ServiceModeState next = new ServiceModeState(target.mode(), target.reason(), now, observed, false, now);
        return new ModeDecision(next, null, true);
    }

    public record Resolution(ServiceMode mode, String reason) {}

    public record PendingRelaxation(ServiceModeTriggers triggers, Instant since) {}

    public record ModeDecision(ServiceModeState state, PendingRelaxation pending, boolean transitioned) {}
}
