/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.mode;

import com.bocado.domain.model.ServiceMode;
import com.bocado.domain.model.ServiceModeState;
import com.bocado.domain.model.ServiceModeTriggers;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceModePolicyTest {
    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");
    private static final ServiceModeTriggers CLEAR = ServiceModeTriggers.allClear();
    private static final ServiceModeTriggers CIRCUIT_OPEN = new ServiceModeTriggers(true, true, true, false);
    private static final ServiceModeTriggers BUDGET_OUT = new ServiceModeTriggers(true, false, true, true);
    private static final ServiceModeTriggers SLOW = new ServiceModeTriggers(true, true, false, true);

    private final ServiceModePolicy policy = new ServiceModePolicy(Duration.ofSeconds(60));

    @Test
    void mostSevereTriggerWins() {
        assertEquals(ServiceMode.NOMINAL, ServiceModePolicy.resolve(CLEAR).mode());
        assertEquals(ServiceMode.WATCH, ServiceModePolicy.resolve(SLOW).mode());
        assertEquals(ServiceMode.DEGRADED, ServiceModePolicy.resolve(new ServiceModeTriggers(false, true, false, true)).mode());
        assertEquals(ServiceModePolicy.REASON_BUDGET_EXCEEDED,
                ServiceModePolicy.resolve(new ServiceModeTriggers(false, false, false, true)).reason());

        ServiceModePolicy.Resolution all = ServiceModePolicy.resolve(new ServiceModeTriggers(false, false, false, false));
        assertEquals(ServiceMode.OUTAGE, all.mode());
        assertEquals(ServiceModePolicy.REASON_CIRCUIT_OPEN, all.reason());
    }

    @Test
    void escalationIsImmediate() {
        ServiceModeState nominal = ServiceModeState.initial(T0);

        ServiceModePolicy.ModeDecision decision = policy.decide(nominal, null, CIRCUIT_OPEN, T0.plusSeconds(1));

        assertTrue(decision.transitioned());
        assertEquals(ServiceMode.OUTAGE, decision.state().currentMode());
        assertEquals(T0.plusSeconds(1), decision.state().enteredAt());
        assertNull(decision.pending());
    }

    @Test
    void relaxationWaitsForDwell() {
        ServiceModeState outage = policy.decide(ServiceModeState.initial(T0), null, CIRCUIT_OPEN, T0).state();

        ServiceModePolicy.ModeDecision first = policy.decide(outage, null, CLEAR, T0.plusSeconds(10));
        assertFalse(first.transitioned());
        assertEquals(ServiceMode.OUTAGE, first.state().currentMode());
        assertNotNull(first.pending());

        ServiceModePolicy.ModeDecision early = policy.decide(first.state(), first.pending(), CLEAR, T0.plusSeconds(69));
        assertFalse(early.transitioned());

        ServiceModePolicy.ModeDecision done = policy.decide(early.state(), early.pending(), CLEAR, T0.plusSeconds(70));
        assertTrue(done.transitioned());
        assertEquals(ServiceMode.NOMINAL, done.state().currentMode());
        assertEquals(ServiceModeState.REASON_NOMINAL, done.state().reason());
    }

    @Test
    void changedTriggersRestartTheDwell() {
        ServiceModeState outage = policy.decide(ServiceModeState.initial(T0), null, CIRCUIT_OPEN, T0).state();

        ServiceModePolicy.ModeDecision toDegraded = policy.decide(outage, null, BUDGET_OUT, T0.plusSeconds(10));
        ServiceModePolicy.ModeDecision toNominal = policy.decide(toDegraded.state(), toDegraded.pending(), CLEAR, T0.plusSeconds(60));

        assertFalse(toNominal.transitioned());
        assertEquals(T0.plusSeconds(60), toNominal.pending().since());

        ServiceModePolicy.ModeDecision later = policy.decide(toNominal.state(), toNominal.pending(), CLEAR, T0.plusSeconds(119));
        assertFalse(later.transitioned());
        assertTrue(policy.decide(later.state(), later.pending(), CLEAR, T0.plusSeconds(120)).transitioned());
    }

    @Test
    void sameModeKeepsEnteredAtAndRefreshesReason() {
        ServiceModeState watch = policy.decide(ServiceModeState.initial(T0), null, SLOW, T0).state();

        ServiceModePolicy.ModeDecision again = policy.decide(watch, null, SLOW, T0.plusSeconds(30));

        assertFalse(again.transitioned());
        assertEquals(T0, again.state().enteredAt());
        assertEquals(ServiceModePolicy.REASON_ELEVATED_LATENCY, again.state().reason());
    }
}
