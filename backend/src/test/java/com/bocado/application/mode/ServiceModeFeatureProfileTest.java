/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.mode;

import com.bocado.application.flags.FeatureKeys;
import com.bocado.domain.model.ServiceMode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceModeFeatureProfileTest {
    @Test
    void profilesTightenWithSeverity() {
        assertTrue(ServiceModeFeatureProfile.forMode(ServiceMode.NOMINAL).values().stream().allMatch(Boolean::booleanValue));

        Map<String, Boolean> watch = ServiceModeFeatureProfile.forMode(ServiceMode.WATCH);
        assertFalse(watch.get(FeatureKeys.OPEN_NOW_ENABLED));
        assertTrue(watch.get(FeatureKeys.PHOTOS_ENABLED));

        Map<String, Boolean> degraded = ServiceModeFeatureProfile.forMode(ServiceMode.DEGRADED);
        assertFalse(degraded.get(FeatureKeys.PHOTOS_ENABLED));
        assertFalse(degraded.get(FeatureKeys.OPEN_NOW_ENABLED));
        assertTrue(degraded.get(FeatureKeys.AUTOCOMPLETE_ENABLED));

        assertTrue(ServiceModeFeatureProfile.forMode(ServiceMode.OUTAGE).values().stream().noneMatch(Boolean::booleanValue));
        assertEquals(FeatureKeys.DEFAULTS.size(), ServiceModeFeatureProfile.forMode(ServiceMode.OUTAGE).size());
    }

    @Test
    void reasonNamesModeAndCause() {
        assertEquals("service_mode_DEGRADED_budget_exceeded",
                ServiceModeFeatureProfile.reason(ServiceMode.DEGRADED, "budget_exceeded"));
    }

    @Test
    void profileReasonsAreDistinguishedFromOperatorReasons() {
        assertTrue(ServiceModeFeatureProfile.isProfileReason(
                ServiceModeFeatureProfile.reason(ServiceMode.OUTAGE, "circuit_open")));
        assertFalse(ServiceModeFeatureProfile.isProfileReason("budget_exceeded"));
        assertFalse(ServiceModeFeatureProfile.isProfileReason(null));
    }
}
