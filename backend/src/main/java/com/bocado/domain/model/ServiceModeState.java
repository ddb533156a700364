/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.domain.model;

import java.time.Instant;

public record ServiceModeState(
        ServiceMode currentMode,
        String reason,
        Instant enteredAt,
        ServiceModeTriggers triggers,
        boolean manualOverride,
        Instant updatedAt
) {
    public static final String REASON_NOMINAL = "all_systems_nominal";

    public static ServiceModeState initial(Instant now) {
        return new ServiceModeState(ServiceMode.NOMINAL, REASON_NOMINAL, now, ServiceModeTriggers.allClear(), false, now);
    }

    public boolean refusesOptionalFeatures() {
        return currentMode.isAtLeast(ServiceMode.DEGRADED);
    }
}
