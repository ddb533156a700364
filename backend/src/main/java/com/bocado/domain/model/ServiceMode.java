/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.domain.model;

/**
 * Operating mode of the gateway, ordered from least to most severe.
 */
public enum ServiceMode {
    NOMINAL(0),
    WATCH(1),
    DEGRADED(2),
    OUTAGE(3);

    private final int severity;

    ServiceMode(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }

    public boolean isAtLeast(ServiceMode other) {
        return severity >= other.severity;
    }

    public boolean isMoreSevereThan(ServiceMode other) {
        return severity > other.severity;
    }
}
