/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.mode;

import com.bocado.application.flags.FeatureKeys;
import com.bocado.domain.model.ServiceMode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flag values each mode imposes when it is entered.
 */
public final class ServiceModeFeatureProfile {
    private static final String REASON_PREFIX = "service_mode_";

    private ServiceModeFeatureProfile() {}

    public static Map<String, Boolean> forMode(ServiceMode mode) {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (String key : FeatureKeys.DEFAULTS) {
            flags.put(key, true);
        }
        switch (mode) {
            case NOMINAL -> {
            }
            case WATCH -> flags.put(FeatureKeys.OPEN_NOW_ENABLED, false);
            case DEGRADED -> {
                flags.put(FeatureKeys.PHOTOS_ENABLED, false);
                flags.put(FeatureKeys.OPEN_NOW_ENABLED, false);
            }
            case OUTAGE -> flags.replaceAll((key, enabled) -> false);
        }
        return flags;
    }

    public static String reason(ServiceMode mode, String modeReason) {
        return REASON_PREFIX + mode.name() + "_" + modeReason;
    }

    /**
     * Whether a flag reason was written by a mode profile rather than by an operator.
     */
    public static boolean isProfileReason(String flagReason) {
        return flagReason != null && flagReason.startsWith(REASON_PREFIX);
    }
}
