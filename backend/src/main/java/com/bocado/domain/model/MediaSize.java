/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum MediaSize {
    THUMBNAIL("thumbnail", 100),
    MEDIUM("medium", 400),
    FULL("full", 1000);

    private final String param;
    private final int maxHeightPx;

    MediaSize(String param, int maxHeightPx) {
        this.param = param;
        this.maxHeightPx = maxHeightPx;
    }

    public String param() {
        return param;
    }

    public int maxHeightPx() {
        return maxHeightPx;
    }

    /**
     * Missing parameter means {@link #MEDIUM}; an unknown value yields empty.
     */
    public static Optional<MediaSize> fromParam(String raw) {
        if (raw == null || raw.isBlank()) return Optional.of(MEDIUM);
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (MediaSize size : values()) {
            if (size.param.equals(normalized)) return Optional.of(size);
        }
        return Optional.empty();
    }
}
