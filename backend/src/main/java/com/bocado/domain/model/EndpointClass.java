/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.domain.model;

import java.util.Locale;

/**
 * Provider endpoint families. Breakers and budgets are kept per class.
 */
public enum EndpointClass {
    PHOTOS("photos"),
    PLACE_DETAILS("place_details"),
    TEXT_SEARCH("text_search"),
    NEARBY_SEARCH("nearby_search"),
    AUTOCOMPLETE("autocomplete"),
    HEALTH("health");

    private final String key;

    EndpointClass(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static EndpointClass fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Endpoint class is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (EndpointClass value : values()) {
            if (value.key.equals(normalized)) return value;
        }
        throw new IllegalArgumentException("Unknown endpoint class: " + raw);
    }
}
