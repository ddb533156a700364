/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.flags;

import java.util.List;

public final class FeatureKeys {
    private FeatureKeys() {}

    public static final String PHOTOS_ENABLED = "photos_enabled";
    public static final String OPEN_NOW_ENABLED = "open_now_enabled";
    public static final String PROVIDER_SEARCH_ENABLED = "provider_search_enabled";
    public static final String AUTOCOMPLETE_ENABLED = "autocomplete_enabled";
    public static final String MAP_SEARCH_ENABLED = "map_search_enabled";

    public static final List<String> DEFAULTS = List.of(
            PHOTOS_ENABLED,
            OPEN_NOW_ENABLED,
            PROVIDER_SEARCH_ENABLED,
            AUTOCOMPLETE_ENABLED,
            MAP_SEARCH_ENABLED
    );
}
