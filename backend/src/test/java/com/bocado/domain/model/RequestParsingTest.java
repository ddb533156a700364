/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RequestParsingTest {
    @Test
    void mediaSizeDefaultsToMedium() {
        assertEquals(Optional.of(MediaSize.MEDIUM), MediaSize.fromParam(null));
        assertEquals(Optional.of(MediaSize.MEDIUM), MediaSize.fromParam(" "));
        assertEquals(Optional.of(MediaSize.FULL), MediaSize.fromParam("FULL"));
        assertEquals(Optional.empty(), MediaSize.fromParam("huge"));
        assertEquals(100, MediaSize.THUMBNAIL.maxHeightPx());
    }

    @Test
    void endpointClassAcceptsBothSeparators() {
        assertEquals(EndpointClass.PLACE_DETAILS, EndpointClass.fromKey("place_details"));
        assertEquals(EndpointClass.PLACE_DETAILS, EndpointClass.fromKey("place-details"));
        assertThrows(IllegalArgumentException.class, () -> EndpointClass.fromKey("weather"));
    }

    @Test
    void triggerMaskRoundTripsEverySet() {
        for (int mask = 0; mask < 16; mask++) {
            assertEquals(mask, ServiceModeTriggers.fromMask(mask).toMask());
        }
    }
}
