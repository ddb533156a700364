/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.domain.model;

/**
 * A media request as carried by the URL. {@code exp} and {@code sig} stay raw until verified.
 */
public record SignedMediaRequest(
        String resourceId,
        String variantRef,
        MediaSize size,
        String exp,
        String sig
) {
    public boolean hasSignature() {
        return exp != null && !exp.isBlank() && sig != null && !sig.isBlank();
    }
}
