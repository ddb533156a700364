/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.crypto;

public enum SignatureCheck {
    VALID,
    EXPIRED,
    INVALID
}
