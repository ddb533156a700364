/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.domain.model;

public enum CircuitStatus {
    CLOSED,
    OPEN,
    HALF_OPEN
}
