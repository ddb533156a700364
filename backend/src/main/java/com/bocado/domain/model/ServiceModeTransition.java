/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.domain.model;

import java.time.Instant;

public record ServiceModeTransition(
        ServiceMode fromMode,
        ServiceMode toMode,
        String reason,
        ServiceModeTriggers triggers,
        boolean manual,
        Instant transitionedAt
) {}
