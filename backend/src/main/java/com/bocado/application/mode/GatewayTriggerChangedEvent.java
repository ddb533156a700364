/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.mode;

/**
 * Published after a committed change that can move a service-mode trigger.
 */
public record GatewayTriggerChangedEvent(String source, String detail) {}
