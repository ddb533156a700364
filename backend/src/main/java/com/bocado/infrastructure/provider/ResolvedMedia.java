/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.provider;

import java.net.URI;

/**
 * Short-lived binary location returned by the provider. Never logged or returned to clients.
 */
public record ResolvedMedia(URI binaryUri) {}
