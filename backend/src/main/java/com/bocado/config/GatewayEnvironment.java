/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.config;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Runtime environment name. Signed media URLs are only enforced in production-like environments.
 */
@Component
public class GatewayEnvironment {
    private static final Set<String> ENFORCING = Set.of("production", "prod", "staging");
    private static final String DEFAULT_ENV = "development";

    private final String name;

    public GatewayEnvironment(Environment env) {
        String configured = firstNonBlank(env.getProperty("BOCADO_ENV"), env.getProperty("bocado.environment"));
        this.name = configured.isEmpty() ? DEFAULT_ENV : configured.toLowerCase(Locale.ROOT);
    }

    public String name() {
        return name;
    }

    public boolean enforcesSignatures() {
        return ENFORCING.contains(name);
    }

    private static String firstNonBlank(String primary, String fallback) {
        if (primary != null && !primary.isBlank()) return primary.trim();
        if (fallback != null && !fallback.isBlank()) return fallback.trim();
        return "";
    }
}
