/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class CorsConfig {
    private final GatewayProperties properties;

    public CorsConfig(GatewayProperties properties) {
        this.properties = properties;
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        String frontendBaseUrl = properties.frontend() == null ? null : properties.frontend().baseUrl();

        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOrigins(resolveAllowedOrigins(frontendBaseUrl));
        config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(List.of("Content-Type", AdminApiKeyAuthenticationFilter.HEADER, RequestIdFilter.HEADER));
        config.setExposedHeaders(List.of(RequestIdFilter.HEADER, "Retry-After"));
        config.setAllowCredentials(false);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }

    static List<String> resolveAllowedOrigins(String frontendBaseUrl) {
        List<String> defaults = List.of("http://localhost:3000", "http://127.0.0.1:3000");
        if (frontendBaseUrl == null || frontendBaseUrl.isBlank()) return defaults;

        URI uri;
        try {
            uri = URI.create(frontendBaseUrl.trim());
        } catch (IllegalArgumentException e) {
            return defaults;
        }
        if (uri.getScheme() == null || uri.getHost() == null) return defaults;

        String portPart = uri.getPort() == -1 ? "" : ":" + uri.getPort();
        List<String> origins = new ArrayList<>();
        origins.add(uri.getScheme() + "://" + uri.getHost() + portPart);
        if ("localhost".equalsIgnoreCase(uri.getHost()) || "127.0.0.1".equals(uri.getHost())) {
            origins.add(uri.getScheme() + "://localhost" + portPart);
            origins.add(uri.getScheme() + "://127.0.0.1" + portPart);
        }
        return origins.stream().distinct().toList();
    }
}
