/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.config;

import com.bocado.infrastructure.crypto.Digests;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Grants ROLE_ADMIN when {@code X-Admin-Api-Key} hashes to the configured SHA-256.
 * Only the hash is configured, so the key itself never sits in configuration.
 */
@Component
public class AdminApiKeyAuthenticationFilter extends OncePerRequestFilter {
    public static final String HEADER = "X-Admin-Api-Key";
    static final String PRINCIPAL = "gateway-admin";

    private static final Logger log = LoggerFactory.getLogger(AdminApiKeyAuthenticationFilter.class);

    private final String expectedHash;

    public AdminApiKeyAuthenticationFilter(GatewayProperties properties) {
        String configured = properties.admin() == null ? null : properties.admin().apiKeySha256();
        this.expectedHash = configured == null || configured.isBlank() ? null : configured.trim().toLowerCase(Locale.ROOT);
        if (expectedHash == null) {
            log.warn("BOCADO_ADMIN_API_KEY_SHA256 not set, admin endpoints are unreachable");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith("/api/admin");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String apiKey = request.getHeader(HEADER);
        if (expectedHash != null && apiKey != null && !apiKey.isBlank()) {
            if (Digests.constantTimeEquals(Digests.sha256Hex(apiKey.trim()), expectedHash)) {
                var auth = new UsernamePasswordAuthenticationToken(
                        PRINCIPAL,
                        null,
                        List.of(new SimpleGrantedAuthority("ROLE_ADMIN"))
                );
                SecurityContextHolder.getContext().setAuthentication(auth);
            } else {
                log.warn("Admin API key rejected path={}", request.getRequestURI());
            }
        }
        filterChain.doFilter(request, response);
    }
}
