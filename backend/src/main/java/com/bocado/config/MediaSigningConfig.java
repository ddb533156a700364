/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.config;

import com.bocado.infrastructure.crypto.SignedUrlCodec;
import com.bocado.infrastructure.redaction.TreeRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MediaSigningConfig {
    private static final Logger log = LoggerFactory.getLogger(MediaSigningConfig.class);

    @Bean
    public SignedUrlCodec signedUrlCodec(GatewayProperties properties, GatewayEnvironment environment, Clock clock) {
        GatewayProperties.Media media = properties.media();
        String secret = media == null ? null : media.signingSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("Missing BOCADO_MEDIA_SIGNING_SECRET");
        }
        if (!environment.enforcesSignatures()) {
            log.warn("Media URL signatures are NOT enforced env={}", environment.name());
        }
        return new SignedUrlCodec(secret.trim(), media.previousSigningSecrets(), clock);
    }

    @Bean
    public TreeRedactor providerContentRedactor() {
        return TreeRedactor.providerContent();
    }
}
