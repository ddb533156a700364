/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.api.admin;

import com.bocado.api.ApiException;
import com.bocado.config.GatewayProperties;
import com.bocado.domain.model.MediaSize;
import com.bocado.infrastructure.crypto.SignedUrlCodec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * Issues signed media paths for server-side renderers that embed photos.
 */
@RestController
@RequestMapping("/api/admin/media")
public class AdminMediaController {
    private static final String IDENTIFIER = "[A-Za-z0-9_-]{1,512}";
    private static final Duration MAX_TTL = Duration.ofDays(7);

    private final SignedUrlCodec signedUrlCodec;
    private final Duration defaultTtl;

    public AdminMediaController(SignedUrlCodec signedUrlCodec, GatewayProperties properties) {
        this.signedUrlCodec = signedUrlCodec;
        this.defaultTtl = properties.media().urlTtl();
    }

    @PostMapping("/sign")
    public SignedUrlCodec.SignedUrl sign(@Valid @RequestBody SignRequest request) {
        MediaSize size = MediaSize.fromParam(request.size())
                .orElseThrow(() -> ApiException.validation("Invalid size parameter"));
        Duration ttl = request.ttlSeconds() == null ? defaultTtl : Duration.ofSeconds(request.ttlSeconds());
        if (ttl.compareTo(MAX_TTL) > 0) {
            throw ApiException.validation("ttlSeconds too large");
        }
        return signedUrlCodec.signedPath(request.resourceId(), request.variantRef(), size, ttl);
    }

    public record SignRequest(
            @NotBlank @Pattern(regexp = IDENTIFIER) String resourceId,
            @NotBlank @Pattern(regexp = IDENTIFIER) String variantRef,
            String size,
            @Positive Long ttlSeconds
    ) {}
}
