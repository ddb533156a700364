/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.api.media;

import com.bocado.application.media.MediaResponse;
import com.bocado.application.media.PhotoProxyHandler;
import com.bocado.config.GatewayProperties;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class MediaProxyController {
    private final PhotoProxyHandler photoProxyHandler;
    private final CacheControl cacheControl;

    public MediaProxyController(PhotoProxyHandler photoProxyHandler, GatewayProperties properties) {
        this.photoProxyHandler = photoProxyHandler;
        GatewayProperties.Media.Cache cache = properties.media().cache();
        this.cacheControl = CacheControl.maxAge(cache.browserMaxAge())
                .cachePublic()
                .sMaxAge(cache.cdnMaxAge())
                .staleWhileRevalidate(cache.staleWhileRevalidate());
    }

    @GetMapping("/media/{resourceId}/{variantRef}")
    public Mono<ResponseEntity<byte[]>> media(
            @PathVariable("resourceId") String resourceId,
            @PathVariable("variantRef") String variantRef,
            @RequestParam(value = "size", required = false) String size,
            @RequestParam(value = "exp", required = false) String exp,
            @RequestParam(value = "sig", required = false) String sig
    ) {
        return photoProxyHandler.handle(resourceId, variantRef, size, exp, sig).map(this::toResponse);
    }

    private ResponseEntity<byte[]> toResponse(MediaResponse media) {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(media.contentType()))
                .cacheControl(cacheControl)
                .header("X-Content-Type-Options", "nosniff")
                .header("X-Robots-Tag", "noindex")
                .body(media.body());
    }
}
