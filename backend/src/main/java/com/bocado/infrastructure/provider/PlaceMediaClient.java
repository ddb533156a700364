/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.provider;

import com.bocado.domain.model.MediaSize;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Two-hop media access: resolve a reference against the provider API, then fetch the binary from
 * wherever it points. Failures are signalled as {@link ProviderException}.
 */
public interface PlaceMediaClient {
    Mono<ResolvedMedia> resolve(String resourceId, String variantRef, MediaSize size);

    Mono<MediaPayload> fetch(URI binaryUri);
}
