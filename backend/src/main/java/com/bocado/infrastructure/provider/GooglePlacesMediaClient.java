/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.provider;

import com.bocado.config.GatewayProperties;
import com.bocado.domain.model.EndpointClass;
import com.bocado.domain.model.MediaSize;
import com.bocado.infrastructure.redaction.TreeRedactor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.codec.CodecException;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Places API (New) photo media: {@code GET /v1/places/{place}/photos/{photo}/media} with
 * {@code skipHttpRedirect=true} answers with a JSON {@code photoUri} pointing at the CDN.
 * The API key travels in a header and never leaves this class.
 */
@Service
public class GooglePlacesMediaClient implements PlaceMediaClient {
    private static final Logger log = LoggerFactory.getLogger(GooglePlacesMediaClient.class);
    private static final String MEDIA_PATH = "/v1/places/{placeId}/photos/{photoRef}/media";
    private static final String API_KEY_HEADER = "X-Goog-Api-Key";

    private final WebClient placesWebClient;
    private final WebClient mediaFetchWebClient;
    private final TreeRedactor redactor;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public GooglePlacesMediaClient(
            GatewayProperties properties,
            @Qualifier("placesWebClient") WebClient placesWebClient,
            @Qualifier("mediaFetchWebClient") WebClient mediaFetchWebClient,
            TreeRedactor redactor,
            ObjectMapper objectMapper
    ) {
        String key = properties.provider() == null ? null : properties.provider().apiKey();
        if (key == null || key.isBlank()) {
            throw new IllegalStateException("Missing BOCADO_PROVIDER_API_KEY");
        }
        this.apiKey = key.trim();
        this.placesWebClient = placesWebClient;
        this.mediaFetchWebClient = mediaFetchWebClient;
        this.redactor = redactor;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ResolvedMedia> resolve(String resourceId, String variantRef, MediaSize size) {
        return placesWebClient.get()
                .uri(uri -> uri.path(MEDIA_PATH)
                        .queryParam("maxHeightPx", size.maxHeightPx())
                        .queryParam("skipHttpRedirect", true)
                        .build(resourceId, variantRef))
                .header(API_KEY_HEADER, apiKey)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(PhotoMediaResponse.class)
                .onErrorMap(WebClientResponseException.class, this::mapResolveError)
                .onErrorMap(WebClientRequestException.class, e -> transportError("resolve", e))
                .onErrorMap(CodecException.class, e -> new ProviderException(
                        EndpointClass.PHOTOS, ProviderErrorType.INVALID_RESPONSE, "Provider response unreadable", e))
                .flatMap(GooglePlacesMediaClient::toResolvedMedia)
                .switchIfEmpty(Mono.error(() -> invalidResponse("Provider response empty")));
    }

    @Override
    public Mono<MediaPayload> fetch(URI binaryUri) {
        return mediaFetchWebClient.get()
                .uri(binaryUri)
                .accept(MediaType.ALL)
                .retrieve()
                .toEntity(byte[].class)
                .map(entity -> new MediaPayload(
                        entity.getHeaders().getContentType() == null ? null : entity.getHeaders().getContentType().toString(),
                        entity.getBody() == null ? new byte[0] : entity.getBody()))
                .onErrorMap(WebClientResponseException.class, this::mapFetchError)
                .onErrorMap(DataBufferLimitException.class, e -> new ProviderException(
                        EndpointClass.PHOTOS, ProviderErrorType.PAYLOAD_TOO_LARGE, "Media payload too large", e))
                .onErrorMap(WebClientRequestException.class, e -> transportError("fetch", e));
    }

    private static Mono<ResolvedMedia> toResolvedMedia(PhotoMediaResponse response) {
        if (response.photoUri == null || response.photoUri.isBlank()) {
            return Mono.error(invalidResponse("Provider response missing photoUri"));
        }
        try {
            URI uri = URI.create(response.photoUri.trim());
            if (!uri.isAbsolute()) return Mono.error(invalidResponse("Provider photoUri not absolute"));
            return Mono.just(new ResolvedMedia(uri));
        } catch (IllegalArgumentException e) {
            return Mono.error(invalidResponse("Provider photoUri malformed"));
        }
    }

    private ProviderException mapResolveError(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        ProviderErrorType type;
        if (status == 404) type = ProviderErrorType.NOT_FOUND;
        else if (status == 429) type = ProviderErrorType.RATE_LIMITED;
        else if (status == 408 || status == 504) type = ProviderErrorType.TIMEOUT;
        else if (status >= 500) type = ProviderErrorType.HTTP_5XX;
        else type = ProviderErrorType.HTTP_4XX;

        log.warn("Places media resolve error type={} status={}", type, status);
        if (log.isDebugEnabled()) {
            log.debug("Places media resolve error body={}", redactedBody(e.getResponseBodyAsString()));
        }
        Long retryAfter = type == ProviderErrorType.RATE_LIMITED ? parseRetryAfter(e.getHeaders()) : null;
        return new ProviderException(EndpointClass.PHOTOS, type, status, retryAfter, "Provider request failed", null);
    }

    private ProviderException mapFetchError(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        ProviderErrorType type = status >= 500 ? ProviderErrorType.HTTP_5XX : ProviderErrorType.HTTP_4XX;
        log.warn("Media fetch error type={} status={}", type, status);
        return new ProviderException(EndpointClass.PHOTOS, type, status, "Media fetch failed");
    }

    private ProviderException transportError(String hop, WebClientRequestException e) {
        Throwable cause = e.getMostSpecificCause();
        ProviderErrorType type = cause instanceof TimeoutException || cause instanceof ConnectTimeoutException
                ? ProviderErrorType.TIMEOUT
                : ProviderErrorType.CONNECTION;
        log.warn("Places media transport error hop={} type={} cause={}", hop, type, cause.getClass().getSimpleName());
        return new ProviderException(EndpointClass.PHOTOS, type, "Provider request failed", e);
    }

    private String redactedBody(String body) {
        if (body == null || body.isBlank()) return "";
        try {
            JsonNode tree = objectMapper.readTree(body);
            return objectMapper.writeValueAsString(redactor.redact(tree));
        } catch (JsonProcessingException e) {
            return "<non-json length=" + body.length() + ">";
        }
    }

    static Long parseRetryAfter(HttpHeaders headers) {
        String value = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) return null;
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds > 0 ? seconds : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static ProviderException invalidResponse(String message) {
        return new ProviderException(EndpointClass.PHOTOS, ProviderErrorType.INVALID_RESPONSE, null, message);
    }

    private static final class PhotoMediaResponse {
        public String name;
        public String photoUri;
    }
}
