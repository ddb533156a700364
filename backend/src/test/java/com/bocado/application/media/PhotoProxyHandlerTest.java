/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.media;

import com.bocado.api.ApiException;
import com.bocado.application.ProviderCallRecorder;
import com.bocado.application.budget.BudgetTracker;
import com.bocado.application.circuit.CircuitBreakerService;
import com.bocado.application.flags.FeatureFlagService;
import com.bocado.application.flags.FeatureKeys;
import com.bocado.application.mode.ServiceModeFeatureProfile;
import com.bocado.application.mode.ServiceModeService;
import com.bocado.config.GatewayEnvironment;
import com.bocado.domain.model.EndpointClass;
import com.bocado.domain.model.FeatureFlag;
import com.bocado.domain.model.MediaSize;
import com.bocado.domain.model.ServiceMode;
import com.bocado.domain.model.ServiceModeState;
import com.bocado.domain.model.ServiceModeTriggers;
import com.bocado.infrastructure.crypto.SignedUrlCodec;
import com.bocado.infrastructure.provider.MediaPayload;
import com.bocado.infrastructure.provider.PlaceMediaClient;
import com.bocado.infrastructure.provider.ProviderErrorType;
import com.bocado.infrastructure.provider.ProviderException;
import com.bocado.infrastructure.provider.ResolvedMedia;
import com.bocado.support.GatewayFixtures;
import com.bocado.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.mock.env.MockEnvironment;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PhotoProxyHandlerTest {
    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final URI BINARY = URI.create("https://cdn.test/photo.jpg");

    @Mock
    private FeatureFlagService featureFlagService;

    @Mock
    private ServiceModeService serviceModeService;

    @Mock
    private BudgetTracker budgetTracker;

    @Mock
    private CircuitBreakerService circuitBreakerService;

    @Mock
    private PlaceMediaClient placeMediaClient;

    @Mock
    private ProviderCallRecorder providerCallRecorder;

    private SignedUrlCodec codec;
    private PhotoProxyHandler handler;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        codec = new SignedUrlCodec(GatewayFixtures.SIGNING_SECRET, List.of(), clock);
        GatewayEnvironment production = new GatewayEnvironment(new MockEnvironment().withProperty("bocado.environment", "production"));
        handler = new PhotoProxyHandler(
                production,
                codec,
                featureFlagService,
                serviceModeService,
                budgetTracker,
                circuitBreakerService,
                placeMediaClient,
                providerCallRecorder,
                GatewayFixtures.properties()
        );

        lenient().when(featureFlagService.find(FeatureKeys.PHOTOS_ENABLED)).thenReturn(Optional.empty());
        lenient().when(serviceModeService.current()).thenReturn(ServiceModeState.initial(NOW));
        lenient().when(budgetTracker.isOk(EndpointClass.PHOTOS)).thenReturn(true);
        lenient().when(circuitBreakerService.tryAcquire(EndpointClass.PHOTOS)).thenReturn(true);
    }

    @Test
    void servesPhotoAndRecordsSpend() {
        byte[] body = {1, 2, 3};
        when(placeMediaClient.resolve("place1", "photo1", MediaSize.THUMBNAIL)).thenReturn(Mono.just(new ResolvedMedia(BINARY)));
        when(placeMediaClient.fetch(BINARY)).thenReturn(Mono.just(new MediaPayload("image/png", body)));

        StepVerifier.create(signedRequest(MediaSize.THUMBNAIL))
                .assertNext(response -> {
                    assertEquals("image/png", response.contentType());
                    assertArrayEquals(body, response.body());
                })
                .verifyComplete();

        verify(providerCallRecorder).recordSuccess(eq(EndpointClass.PHOTOS), anyLong(), eq(7L));
    }

    @Test
    void missingContentTypeDefaultsToJpeg() {
        when(placeMediaClient.resolve(any(), any(), any())).thenReturn(Mono.just(new ResolvedMedia(BINARY)));
        when(placeMediaClient.fetch(BINARY)).thenReturn(Mono.just(new MediaPayload(null, new byte[]{9})));

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .assertNext(response -> assertEquals("image/jpeg", response.contentType()))
                .verifyComplete();
    }

    @Test
    void invalidSizeIsRejectedBeforeAnythingElse() {
        StepVerifier.create(handler.handle("place1", "photo1", "huge", null, null))
                .verifyErrorSatisfies(apiError(HttpStatus.BAD_REQUEST, ApiException.VALIDATION_ERROR, null));

        verifyNoInteractions(featureFlagService, placeMediaClient);
    }

    @Test
    void invalidIdentifierIsRejected() {
        StepVerifier.create(handler.handle("../etc", "photo1", "medium", null, null))
                .verifyErrorSatisfies(apiError(HttpStatus.BAD_REQUEST, ApiException.VALIDATION_ERROR, null));
    }

    @Test
    void missingSignatureIsForbidden() {
        StepVerifier.create(handler.handle("place1", "photo1", "medium", null, null))
                .verifyErrorSatisfies(apiError(HttpStatus.FORBIDDEN, ApiException.AUTH_ERROR, "missing_signature"));

        verifyNoInteractions(placeMediaClient);
    }

    @Test
    void expiredSignatureIsForbidden() {
        long exp = NOW.minusSeconds(1).getEpochSecond();
        String sig = codec.sign("place1", "photo1", MediaSize.MEDIUM, exp);

        StepVerifier.create(handler.handle("place1", "photo1", "medium", Long.toString(exp), sig))
                .verifyErrorSatisfies(apiError(HttpStatus.FORBIDDEN, ApiException.AUTH_ERROR, "expired"));
    }

    @Test
    void signatureForAnotherSizeIsInvalid() {
        long exp = NOW.plusSeconds(60).getEpochSecond();
        String sig = codec.sign("place1", "photo1", MediaSize.THUMBNAIL, exp);

        StepVerifier.create(handler.handle("place1", "photo1", "full", Long.toString(exp), sig))
                .verifyErrorSatisfies(apiError(HttpStatus.FORBIDDEN, ApiException.AUTH_ERROR, "invalid_signature"));
    }

    @Test
    void disabledFlagRefusesWithItsReason() {
        when(featureFlagService.find(FeatureKeys.PHOTOS_ENABLED))
                .thenReturn(Optional.of(new FeatureFlag(FeatureKeys.PHOTOS_ENABLED, false, "maintenance", NOW)));

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(e -> {
                    apiError(HttpStatus.SERVICE_UNAVAILABLE, ApiException.FEATURE_DISABLED, "maintenance").accept(e);
                    assertEquals(PhotoProxyHandler.FEATURE_DISABLED_RETRY_AFTER, ((ApiException) e).getRetryAfterSeconds());
                });

        verifyNoInteractions(placeMediaClient);
    }

    @Test
    void flagLookupFailureFailsOpen() {
        when(featureFlagService.find(FeatureKeys.PHOTOS_ENABLED)).thenThrow(new DataAccessResourceFailureException("db down"));
        when(placeMediaClient.resolve(any(), any(), any())).thenReturn(Mono.just(new ResolvedMedia(BINARY)));
        when(placeMediaClient.fetch(BINARY)).thenReturn(Mono.just(new MediaPayload("image/jpeg", new byte[]{1})));

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void degradedModeRefuses() {
        ServiceModeState degraded = new ServiceModeState(ServiceMode.DEGRADED, "budget_exceeded", NOW,
                new ServiceModeTriggers(true, false, true, true), false, NOW);
        when(serviceModeService.current()).thenReturn(degraded);

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(apiError(HttpStatus.SERVICE_UNAVAILABLE, ApiException.SERVICE_DEGRADED, "budget_exceeded"));

        verifyNoInteractions(placeMediaClient);
    }

    @Test
    void exhaustedBudgetRefusesUntilReset() {
        when(budgetTracker.isOk(EndpointClass.PHOTOS)).thenReturn(false);
        when(budgetTracker.secondsUntilReset(EndpointClass.PHOTOS)).thenReturn(3600L);

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(e -> {
                    apiError(HttpStatus.SERVICE_UNAVAILABLE, ApiException.SERVICE_UNAVAILABLE, "budget_exceeded").accept(e);
                    assertEquals(3600L, ((ApiException) e).getRetryAfterSeconds());
                });

        verify(circuitBreakerService, never()).tryAcquire(any());
        verifyNoInteractions(placeMediaClient);
    }

    @Test
    void openCircuitRefuses() {
        when(circuitBreakerService.tryAcquire(EndpointClass.PHOTOS)).thenReturn(false);
        when(circuitBreakerService.secondsUntilProbe(EndpointClass.PHOTOS)).thenReturn(25L);

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(apiError(HttpStatus.SERVICE_UNAVAILABLE, ApiException.SERVICE_UNAVAILABLE, "circuit_open"));

        verifyNoInteractions(placeMediaClient);
    }

    @Test
    void unreachableStateStoreFailsClosed() {
        when(budgetTracker.isOk(EndpointClass.PHOTOS)).thenThrow(new DataAccessResourceFailureException("db down"));

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(apiError(HttpStatus.SERVICE_UNAVAILABLE, ApiException.SERVICE_UNAVAILABLE, "gateway_state_unavailable"));

        verifyNoInteractions(placeMediaClient);
    }

    @Test
    void dueTrialCallPassesRefusalsRaisedByTheOutageMode() {
        String outageReason = ServiceModeFeatureProfile.reason(ServiceMode.OUTAGE, "circuit_open");
        when(featureFlagService.find(FeatureKeys.PHOTOS_ENABLED))
                .thenReturn(Optional.of(new FeatureFlag(FeatureKeys.PHOTOS_ENABLED, false, outageReason, NOW)));
        when(serviceModeService.current()).thenReturn(outage(false));
        when(circuitBreakerService.probeDue(EndpointClass.PHOTOS)).thenReturn(true);
        when(placeMediaClient.resolve(any(), any(), any())).thenReturn(Mono.just(new ResolvedMedia(BINARY)));
        when(placeMediaClient.fetch(BINARY)).thenReturn(Mono.just(new MediaPayload("image/jpeg", new byte[]{1})));

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .expectNextCount(1)
                .verifyComplete();

        verify(circuitBreakerService).tryAcquire(EndpointClass.PHOTOS);
        verify(providerCallRecorder).recordSuccess(eq(EndpointClass.PHOTOS), anyLong(), eq(7L));
    }

    @Test
    void dueTrialCallStillHonoursOperatorDisabledFlag() {
        when(featureFlagService.find(FeatureKeys.PHOTOS_ENABLED))
                .thenReturn(Optional.of(new FeatureFlag(FeatureKeys.PHOTOS_ENABLED, false, "maintenance", NOW)));
        when(circuitBreakerService.probeDue(EndpointClass.PHOTOS)).thenReturn(true);

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(apiError(HttpStatus.SERVICE_UNAVAILABLE, ApiException.FEATURE_DISABLED, "maintenance"));

        verify(circuitBreakerService, never()).tryAcquire(any());
        verifyNoInteractions(placeMediaClient);
    }

    @Test
    void dueTrialCallStillHonoursModeOverride() {
        when(serviceModeService.current()).thenReturn(outage(true));
        when(circuitBreakerService.probeDue(EndpointClass.PHOTOS)).thenReturn(true);

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(apiError(HttpStatus.SERVICE_UNAVAILABLE, ApiException.SERVICE_DEGRADED, "circuit_open"));

        verify(circuitBreakerService, never()).tryAcquire(any());
        verifyNoInteractions(placeMediaClient);
    }

    @Test
    void resolveDeadlineAbortsBeforeFetch() {
        when(placeMediaClient.resolve(any(), any(), any())).thenReturn(Mono.never());

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(apiError(HttpStatus.GATEWAY_TIMEOUT, ApiException.TIMEOUT, "resolve_timeout"));

        verify(placeMediaClient, never()).fetch(any());
        verify(providerCallRecorder).recordFailure(eq(EndpointClass.PHOTOS), any(TimeoutException.class), anyLong());
    }

    @Test
    void fetchDeadlineMapsToTimeout() {
        when(placeMediaClient.resolve(any(), any(), any())).thenReturn(Mono.just(new ResolvedMedia(BINARY)));
        when(placeMediaClient.fetch(BINARY)).thenReturn(Mono.never());

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(apiError(HttpStatus.GATEWAY_TIMEOUT, ApiException.TIMEOUT, "fetch_timeout"));
    }

    @Test
    void upstreamNotFoundIsNotFound() {
        when(placeMediaClient.resolve(any(), any(), any())).thenReturn(Mono.error(
                new ProviderException(EndpointClass.PHOTOS, ProviderErrorType.NOT_FOUND, 404, "not found")));

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(apiError(HttpStatus.NOT_FOUND, ApiException.NOT_FOUND, null));
    }

    @Test
    void upstreamRateLimitPassesRetryAfter() {
        when(placeMediaClient.resolve(any(), any(), any())).thenReturn(Mono.error(
                new ProviderException(EndpointClass.PHOTOS, ProviderErrorType.RATE_LIMITED, 429, 12L, "limited", null)));

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(e -> {
                    apiError(HttpStatus.SERVICE_UNAVAILABLE, ApiException.UPSTREAM_RATE_LIMITED, "upstream_rate_limited").accept(e);
                    assertEquals(12L, ((ApiException) e).getRetryAfterSeconds());
                });
    }

    @Test
    void upstreamServerErrorIsBadGateway() {
        when(placeMediaClient.resolve(any(), any(), any())).thenReturn(Mono.error(
                new ProviderException(EndpointClass.PHOTOS, ProviderErrorType.HTTP_5XX, 503, "unavailable")));

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(apiError(HttpStatus.BAD_GATEWAY, ApiException.UPSTREAM_ERROR, "resolve_failed"));
    }

    @Test
    void fetchFailureIsBadGateway() {
        when(placeMediaClient.resolve(any(), any(), any())).thenReturn(Mono.just(new ResolvedMedia(BINARY)));
        when(placeMediaClient.fetch(BINARY)).thenReturn(Mono.error(
                new ProviderException(EndpointClass.PHOTOS, ProviderErrorType.PAYLOAD_TOO_LARGE, null, "too large")));

        StepVerifier.create(signedRequest(MediaSize.MEDIUM))
                .verifyErrorSatisfies(apiError(HttpStatus.BAD_GATEWAY, ApiException.UPSTREAM_ERROR, "fetch_failed"));
    }

    private static ServiceModeState outage(boolean manualOverride) {
        return new ServiceModeState(ServiceMode.OUTAGE, "circuit_open", NOW,
                new ServiceModeTriggers(true, true, true, false), manualOverride, NOW);
    }

    private Mono<MediaResponse> signedRequest(MediaSize size) {
        SignedUrlCodec.SignedUrl url = codec.signedPath("place1", "photo1", size, Duration.ofHours(1));
        return handler.handle("place1", "photo1", size.param(), Long.toString(url.exp()), url.sig());
    }

    private static Consumer<Throwable> apiError(HttpStatus status, String code, String reason) {
        return e -> {
            ApiException api = assertInstanceOf(ApiException.class, e);
            assertEquals(status, api.getStatus());
            assertEquals(code, api.getCode());
            assertEquals(reason, api.getReason());
        };
    }
}
