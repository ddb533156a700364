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
import com.bocado.config.GatewayProperties;
import com.bocado.config.RequestIdFilter;
import com.bocado.domain.model.EndpointClass;
import com.bocado.domain.model.FeatureFlag;
import com.bocado.domain.model.MediaSize;
import com.bocado.domain.model.ServiceModeState;
import com.bocado.domain.model.SignedMediaRequest;
import com.bocado.infrastructure.crypto.SignatureCheck;
import com.bocado.infrastructure.crypto.SignedUrlCodec;
import com.bocado.infrastructure.provider.MediaPayload;
import com.bocado.infrastructure.provider.PlaceMediaClient;
import com.bocado.infrastructure.provider.ProviderErrorType;
import com.bocado.infrastructure.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Serves provider photos without exposing the provider credential.
 * <p>
 * Admission runs in order and stops at the first refusal: request shape, URL signature, the
 * {@code photos_enabled} flag, the service mode, the photos budget and the breaker. Then the
 * reference is resolved against the provider and the binary fetched, each under its own deadline.
 * The flag check fails open; budget and breaker checks fail closed. Once the breaker's probe is
 * due, refusals the service mode raised automatically no longer apply to the next request.
 */
@Service
public class PhotoProxyHandler {
    private static final Logger log = LoggerFactory.getLogger(PhotoProxyHandler.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_-]{1,512}");
    private static final EndpointClass ENDPOINT = EndpointClass.PHOTOS;

    static final long FEATURE_DISABLED_RETRY_AFTER = 300;
    static final long DEGRADED_RETRY_AFTER = 60;
    static final long RATE_LIMITED_RETRY_AFTER = 60;
    static final long STATE_UNAVAILABLE_RETRY_AFTER = 30;
    static final String DEFAULT_CONTENT_TYPE = MediaType.IMAGE_JPEG_VALUE;

    private final GatewayEnvironment environment;
    private final SignedUrlCodec signedUrlCodec;
    private final FeatureFlagService featureFlagService;
    private final ServiceModeService serviceModeService;
    private final BudgetTracker budgetTracker;
    private final CircuitBreakerService circuitBreakerService;
    private final PlaceMediaClient placeMediaClient;
    private final ProviderCallRecorder providerCallRecorder;
    private final GatewayProperties.Media media;

    public PhotoProxyHandler(
            GatewayEnvironment environment,
            SignedUrlCodec signedUrlCodec,
            FeatureFlagService featureFlagService,
            ServiceModeService serviceModeService,
            BudgetTracker budgetTracker,
            CircuitBreakerService circuitBreakerService,
            PlaceMediaClient placeMediaClient,
            ProviderCallRecorder providerCallRecorder,
            GatewayProperties properties
    ) {
        this.environment = environment;
        this.signedUrlCodec = signedUrlCodec;
        this.featureFlagService = featureFlagService;
        this.serviceModeService = serviceModeService;
        this.budgetTracker = budgetTracker;
        this.circuitBreakerService = circuitBreakerService;
        this.placeMediaClient = placeMediaClient;
        this.providerCallRecorder = providerCallRecorder;
        this.media = properties.media();
    }

    public Mono<MediaResponse> handle(String resourceId, String variantRef, String size, String exp, String sig) {
        String requestId = MDC.get(RequestIdFilter.MDC_KEY);
        String sizeLabel = MediaSize.fromParam(size).map(MediaSize::param).orElse("invalid");
        long started = System.nanoTime();

        return Mono.fromCallable(() -> admit(resourceId, variantRef, size, exp, sig))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(this::proxy)
                .doOnSuccess(r -> logOutcome(requestId, "OK", HttpStatus.OK.value(), sizeLabel, started))
                .doOnError(e -> logOutcome(requestId, codeOf(e), statusOf(e), sizeLabel, started))
                .doOnCancel(() -> logOutcome(requestId, "CANCELLED", 499, sizeLabel, started));
    }

    SignedMediaRequest admit(String resourceId, String variantRef, String size, String exp, String sig) {
        SignedMediaRequest request = parse(resourceId, variantRef, size, exp, sig);
        if (environment.enforcesSignatures()) {
            verifySignature(request);
        }
        boolean probeDue = probeDue();
        checkFeatureFlag(probeDue);
        checkServiceMode(probeDue);
        checkBudgetAndCircuit();
        return request;
    }

    static SignedMediaRequest parse(String resourceId, String variantRef, String size, String exp, String sig) {
        MediaSize mediaSize = MediaSize.fromParam(size)
                .orElseThrow(() -> ApiException.validation("Invalid size parameter"));
        if (!isIdentifier(resourceId) || !isIdentifier(variantRef)) {
            throw ApiException.validation("Invalid media reference");
        }
        return new SignedMediaRequest(resourceId, variantRef, mediaSize, exp, sig);
    }

    private void verifySignature(SignedMediaRequest request) {
        if (!request.hasSignature()) {
            throw ApiException.forbidden("missing_signature", "Missing signature");
        }
        long exp;
        try {
            exp = Long.parseLong(request.exp().trim());
        } catch (NumberFormatException e) {
            throw ApiException.forbidden("invalid_signature", "Invalid signature");
        }
        SignatureCheck check = signedUrlCodec.verify(request.resourceId(), request.variantRef(), request.size(), exp, request.sig());
        if (check == SignatureCheck.EXPIRED) {
            throw ApiException.forbidden("expired", "URL has expired");
        }
        if (check != SignatureCheck.VALID) {
            throw ApiException.forbidden("invalid_signature", "Invalid signature");
        }
    }

    /**
     * While the breaker's probe is due, refusals the service mode raised on its own do not apply.
     * Operator flag changes and mode overrides still refuse.
     */
    private boolean probeDue() {
        try {
            return circuitBreakerService.probeDue(ENDPOINT);
        } catch (DataAccessException e) {
            log.warn("Circuit state unavailable, no probe admitted endpointClass={}", ENDPOINT.key(), e);
            return false;
        }
    }

    private void checkFeatureFlag(boolean probeDue) {
        Optional<FeatureFlag> flag;
        try {
            flag = featureFlagService.find(FeatureKeys.PHOTOS_ENABLED);
        } catch (RuntimeException e) {
            log.warn("Feature flag lookup failed, serving anyway key={}", FeatureKeys.PHOTOS_ENABLED, e);
            return;
        }
        if (flag.isPresent() && !flag.get().enabled()) {
            if (probeDue && ServiceModeFeatureProfile.isProfileReason(flag.get().reason())) {
                log.info("Circuit probe passes mode-disabled flag key={} reason={}", FeatureKeys.PHOTOS_ENABLED, flag.get().reason());
                return;
            }
            String reason = flag.get().reason() == null ? "feature_disabled" : flag.get().reason();
            throw ApiException.unavailable(ApiException.FEATURE_DISABLED, reason,
                    "Photos temporarily unavailable", FEATURE_DISABLED_RETRY_AFTER);
        }
    }

    private void checkServiceMode(boolean probeDue) {
        ServiceModeState state = serviceModeService.current();
        if (state.refusesOptionalFeatures()) {
            if (probeDue && !state.manualOverride()) {
                log.info("Circuit probe passes service mode mode={} reason={}", state.currentMode(), state.reason());
                return;
            }
            throw ApiException.unavailable(ApiException.SERVICE_DEGRADED, state.reason(),
                    "Photos unavailable while the service is " + state.currentMode().name().toLowerCase(Locale.ROOT),
                    DEGRADED_RETRY_AFTER);
        }
    }

    private void checkBudgetAndCircuit() {
        try {
            if (!budgetTracker.isOk(ENDPOINT)) {
                throw ApiException.unavailable(ApiException.SERVICE_UNAVAILABLE, "budget_exceeded",
                        "Photo budget exhausted", budgetTracker.secondsUntilReset(ENDPOINT));
            }
            if (!circuitBreakerService.tryAcquire(ENDPOINT)) {
                throw ApiException.unavailable(ApiException.SERVICE_UNAVAILABLE, "circuit_open",
                        "Photo provider temporarily unavailable", circuitBreakerService.secondsUntilProbe(ENDPOINT));
            }
        } catch (DataAccessException | TransactionException e) {
            log.error("Gateway state unavailable, refusing photo request", e);
            throw ApiException.unavailable(ApiException.SERVICE_UNAVAILABLE, "gateway_state_unavailable",
                    "Service temporarily unavailable", STATE_UNAVAILABLE_RETRY_AFTER);
        }
    }

    private Mono<MediaResponse> proxy(SignedMediaRequest request) {
        long resolveStarted = System.nanoTime();
        return Mono.defer(() -> placeMediaClient.resolve(request.resourceId(), request.variantRef(), request.size()))
                .timeout(media.resolveTimeout())
                .switchIfEmpty(Mono.error(() -> new ProviderException(
                        ENDPOINT, ProviderErrorType.INVALID_RESPONSE, null, "Provider response empty")))
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(resolved -> providerCallRecorder.recordSuccess(ENDPOINT, elapsedMs(resolveStarted), media.photoCost()))
                .doOnError(e -> providerCallRecorder.recordFailure(ENDPOINT, e, elapsedMs(resolveStarted)))
                .onErrorMap(e -> toApiException(e, Hop.RESOLVE))
                .flatMap(resolved -> Mono.defer(() -> placeMediaClient.fetch(resolved.binaryUri()))
                        .timeout(media.fetchTimeout())
                        .switchIfEmpty(Mono.error(() -> new ProviderException(
                                ENDPOINT, ProviderErrorType.INVALID_RESPONSE, null, "Media payload empty")))
                        .onErrorMap(e -> toApiException(e, Hop.FETCH)))
                .map(PhotoProxyHandler::toResponse);
    }

    static Throwable toApiException(Throwable e, Hop hop) {
        if (e instanceof ApiException) return e;
        if (e instanceof TimeoutException) {
            return new ApiException(HttpStatus.GATEWAY_TIMEOUT, ApiException.TIMEOUT, "Upstream request timed out", hop.timeoutReason, null);
        }
        if (!(e instanceof ProviderException pe)) return e;

        if (pe.getType() == ProviderErrorType.TIMEOUT) {
            return new ApiException(HttpStatus.GATEWAY_TIMEOUT, ApiException.TIMEOUT, "Upstream request timed out", hop.timeoutReason, null);
        }
        if (hop == Hop.FETCH) {
            return new ApiException(HttpStatus.BAD_GATEWAY, ApiException.UPSTREAM_ERROR, "Media fetch failed", "fetch_failed", null);
        }
        return switch (pe.getType()) {
            case NOT_FOUND -> new ApiException(HttpStatus.NOT_FOUND, ApiException.NOT_FOUND, "Media not found");
            case RATE_LIMITED -> ApiException.unavailable(ApiException.UPSTREAM_RATE_LIMITED, "upstream_rate_limited",
                    "Photo provider rate limited",
                    pe.getRetryAfterSeconds() == null ? RATE_LIMITED_RETRY_AFTER : pe.getRetryAfterSeconds());
            default -> new ApiException(HttpStatus.BAD_GATEWAY, ApiException.UPSTREAM_ERROR, "Upstream request failed", "resolve_failed", null);
        };
    }

    private static MediaResponse toResponse(MediaPayload payload) {
        return new MediaResponse(contentType(payload.contentType()), payload.body());
    }

    static String contentType(String upstream) {
        if (upstream == null || upstream.isBlank()) return DEFAULT_CONTENT_TYPE;
        try {
            return MediaType.parseMediaType(upstream).toString();
        } catch (InvalidMediaTypeException e) {
            return DEFAULT_CONTENT_TYPE;
        }
    }

    private static boolean isIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static String codeOf(Throwable e) {
        return e instanceof ApiException api ? api.getCode() : "INTERNAL";
    }

    private static int statusOf(Throwable e) {
        return e instanceof ApiException api ? api.getStatus().value() : HttpStatus.INTERNAL_SERVER_ERROR.value();
    }

    private static void logOutcome(String requestId, String outcome, int status, String size, long startedNanos) {
        log.info("media_proxy requestId={} outcome={} status={} size={} latencyMs={}",
                requestId, outcome, status, size, elapsedMs(startedNanos));
    }

    enum Hop {
        RESOLVE("resolve_timeout"),
        FETCH("fetch_timeout");

        private final String timeoutReason;

        Hop(String timeoutReason) {
            this.timeoutReason = timeoutReason;
        }
    }
}
