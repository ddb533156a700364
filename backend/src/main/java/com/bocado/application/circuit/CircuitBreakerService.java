/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.circuit;

import com.bocado.application.mode.GatewayTriggerChangedEvent;
import com.bocado.config.GatewayProperties;
import com.bocado.domain.model.CircuitBreakerSnapshot;
import com.bocado.domain.model.CircuitStatus;
import com.bocado.domain.model.EndpointClass;
import com.bocado.infrastructure.persistence.StateUpdateTemplate;
import com.bocado.infrastructure.persistence.entity.CircuitBreakerStateEntity;
import com.bocado.infrastructure.persistence.repository.CircuitBreakerStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Shared circuit breaker per provider endpoint class.
 * <p>
 * CLOSED counts consecutive failures and opens at the threshold. OPEN refuses calls until
 * {@code nextProbeAt}; the first caller after that becomes the probe and moves the breaker to
 * HALF_OPEN holding a lease of {@code probe-timeout}. The probe outcome closes the breaker or
 * re-opens it with a doubled cool-down. An expired lease admits a new probe.
 */
@Service
public class CircuitBreakerService {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerService.class);
    private static final int MAX_BACKOFF_EXPONENT = 20;

    private final CircuitBreakerStateRepository circuitBreakerStateRepository;
    private final StateUpdateTemplate stateUpdateTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final GatewayProperties.CircuitBreaker config;
    private final Clock clock;

    public CircuitBreakerService(
            CircuitBreakerStateRepository circuitBreakerStateRepository,
            StateUpdateTemplate stateUpdateTemplate,
            ApplicationEventPublisher eventPublisher,
            GatewayProperties properties,
            Clock clock
    ) {
        this.circuitBreakerStateRepository = circuitBreakerStateRepository;
        this.stateUpdateTemplate = stateUpdateTemplate;
        this.eventPublisher = eventPublisher;
        this.config = properties.circuitBreaker();
        this.clock = clock;
        if (config.failureThreshold() < 1) {
            throw new IllegalStateException("bocado.circuit-breaker.failure-threshold must be at least 1");
        }
    }

    /**
     * Whether a provider call may go out now. May claim the probe slot, so only call it right
     * before the call and report the outcome afterwards.
     */
    public boolean tryAcquire(EndpointClass endpointClass) {
        if (state(endpointClass).isClosed()) return true;

        Transition transition = stateUpdateTemplate.update(key(endpointClass), () -> {
            CircuitBreakerStateEntity entity = load(endpointClass);
            CircuitStatus before = entity.getStatus();
            Instant now = clock.instant();
            if (before == CircuitStatus.CLOSED) {
                return new Transition(before, before, true);
            }
            if (entity.getNextProbeAt() != null && now.isBefore(entity.getNextProbeAt())) {
                return new Transition(before, before, false);
            }
            entity.setStatus(CircuitStatus.HALF_OPEN);
            entity.setNextProbeAt(now.plus(config.probeTimeout()));
            entity.setUpdatedAt(now);
            circuitBreakerStateRepository.saveAndFlush(entity);
            return new Transition(before, CircuitStatus.HALF_OPEN, true);
        });

        if (transition.admitted() && transition.before() != CircuitStatus.CLOSED) {
            log.info("Circuit probe admitted endpointClass={} from={}", endpointClass.key(), transition.before());
        }
        return transition.admitted();
    }

    public CircuitBreakerSnapshot recordSuccess(EndpointClass endpointClass) {
        CircuitBreakerSnapshot current = state(endpointClass);
        if (current.isClosed() && current.consecutiveFailures() == 0) return current;

        Transition transition = stateUpdateTemplate.update(key(endpointClass), () -> {
            CircuitBreakerStateEntity entity = load(endpointClass);
            CircuitStatus before = entity.getStatus();
            // A late success from a call admitted before the breaker opened does not cut the cool-down short.
            if (before == CircuitStatus.OPEN) {
                return new Transition(before, before, false);
            }
            entity.setStatus(CircuitStatus.CLOSED);
            entity.setConsecutiveFailures(0);
            entity.setOpenCount(0);
            entity.setOpenedAt(null);
            entity.setNextProbeAt(null);
            entity.setUpdatedAt(clock.instant());
            circuitBreakerStateRepository.saveAndFlush(entity);
            return new Transition(before, CircuitStatus.CLOSED, true);
        });

        if (transition.changed()) {
            log.info("Circuit closed endpointClass={}", endpointClass.key());
            eventPublisher.publishEvent(new GatewayTriggerChangedEvent("circuit", endpointClass.key()));
        }
        return state(endpointClass);
    }

    public CircuitBreakerSnapshot recordFailure(EndpointClass endpointClass) {
        Transition transition = stateUpdateTemplate.update(key(endpointClass), () -> {
            CircuitBreakerStateEntity entity = load(endpointClass);
            CircuitStatus before = entity.getStatus();
            Instant now = clock.instant();
            entity.setConsecutiveFailures(entity.getConsecutiveFailures() + 1);
            switch (before) {
                case CLOSED -> {
                    if (entity.getConsecutiveFailures() >= config.failureThreshold()) {
                        open(entity, now);
                    }
                }
                case HALF_OPEN -> open(entity, now);
                case OPEN -> {
                    // already refusing calls; keep the scheduled probe
                }
            }
            entity.setUpdatedAt(now);
            circuitBreakerStateRepository.saveAndFlush(entity);
            return new Transition(before, entity.getStatus(), false);
        });

        if (transition.changed()) {
            CircuitBreakerSnapshot opened = state(endpointClass);
            log.warn("Circuit opened endpointClass={} from={} openCount={} nextProbeAt={}",
                    endpointClass.key(), transition.before(), opened.openCount(), opened.nextProbeAt());
            eventPublisher.publishEvent(new GatewayTriggerChangedEvent("circuit", endpointClass.key()));
        }
        return state(endpointClass);
    }

    public CircuitBreakerSnapshot state(EndpointClass endpointClass) {
        return circuitBreakerStateRepository.findById(endpointClass.key())
                .map(e -> toSnapshot(endpointClass, e))
                .orElseGet(() -> CircuitBreakerSnapshot.closed(endpointClass));
    }

    public boolean isClosed(EndpointClass endpointClass) {
        return state(endpointClass).isClosed();
    }

    /**
     * Whether a refused breaker is ready for its next probe: OPEN past {@code nextProbeAt}, or a
     * HALF_OPEN lease that expired.
     */
    public boolean probeDue(EndpointClass endpointClass) {
        CircuitBreakerSnapshot snapshot = state(endpointClass);
        if (snapshot.isClosed() || snapshot.nextProbeAt() == null) return false;
        return !clock.instant().isBefore(snapshot.nextProbeAt());
    }

    public boolean allClosed() {
        return Arrays.stream(EndpointClass.values()).allMatch(this::isClosed);
    }

    public List<CircuitBreakerSnapshot> states() {
        return Arrays.stream(EndpointClass.values()).map(this::state).toList();
    }

    /**
     * Seconds until a refused caller could be admitted again, at least 1.
     */
    public long secondsUntilProbe(EndpointClass endpointClass) {
        CircuitBreakerSnapshot snapshot = state(endpointClass);
        if (snapshot.nextProbeAt() == null) return Math.max(1, config.coolDown().toSeconds());
        long seconds = Duration.between(clock.instant(), snapshot.nextProbeAt()).toSeconds();
        return Math.max(1, seconds);
    }

    public CircuitBreakerSnapshot reset(EndpointClass endpointClass) {
        CircuitStatus before = stateUpdateTemplate.update(key(endpointClass), () -> {
            CircuitBreakerStateEntity entity = load(endpointClass);
            CircuitStatus status = entity.getStatus();
            entity.setStatus(CircuitStatus.CLOSED);
            entity.setConsecutiveFailures(0);
            entity.setOpenCount(0);
            entity.setOpenedAt(null);
            entity.setNextProbeAt(null);
            entity.setUpdatedAt(clock.instant());
            circuitBreakerStateRepository.saveAndFlush(entity);
            return status;
        });
        log.info("Circuit reset endpointClass={} from={}", endpointClass.key(), before);
        if (before != CircuitStatus.CLOSED) {
            eventPublisher.publishEvent(new GatewayTriggerChangedEvent("circuit", endpointClass.key()));
        }
        return state(endpointClass);
    }

    Duration backoff(int openCount) {
        int exponent = Math.min(Math.max(openCount - 1, 0), MAX_BACKOFF_EXPONENT);
        Duration scaled = config.coolDown().multipliedBy(1L << exponent);
        return scaled.compareTo(config.maxCoolDown()) > 0 ? config.maxCoolDown() : scaled;
    }

    private void open(CircuitBreakerStateEntity entity, Instant now) {
        entity.setStatus(CircuitStatus.OPEN);
        entity.setOpenCount(entity.getOpenCount() + 1);
        entity.setOpenedAt(now);
        entity.setNextProbeAt(now.plus(backoff(entity.getOpenCount())));
    }

    private CircuitBreakerStateEntity load(EndpointClass endpointClass) {
        return circuitBreakerStateRepository.findById(endpointClass.key()).orElseGet(() -> {
            CircuitBreakerStateEntity e = new CircuitBreakerStateEntity();
            e.setEndpointClass(endpointClass.key());
            e.setStatus(CircuitStatus.CLOSED);
            return e;
        });
    }

    private static String key(EndpointClass endpointClass) {
        return "circuit:" + endpointClass.key();
    }

    private static CircuitBreakerSnapshot toSnapshot(EndpointClass endpointClass, CircuitBreakerStateEntity e) {
        return new CircuitBreakerSnapshot(
                endpointClass,
                e.getStatus(),
                e.getConsecutiveFailures(),
                e.getOpenCount(),
                e.getOpenedAt(),
                e.getNextProbeAt()
        );
    }

    private record Transition(CircuitStatus before, CircuitStatus after, boolean admitted) {
        boolean changed() {
            return before != after;
        }
    }
}
