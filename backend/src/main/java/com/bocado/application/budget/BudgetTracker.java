/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.budget;

import com.bocado.application.mode.GatewayTriggerChangedEvent;
import com.bocado.config.GatewayProperties;
import com.bocado.domain.model.BudgetStatus;
import com.bocado.domain.model.EndpointClass;
import com.bocado.infrastructure.persistence.StateUpdateTemplate;
import com.bocado.infrastructure.persistence.entity.BudgetCounterEntity;
import com.bocado.infrastructure.persistence.repository.BudgetCounterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Spend per endpoint class in fixed windows aligned to the epoch.
 * <p>
 * A counter whose window has elapsed counts as zero on read and is restarted on the next write;
 * nothing sweeps counters in the background.
 */
@Service
public class BudgetTracker {
    private static final Logger log = LoggerFactory.getLogger(BudgetTracker.class);

    private final BudgetCounterRepository budgetCounterRepository;
    private final StateUpdateTemplate stateUpdateTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final GatewayProperties.Budget config;
    private final Clock clock;

    public BudgetTracker(
            BudgetCounterRepository budgetCounterRepository,
            StateUpdateTemplate stateUpdateTemplate,
            ApplicationEventPublisher eventPublisher,
            GatewayProperties properties,
            Clock clock
    ) {
        this.budgetCounterRepository = budgetCounterRepository;
        this.stateUpdateTemplate = stateUpdateTemplate;
        this.eventPublisher = eventPublisher;
        this.config = properties.budget();
        this.clock = clock;
        if (config.window() == null || config.window().isZero() || config.window().isNegative()) {
            throw new IllegalStateException("bocado.budget.window must be positive");
        }
    }

    public BudgetStatus recordSpend(EndpointClass endpointClass, long amount) {
        if (amount < 0) throw new IllegalArgumentException("Spend amount must not be negative");

        SpendOutcome outcome = stateUpdateTemplate.update("budget:" + endpointClass.key(), () -> {
            Instant now = clock.instant();
            Instant windowStart = windowStart(now);
            BudgetCounterEntity entity = budgetCounterRepository.findById(endpointClass.key()).orElseGet(() -> {
                BudgetCounterEntity e = new BudgetCounterEntity();
                e.setEndpointClass(endpointClass.key());
                e.setWindowStart(windowStart);
                return e;
            });
            if (!windowStart.equals(entity.getWindowStart())) {
                entity.setWindowStart(windowStart);
                entity.setSpent(0);
            }
            long limit = config.limitFor(endpointClass);
            boolean wasOk = entity.getSpent() < limit;
            entity.setSpent(entity.getSpent() + amount);
            entity.setLimit(limit);
            entity.setUpdatedAt(now);
            BudgetCounterEntity saved = budgetCounterRepository.saveAndFlush(entity);
            return new SpendOutcome(toStatus(endpointClass, saved.getWindowStart(), saved.getSpent(), limit), wasOk);
        });

        if (outcome.wasOk() && !outcome.status().ok()) {
            log.warn("Budget exhausted endpointClass={} spent={} limit={}",
                    endpointClass.key(), outcome.status().spent(), outcome.status().limit());
            eventPublisher.publishEvent(new GatewayTriggerChangedEvent("budget", endpointClass.key()));
        }
        return outcome.status();
    }

    public boolean isOk(EndpointClass endpointClass) {
        return status(endpointClass).ok();
    }

    /**
     * True when every tracked endpoint class is under its limit.
     */
    public boolean isOk() {
        return Arrays.stream(EndpointClass.values()).allMatch(this::isOk);
    }

    public BudgetStatus status(EndpointClass endpointClass) {
        Instant windowStart = windowStart(clock.instant());
        long limit = config.limitFor(endpointClass);
        Optional<BudgetCounterEntity> counter = budgetCounterRepository.findById(endpointClass.key());
        long spent = counter
                .filter(c -> windowStart.equals(c.getWindowStart()))
                .map(BudgetCounterEntity::getSpent)
                .orElse(0L);
        return toStatus(endpointClass, windowStart, spent, limit);
    }

    public List<BudgetStatus> statuses() {
        return Arrays.stream(EndpointClass.values()).map(this::status).toList();
    }

    public long secondsUntilReset(EndpointClass endpointClass) {
        Instant now = clock.instant();
        Instant windowEnd = windowStart(now).plus(config.window());
        return Math.max(1, Duration.between(now, windowEnd).toSeconds());
    }

    Instant windowStart(Instant now) {
        long windowMillis = config.window().toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(now.toEpochMilli(), windowMillis) * windowMillis);
    }

    private BudgetStatus toStatus(EndpointClass endpointClass, Instant windowStart, long spent, long limit) {
        return new BudgetStatus(endpointClass, windowStart, windowStart.plus(config.window()), spent, limit);
    }

    private record SpendOutcome(BudgetStatus status, boolean wasOk) {}
}
