/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.mode;

import com.bocado.application.budget.BudgetTracker;
import com.bocado.application.circuit.CircuitBreakerService;
import com.bocado.application.flags.FeatureFlagService;
import com.bocado.application.health.ProviderHealthReport;
import com.bocado.application.health.ProviderHealthService;
import com.bocado.application.mode.ServiceModePolicy.ModeDecision;
import com.bocado.application.mode.ServiceModePolicy.PendingRelaxation;
import com.bocado.config.GatewayProperties;
import com.bocado.domain.model.ServiceMode;
import com.bocado.domain.model.ServiceModeState;
import com.bocado.domain.model.ServiceModeTransition;
import com.bocado.domain.model.ServiceModeTriggers;
import com.bocado.infrastructure.persistence.StateUpdateTemplate;
import com.bocado.infrastructure.persistence.entity.ServiceModeStateEntity;
import com.bocado.infrastructure.persistence.entity.ServiceModeTransitionEntity;
import com.bocado.infrastructure.persistence.repository.ServiceModeStateRepository;
import com.bocado.infrastructure.persistence.repository.ServiceModeTransitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the process-wide service mode.
 * <p>
 * {@link #initialize()} loads the persisted state at startup, {@link #recompute()} is the only path
 * that derives a new mode from the triggers and {@link #current()} answers from memory. The row in
 * {@code service_mode_state} is shared by all instances and updated with optimistic locking.
 */
@Service
public class ServiceModeService {
    private static final Logger log = LoggerFactory.getLogger(ServiceModeService.class);
    private static final String STATE_KEY = "service_mode";
    private static final int MAX_HISTORY = 100;

    private final ServiceModeStateRepository stateRepository;
    private final ServiceModeTransitionRepository transitionRepository;
    private final StateUpdateTemplate stateUpdateTemplate;
    private final CircuitBreakerService circuitBreakerService;
    private final BudgetTracker budgetTracker;
    private final ProviderHealthService providerHealthService;
    private final FeatureFlagService featureFlagService;
    private final ServiceModePolicy policy;
    private final boolean manageFeatureFlags;
    private final Clock clock;
    private final AtomicReference<ServiceModeState> current;

    public ServiceModeService(
            ServiceModeStateRepository stateRepository,
            ServiceModeTransitionRepository transitionRepository,
            StateUpdateTemplate stateUpdateTemplate,
            CircuitBreakerService circuitBreakerService,
            BudgetTracker budgetTracker,
            ProviderHealthService providerHealthService,
            FeatureFlagService featureFlagService,
            GatewayProperties properties,
            Clock clock
    ) {
        this.stateRepository = stateRepository;
        this.transitionRepository = transitionRepository;
        this.stateUpdateTemplate = stateUpdateTemplate;
        this.circuitBreakerService = circuitBreakerService;
        this.budgetTracker = budgetTracker;
        this.providerHealthService = providerHealthService;
        this.featureFlagService = featureFlagService;
        this.policy = new ServiceModePolicy(properties.serviceMode().minDwell());
        this.manageFeatureFlags = properties.serviceMode().manageFeatureFlags();
        this.clock = clock;
        this.current = new AtomicReference<>(ServiceModeState.initial(clock.instant()));
    }

    public ServiceModeState current() {
        return current.get();
    }

    public ServiceModeState initialize() {
        ServiceModeState loaded = stateUpdateTemplate.update(STATE_KEY, () -> toState(loadOrSeed()));
        publish(loaded);
        log.info("Service mode loaded mode={} reason={} manualOverride={}",
                loaded.currentMode(), loaded.reason(), loaded.manualOverride());
        return loaded;
    }

    public ServiceModeState recompute() {
        ServiceModeTriggers observed = observeTriggers();
        Recomputation result = stateUpdateTemplate.update(STATE_KEY, () -> {
            ServiceModeStateEntity entity = loadOrSeed();
            ServiceModeState before = toState(entity);
            Instant now = clock.instant();

            if (entity.isManualOverride()) {
                writeTriggers(entity, observed);
                entity.setUpdatedAt(now);
                return new Recomputation(before, toState(stateRepository.saveAndFlush(entity)), false);
            }

            ModeDecision decision = policy.decide(before, pending(entity), observed, now);
            ServiceModeState next = decision.state();
            entity.setCurrentMode(next.currentMode());
            entity.setReason(next.reason());
            entity.setEnteredAt(next.enteredAt());
            writeTriggers(entity, next.triggers());
            entity.setPendingTriggers(decision.pending() == null ? null : decision.pending().triggers().toMask());
            entity.setPendingSince(decision.pending() == null ? null : decision.pending().since());
            entity.setUpdatedAt(now);
            stateRepository.saveAndFlush(entity);
            if (decision.transitioned()) {
                transitionRepository.save(transition(before.currentMode(), next, false));
            }
            return new Recomputation(before, next, decision.transitioned());
        });

        publish(result.after());
        if (result.transitioned()) {
            onTransition(result.before(), result.after());
        }
        return result.after();
    }

    /**
     * Pins the mode until {@link #clearOverride()}. Triggers keep being recorded meanwhile.
     */
    public ServiceModeState override(ServiceMode mode, String reason) {
        if (mode == null) throw new IllegalArgumentException("Mode is required");
        if (reason == null || reason.isBlank()) throw new IllegalArgumentException("Reason is required");
        String cleanReason = reason.trim();

        Recomputation result = stateUpdateTemplate.update(STATE_KEY, () -> {
            ServiceModeStateEntity entity = loadOrSeed();
            ServiceModeState before = toState(entity);
            Instant now = clock.instant();
            boolean changed = entity.getCurrentMode() != mode;
            entity.setManualOverride(true);
            entity.setCurrentMode(mode);
            entity.setReason(cleanReason);
            if (changed) entity.setEnteredAt(now);
            entity.setPendingTriggers(null);
            entity.setPendingSince(null);
            entity.setUpdatedAt(now);
            ServiceModeState after = toState(stateRepository.saveAndFlush(entity));
            if (changed) {
                transitionRepository.save(transition(before.currentMode(), after, true));
            }
            return new Recomputation(before, after, changed);
        });

        log.warn("Service mode override set mode={} reason={}", mode, cleanReason);
        publish(result.after());
        if (result.transitioned()) {
            onTransition(result.before(), result.after());
        }
        return result.after();
    }

    public ServiceModeState clearOverride() {
        stateUpdateTemplate.update(STATE_KEY, () -> {
            ServiceModeStateEntity entity = loadOrSeed();
            entity.setManualOverride(false);
            entity.setUpdatedAt(clock.instant());
            return stateRepository.saveAndFlush(entity).getCurrentMode();
        });
        log.info("Service mode override cleared");
        return recompute();
    }

    public List<ServiceModeTransition> history(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_HISTORY));
        return transitionRepository.findRecent(PageRequest.of(0, size)).stream()
                .map(ServiceModeService::toTransition)
                .toList();
    }

    @EventListener
    public void onTriggerChanged(GatewayTriggerChangedEvent event) {
        try {
            recompute();
        } catch (DataAccessException e) {
            log.warn("Service mode recompute failed source={} detail={}", event.source(), event.detail(), e);
        }
    }

    ServiceModeTriggers observeTriggers() {
        ProviderHealthReport health = providerHealthService.report();
        return new ServiceModeTriggers(
                health.providerHealthy(),
                budgetTracker.isOk(),
                health.latencyOk(),
                circuitBreakerService.allClosed()
        );
    }

    private void onTransition(ServiceModeState before, ServiceModeState after) {
        if (after.currentMode().isMoreSevereThan(before.currentMode())) {
            log.warn("Service mode escalated from={} to={} reason={}", before.currentMode(), after.currentMode(), after.reason());
        } else {
            log.info("Service mode relaxed from={} to={} reason={}", before.currentMode(), after.currentMode(), after.reason());
        }
        if (!manageFeatureFlags) return;
        try {
            featureFlagService.applyProfile(
                    ServiceModeFeatureProfile.forMode(after.currentMode()),
                    ServiceModeFeatureProfile.reason(after.currentMode(), after.reason())
            );
        } catch (DataAccessException e) {
            log.warn("Feature profile not applied mode={}", after.currentMode(), e);
        }
    }

    private void publish(ServiceModeState next) {
        current.set(next);
    }

    private ServiceModeStateEntity loadOrSeed() {
        return stateRepository.findById(ServiceModeStateEntity.SINGLETON_KEY).orElseGet(() -> {
            ServiceModeState initial = ServiceModeState.initial(clock.instant());
            ServiceModeStateEntity e = new ServiceModeStateEntity();
            e.setStateKey(ServiceModeStateEntity.SINGLETON_KEY);
            e.setCurrentMode(initial.currentMode());
            e.setReason(initial.reason());
            e.setEnteredAt(initial.enteredAt());
            writeTriggers(e, initial.triggers());
            e.setManualOverride(false);
            e.setUpdatedAt(initial.updatedAt());
            return stateRepository.saveAndFlush(e);
        });
    }

    private static PendingRelaxation pending(ServiceModeStateEntity entity) {
        if (entity.getPendingTriggers() == null || entity.getPendingSince() == null) return null;
        return new PendingRelaxation(ServiceModeTriggers.fromMask(entity.getPendingTriggers()), entity.getPendingSince());
    }

    private static void writeTriggers(ServiceModeStateEntity entity, ServiceModeTriggers triggers) {
        entity.setProviderHealthy(triggers.providerHealthy());
        entity.setBudgetOk(triggers.budgetOk());
        entity.setLatencyOk(triggers.latencyOk());
        entity.setCircuitBreakerClosed(triggers.circuitBreakerClosed());
    }

    private static ServiceModeState toState(ServiceModeStateEntity e) {
        return new ServiceModeState(
                e.getCurrentMode(),
                e.getReason(),
                e.getEnteredAt(),
                new ServiceModeTriggers(e.isProviderHealthy(), e.isBudgetOk(), e.isLatencyOk(), e.isCircuitBreakerClosed()),
                e.isManualOverride(),
                e.getUpdatedAt()
        );
    }

    private static ServiceModeTransitionEntity transition(ServiceMode from, ServiceModeState to, boolean manual) {
        ServiceModeTransitionEntity t = new ServiceModeTransitionEntity();
        t.setFromMode(from);
        t.setToMode(to.currentMode());
        t.setReason(to.reason());
        t.setProviderHealthy(to.triggers().providerHealthy());
        t.setBudgetOk(to.triggers().budgetOk());
        t.setLatencyOk(to.triggers().latencyOk());
        t.setCircuitBreakerClosed(to.triggers().circuitBreakerClosed());
        t.setManual(manual);
        t.setTransitionedAt(to.updatedAt());
        return t;
    }

    private static ServiceModeTransition toTransition(ServiceModeTransitionEntity t) {
        return new ServiceModeTransition(
                t.getFromMode(),
                t.getToMode(),
                t.getReason(),
                new ServiceModeTriggers(t.isProviderHealthy(), t.isBudgetOk(), t.isLatencyOk(), t.isCircuitBreakerClosed()),
                t.isManual(),
                t.getTransitionedAt()
        );
    }

    private record Recomputation(ServiceModeState before, ServiceModeState after, boolean transitioned) {}
}
