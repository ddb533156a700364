/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.persistence.entity;

import com.bocado.domain.model.ServiceMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.Instant;

@Entity
@Table(name = "service_mode_state")
public class ServiceModeStateEntity {
    public static final String SINGLETON_KEY = "service_mode";

    @Id
    @Column(name = "state_key", nullable = false)
    private String stateKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_mode", nullable = false)
    private ServiceMode currentMode;

    @Column(name = "reason", nullable = false)
    private String reason;

    @Column(name = "entered_at", nullable = false)
    private Instant enteredAt;

    @Column(name = "provider_healthy", nullable = false)
    private boolean providerHealthy;

    @Column(name = "budget_ok", nullable = false)
    private boolean budgetOk;

    @Column(name = "latency_ok", nullable = false)
    private boolean latencyOk;

    @Column(name = "circuit_breaker_closed", nullable = false)
    private boolean circuitBreakerClosed;

    @Column(name = "pending_triggers")
    private Integer pendingTriggers;

    @Column(name = "pending_since")
    private Instant pendingSince;

    @Column(name = "manual_override", nullable = false)
    private boolean manualOverride;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public String getStateKey() {
        return stateKey;
    }

    public void setStateKey(String stateKey) {
        this.stateKey = stateKey;
    }

    public ServiceMode getCurrentMode() {
        return currentMode;
    }

    public void setCurrentMode(ServiceMode currentMode) {
        this.currentMode = currentMode;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public Instant getEnteredAt() {
        return enteredAt;
    }

    public void setEnteredAt(Instant enteredAt) {
        this.enteredAt = enteredAt;
    }

    public boolean isProviderHealthy() {
        return providerHealthy;
    }

    public void setProviderHealthy(boolean providerHealthy) {
        this.providerHealthy = providerHealthy;
    }

    public boolean isBudgetOk() {
        return budgetOk;
    }

    public void setBudgetOk(boolean budgetOk) {
        this.budgetOk = budgetOk;
    }

    public boolean isLatencyOk() {
        return latencyOk;
    }

    public void setLatencyOk(boolean latencyOk) {
        this.latencyOk = latencyOk;
    }

    public boolean isCircuitBreakerClosed() {
        return circuitBreakerClosed;
    }

    public void setCircuitBreakerClosed(boolean circuitBreakerClosed) {
        this.circuitBreakerClosed = circuitBreakerClosed;
    }

    public Integer getPendingTriggers() {
        return pendingTriggers;
    }

    public void setPendingTriggers(Integer pendingTriggers) {
        this.pendingTriggers = pendingTriggers;
    }

    public Instant getPendingSince() {
        return pendingSince;
    }

    public void setPendingSince(Instant pendingSince) {
        this.pendingSince = pendingSince;
    }

    public boolean isManualOverride() {
        return manualOverride;
    }

    public void setManualOverride(boolean manualOverride) {
        this.manualOverride = manualOverride;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getVersion() {
        return version;
    }
}
