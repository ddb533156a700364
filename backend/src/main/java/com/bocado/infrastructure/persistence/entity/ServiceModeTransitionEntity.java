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
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "service_mode_transitions")
public class ServiceModeTransitionEntity {
    @Id
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "id", nullable = false, length = 36)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_mode", nullable = false)
    private ServiceMode fromMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_mode", nullable = false)
    private ServiceMode toMode;

    @Column(name = "reason", nullable = false)
    private String reason;

    @Column(name = "provider_healthy", nullable = false)
    private boolean providerHealthy;

    @Column(name = "budget_ok", nullable = false)
    private boolean budgetOk;

    @Column(name = "latency_ok", nullable = false)
    private boolean latencyOk;

    @Column(name = "circuit_breaker_closed", nullable = false)
    private boolean circuitBreakerClosed;

    @Column(name = "manual", nullable = false)
    private boolean manual;

    @Column(name = "transitioned_at", nullable = false)
    private Instant transitionedAt;

    @PrePersist
    void prePersist() {
        if (id == null) id = UUID.randomUUID();
        if (transitionedAt == null) transitionedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public ServiceMode getFromMode() {
        return fromMode;
    }

    public void setFromMode(ServiceMode fromMode) {
        this.fromMode = fromMode;
    }

    public ServiceMode getToMode() {
        return toMode;
    }

    public void setToMode(ServiceMode toMode) {
        this.toMode = toMode;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
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

    public boolean isManual() {
        return manual;
    }

    public void setManual(boolean manual) {
        this.manual = manual;
    }

    public Instant getTransitionedAt() {
        return transitionedAt;
    }

    public void setTransitionedAt(Instant transitionedAt) {
        this.transitionedAt = transitionedAt;
    }
}
