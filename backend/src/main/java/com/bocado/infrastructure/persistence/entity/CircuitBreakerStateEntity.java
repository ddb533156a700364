/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.persistence.entity;

import com.bocado.domain.model.CircuitStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.Instant;

@Entity
@Table(name = "circuit_breaker_states")
public class CircuitBreakerStateEntity {
    @Id
    @Column(name = "endpoint_class", nullable = false)
    private String endpointClass;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private CircuitStatus status;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "open_count", nullable = false)
    private int openCount;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "next_probe_at")
    private Instant nextProbeAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public String getEndpointClass() {
        return endpointClass;
    }

    public void setEndpointClass(String endpointClass) {
        this.endpointClass = endpointClass;
    }

    public CircuitStatus getStatus() {
        return status;
    }

    public void setStatus(CircuitStatus status) {
        this.status = status;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void setConsecutiveFailures(int consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    public int getOpenCount() {
        return openCount;
    }

    public void setOpenCount(int openCount) {
        this.openCount = openCount;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public void setOpenedAt(Instant openedAt) {
        this.openedAt = openedAt;
    }

    public Instant getNextProbeAt() {
        return nextProbeAt;
    }

    public void setNextProbeAt(Instant nextProbeAt) {
        this.nextProbeAt = nextProbeAt;
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
