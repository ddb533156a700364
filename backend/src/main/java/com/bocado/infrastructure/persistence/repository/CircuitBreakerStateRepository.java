/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.persistence.repository;

import com.bocado.infrastructure.persistence.entity.CircuitBreakerStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CircuitBreakerStateRepository extends JpaRepository<CircuitBreakerStateEntity, String> {
}
