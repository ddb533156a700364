/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.persistence.repository;

import com.bocado.infrastructure.persistence.entity.ServiceModeTransitionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.UUID;

public interface ServiceModeTransitionRepository extends JpaRepository<ServiceModeTransitionEntity, UUID> {
    @Query("""
            select t from ServiceModeTransitionEntity t
            order by t.transitionedAt desc
            """)
    List<ServiceModeTransitionEntity> findRecent(Pageable pageable);
}
