/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.persistence.repository;

import com.bocado.infrastructure.persistence.entity.ProviderCallEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ProviderCallEventRepository extends JpaRepository<ProviderCallEventEntity, UUID> {
    @Query("""
            select count(e) from ProviderCallEventEntity e
            where e.createdAt >= :from
            """)
    long countSince(@Param("from") Instant from);

    @Query("""
            select count(e) from ProviderCallEventEntity e
            where e.success = false
              and e.createdAt >= :from
            """)
    long countFailuresSince(@Param("from") Instant from);

    @Query("""
            select e.latencyMs from ProviderCallEventEntity e
            where e.success = true
              and e.createdAt >= :from
            order by e.latencyMs asc
            """)
    List<Long> findSuccessLatenciesSince(@Param("from") Instant from);

    @Modifying
    @Query("""
            delete from ProviderCallEventEntity e
            where e.createdAt < :cutoff
            """)
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
