/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.config;

import com.bocado.infrastructure.persistence.repository.FeatureFlagRepository;
import com.bocado.infrastructure.persistence.repository.ServiceModeStateRepository;
import jakarta.persistence.EntityManagerFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class JpaContextTest {
    @Autowired
    private EntityManagerFactory entityManagerFactory;

    @Autowired
    private FeatureFlagRepository featureFlagRepository;

    @Autowired
    private ServiceModeStateRepository serviceModeStateRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void contextLoadsWithJpaAndMigrations() {
        assertNotNull(entityManagerFactory);
        Integer tables = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM sqlite_master WHERE type = 'table' AND name IN "
                        + "('feature_flags','circuit_breaker_states','budget_counters','service_mode_state',"
                        + "'service_mode_transitions','provider_call_events')",
                Integer.class);
        assertEquals(6, tables);
    }

    @Test
    void startupSeedsFlagsAndModeRow() {
        assertTrue(featureFlagRepository.count() >= 5);
        assertTrue(serviceModeStateRepository.existsById("service_mode"));
    }
}
