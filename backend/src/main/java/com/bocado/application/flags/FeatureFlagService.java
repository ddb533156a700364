/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.application.flags;

import com.bocado.domain.model.FeatureFlag;
import com.bocado.infrastructure.persistence.StateUpdateTemplate;
import com.bocado.infrastructure.persistence.entity.FeatureFlagEntity;
import com.bocado.infrastructure.persistence.repository.FeatureFlagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Durable on/off switches. An absent flag reads as enabled.
 */
@Service
public class FeatureFlagService {
    private static final Logger log = LoggerFactory.getLogger(FeatureFlagService.class);
    private static final Pattern KEY_PATTERN = Pattern.compile("[a-z0-9_]{1,64}");
    private static final int MAX_REASON_LENGTH = 200;

    private final FeatureFlagRepository featureFlagRepository;
    private final StateUpdateTemplate stateUpdateTemplate;
    private final Clock clock;

    public FeatureFlagService(FeatureFlagRepository featureFlagRepository, StateUpdateTemplate stateUpdateTemplate, Clock clock) {
        this.featureFlagRepository = featureFlagRepository;
        this.stateUpdateTemplate = stateUpdateTemplate;
        this.clock = clock;
    }

    public boolean get(String key) {
        return featureFlagRepository.findById(key).map(FeatureFlagEntity::isEnabled).orElse(true);
    }

    public Optional<FeatureFlag> find(String key) {
        return featureFlagRepository.findById(key).map(FeatureFlagService::toModel);
    }

    public Map<String, Boolean> getAll() {
        Map<String, Boolean> flags = new TreeMap<>();
        for (FeatureFlagEntity e : featureFlagRepository.findAll()) {
            flags.put(e.getKey(), e.isEnabled());
        }
        return flags;
    }

    public List<FeatureFlag> list() {
        return featureFlagRepository.findAll().stream()
                .map(FeatureFlagService::toModel)
                .sorted(Comparator.comparing(FeatureFlag::key))
                .toList();
    }

    public FeatureFlag set(String key, boolean enabled, String reason) {
        String validKey = requireValidKey(key);
        String cleanReason = normalizeReason(reason);
        FeatureFlag saved = stateUpdateTemplate.update("flag:" + validKey, () -> {
            FeatureFlagEntity entity = featureFlagRepository.findById(validKey).orElseGet(() -> {
                FeatureFlagEntity e = new FeatureFlagEntity();
                e.setKey(validKey);
                return e;
            });
            entity.setEnabled(enabled);
            entity.setReason(cleanReason);
            entity.setUpdatedAt(clock.instant());
            return toModel(featureFlagRepository.saveAndFlush(entity));
        });
        log.info("Feature flag set key={} enabled={} reason={}", validKey, enabled, cleanReason);
        return saved;
    }

    /**
     * Seeds the default flags as enabled where no row exists yet. Returns how many were created.
     */
    public int initDefaults() {
        int created = 0;
        for (String key : FeatureKeys.DEFAULTS) {
            boolean inserted = stateUpdateTemplate.update("flag:" + key, () -> {
                if (featureFlagRepository.existsById(key)) return false;
                FeatureFlagEntity e = new FeatureFlagEntity();
                e.setKey(key);
                e.setEnabled(true);
                e.setUpdatedAt(clock.instant());
                featureFlagRepository.saveAndFlush(e);
                return true;
            });
            if (inserted) created++;
        }
        if (created > 0) {
            log.info("Feature flags seeded created={}", created);
        }
        return created;
    }

    /**
     * Applies a set of desired values, writing only the flags whose value or reason differs.
     */
    public int applyProfile(Map<String, Boolean> profile, String reason) {
        int changed = 0;
        for (Map.Entry<String, Boolean> entry : profile.entrySet()) {
            String desiredReason = entry.getValue() ? null : reason;
            Optional<FeatureFlag> current = find(entry.getKey());
            boolean same = current.isPresent()
                    && current.get().enabled() == entry.getValue()
                    && Objects.equals(current.get().reason(), normalizeReason(desiredReason));
            if (same) continue;
            set(entry.getKey(), entry.getValue(), desiredReason);
            changed++;
        }
        return changed;
    }

    private static String requireValidKey(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid feature flag key");
        }
        return key;
    }

    private static String normalizeReason(String reason) {
        if (reason == null || reason.isBlank()) return null;
        String trimmed = reason.trim();
        return trimmed.length() > MAX_REASON_LENGTH ? trimmed.substring(0, MAX_REASON_LENGTH) : trimmed;
    }

    private static FeatureFlag toModel(FeatureFlagEntity e) {
        return new FeatureFlag(e.getKey(), e.isEnabled(), e.getReason(), e.getUpdatedAt());
    }
}
