/*
 * Copyright (C) 2025 Bocado Provider Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.bocado.infrastructure.persistence;

import com.bocado.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.function.Supplier;

/**
 * Read-modify-write on a gateway state row.
 * <p>
 * Each attempt runs in its own transaction. A stale {@code @Version}, a lost insert race on the
 * same key or a busy database restarts the whole read-modify-write, up to {@code bocado.state.max-attempts}.
 * The callback must therefore be free of side effects outside the transaction.
 */
@Component
public class StateUpdateTemplate {
    private static final Logger log = LoggerFactory.getLogger(StateUpdateTemplate.class);

    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;

    public StateUpdateTemplate(PlatformTransactionManager transactionManager, GatewayProperties properties) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        int configured = properties.state() == null ? 0 : properties.state().maxAttempts();
        this.maxAttempts = configured < 1 ? 5 : configured;
    }

    public <T> T update(String stateKey, Supplier<T> work) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (RuntimeException e) {
                if (!isConflict(e)) throw e;
                last = e;
                log.debug("State update conflict key={} attempt={}/{}", stateKey, attempt, maxAttempts);
            }
        }
        log.warn("State update gave up key={} attempts={}", stateKey, maxAttempts);
        throw last;
    }

    /**
     * Optimistic-lock failures, duplicate inserts and SQLite busy/locked errors, even when wrapped.
     */
    static boolean isConflict(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t instanceof ConcurrencyFailureException) return true;
            if (t instanceof DataIntegrityViolationException) return true;
            if (t instanceof jakarta.persistence.OptimisticLockException) return true;
            if (t instanceof org.hibernate.StaleStateException) return true;
            if (t instanceof org.hibernate.exception.ConstraintViolationException) return true;
            if (t instanceof SQLException sql) {
                String msg = sql.getMessage();
                if (msg != null && (msg.contains("SQLITE_CONSTRAINT") || msg.contains("SQLITE_BUSY"))) return true;
            }
            t = t.getCause();
        }
        return false;
    }
}
