package com.batterysmart.swap_ledger.config;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Bounds how long the current transaction waits for a row lock.
 *
 * PostgreSQL reports an expired wait as SQLSTATE 55P03, which Spring
 * translates into a PessimisticLockingFailureException; callers surface it
 * as a retryable conflict.
 */
@Component
@RequiredArgsConstructor
public class TransactionLockTimeout {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;

    @Transactional(propagation = Propagation.MANDATORY)
    public void apply() {
        long timeoutMs = Math.max(1, properties.getSwap().getLockTimeoutMs());
        jdbcTemplate.execute("SET LOCAL lock_timeout = '" + timeoutMs + "ms'");
    }
}
