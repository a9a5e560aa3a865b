package com.batterysmart.swap_ledger.invoice;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;

/**
 * Allocates invoice numbers of the form {@code INV-YYYYMM-NNNNNN}.
 *
 * Each period has one counter row in invoice_sequences. The increment is a
 * single upsert; the row lock it takes is held until the surrounding
 * transaction commits, so allocation is serialized per month and a number
 * is never visible before the invoice that carries it. Numbers of a
 * rolled-back transaction are handed out again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvoiceSequencer {

    static final long MAX_SEQUENCE = 999_999L;

    private static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ofPattern("yyyyMM");

    private static final String NEXT_VALUE =
        "INSERT INTO invoice_sequences (period, last_value, updated_at) VALUES (?, 1, ?) " +
        "ON CONFLICT (period) DO UPDATE SET last_value = invoice_sequences.last_value + 1, " +
        "updated_at = EXCLUDED.updated_at " +
        "RETURNING last_value";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Must run inside the transaction that inserts the invoice.
     *
     * @throws IllegalStateException if the month's sequence would exceed six digits
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String nextInvoiceNumber(YearMonth period) {
        String key = period.format(PERIOD_FORMAT);
        Long value = jdbcTemplate.queryForObject(NEXT_VALUE, Long.class, key, Timestamp.from(clock.instant()));
        if (value == null) {
            throw new IllegalStateException("Invoice sequence returned no value for period " + key);
        }
        return format(period, value);
    }

    static String format(YearMonth period, long sequence) {
        if (sequence < 1 || sequence > MAX_SEQUENCE) {
            throw new IllegalStateException("Invoice sequence " + sequence + " for "
                + period.format(PERIOD_FORMAT) + " is outside 1.." + MAX_SEQUENCE);
        }
        return String.format("INV-%s-%06d", period.format(PERIOD_FORMAT), sequence);
    }
}
