package com.batterysmart.swap_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.swaps.recorded{covered}: swaps written, split by coverage
 * - ledger.swap.latency: end-to-end time of recordSwap
 * - ledger.invoices.issued{type}: invoices allocated per type
 * - ledger.penalties.assessed / ledger.penalties.settled{status}
 * - ledger.leave.transitions{status}
 * - ledger.integrity.violations{kind}: states that should never exist
 * - idempotency.cache{result}: swap idempotency lookups
 * - ledger.batteries.overdue: batteries still out past the penalty grace period
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter duplicateSwaps;
    private final Counter subscriptionsExpired;
    private final Timer swapTimer;
    private final AtomicLong overdueBatteries = new AtomicLong(0);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicateSwaps = Counter.builder("ledger.swaps.duplicates")
                .description("Swap reports answered from an earlier idempotency key")
                .register(registry);

        this.subscriptionsExpired = Counter.builder("ledger.subscriptions.expired")
                .description("Subscriptions moved to EXPIRED by the nightly sweep")
                .register(registry);

        this.swapTimer = Timer.builder("ledger.swap.latency")
                .description("Time taken to record a swap, including invoicing")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder("ledger.batteries.overdue", overdueBatteries, AtomicLong::get)
                .description("Ended subscriptions whose battery is still out past the grace period")
                .register(registry);
    }

    public void recordSwap(boolean covered, Duration duration) {
        registry.counter("ledger.swaps.recorded", "covered", String.valueOf(covered)).increment();
        swapTimer.record(duration);
    }

    public void recordSwapRejected(String reason) {
        registry.counter("ledger.swaps.rejected", "reason", sanitizeTag(reason)).increment();
    }

    public void incrementDuplicateSwaps() {
        duplicateSwaps.increment();
    }

    public void recordInvoiceIssued(String invoiceType) {
        registry.counter("ledger.invoices.issued", "type", sanitizeTag(invoiceType)).increment();
    }

    public void recordPenaltyAssessed() {
        registry.counter("ledger.penalties.assessed").increment();
    }

    public void recordPenaltySettled(String status) {
        registry.counter("ledger.penalties.settled", "status", sanitizeTag(status)).increment();
    }

    public void recordLeaveTransition(String status) {
        registry.counter("ledger.leave.transitions", "status", sanitizeTag(status)).increment();
    }

    public void recordSubscriptionsExpired(int count) {
        subscriptionsExpired.increment(count);
    }

    /**
     * Records a state that the ledger's invariants say cannot exist, e.g. two
     * active subscriptions for one driver. The caller still answers, flagged
     * as degraded.
     */
    public void recordIntegrityViolation(String kind) {
        registry.counter("ledger.integrity.violations", "kind", sanitizeTag(kind)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void updateOverdueBatteries(long count) {
        overdueBatteries.set(count);
    }

    public long getOverdueBatteries() {
        return overdueBatteries.get();
    }

    public void recordStationReport(String outcome) {
        registry.counter("ledger.station_reports.consumed", "outcome", sanitizeTag(outcome)).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
