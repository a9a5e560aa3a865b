package com.batterysmart.swap_ledger.penalty;

import com.batterysmart.swap_ledger.config.LedgerProperties;
import com.batterysmart.swap_ledger.observability.LedgerMetrics;
import com.batterysmart.swap_ledger.subscription.DriverSubscription;
import com.batterysmart.swap_ledger.subscription.SubscriptionStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Penalty arithmetic with the default policy: 4 grace days, Rs.80 per day.
 */
class PenaltyEngineTest {

    private static final LocalDate END_DATE = LocalDate.of(2024, 5, 31);

    private SimpleMeterRegistry registry;
    private PenaltyEngine engine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        engine = new PenaltyEngine(new LedgerProperties(), new LedgerMetrics(registry));
    }

    private DriverSubscription subscription(boolean returned, Instant returnedAt) {
        Instant created = Instant.parse("2024-05-01T04:30:00Z");
        return new DriverSubscription(
            UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            END_DATE.minusDays(30), END_DATE, SubscriptionStatus.EXPIRED,
            12, false, "BAT-001", returned, false, returnedAt, created, created);
    }

    @Nested
    @DisplayName("Battery still with the driver")
    class Unreturned {

        @Test
        @DisplayName("Six days past the end date owes two days after grace")
        void sixDaysPastEnd() {
            PenaltyView view = engine.computePenalty(subscription(false, null), END_DATE.plusDays(6));

            assertTrue(view.isHasPenalty());
            assertEquals(2, view.getDaysOverdue());
            assertEquals(new BigDecimal("160.00"), view.getTotalAmount());
            assertEquals(new BigDecimal("80.00"), view.getDailyRate());
            assertEquals(4, view.getGracePeriodDays());
            assertFalse(view.isDegraded());
        }

        @Test
        @DisplayName("Within the grace period nothing is owed")
        void withinGrace() {
            PenaltyView view = engine.computePenalty(subscription(false, null), END_DATE.plusDays(3));

            assertFalse(view.isHasPenalty());
            assertEquals(0, view.getDaysOverdue());
            assertEquals(new BigDecimal("0.00"), view.getTotalAmount());
        }

        @Test
        @DisplayName("Last grace day still owes nothing, the next day owes one")
        void graceBoundary() {
            assertFalse(engine.computePenalty(subscription(false, null), END_DATE.plusDays(4)).isHasPenalty());

            PenaltyView dayFive = engine.computePenalty(subscription(false, null), END_DATE.plusDays(5));
            assertEquals(1, dayFive.getDaysOverdue());
            assertEquals(new BigDecimal("80.00"), dayFive.getTotalAmount());
        }

        @Test
        @DisplayName("Before the end date the overdue count is clamped to zero")
        void beforeEndDate() {
            PenaltyView view = engine.computePenalty(subscription(false, null), END_DATE.minusDays(10));

            assertFalse(view.isHasPenalty());
            assertEquals(0, view.getDaysOverdue());
        }

        @Test
        @DisplayName("Same inputs always give the same answer")
        void deterministic() {
            DriverSubscription subscription = subscription(false, null);
            LocalDate today = END_DATE.plusDays(20);

            assertEquals(engine.computePenalty(subscription, today), engine.computePenalty(subscription, today));
        }
    }

    @Nested
    @DisplayName("Battery returned")
    class Returned {

        @Test
        @DisplayName("A returned battery owes nothing however late it is")
        void returnedOwesNothing() {
            PenaltyView view = engine.computePenalty(
                subscription(true, Instant.parse("2024-06-20T06:00:00Z")), END_DATE.plusDays(40));

            assertFalse(view.isHasPenalty());
            assertEquals(new BigDecimal("0.00"), view.getTotalAmount());
            assertFalse(view.isDegraded());
        }

        @Test
        @DisplayName("Returned flag without a timestamp is reported as degraded")
        void incoherentFlags() {
            PenaltyView view = engine.computePenalty(subscription(true, null), END_DATE.plusDays(10));

            assertFalse(view.isHasPenalty());
            assertTrue(view.isDegraded());
            assertEquals(1.0, registry.counter("ledger.integrity.violations", "kind", "custody_flags").count());
        }
    }

    @Test
    @DisplayName("Custom grace and rate are applied")
    void customPolicy() {
        LedgerProperties properties = new LedgerProperties();
        properties.getPenalty().setGracePeriodDays(0);
        properties.getPenalty().setDailyRate(new BigDecimal("50"));
        PenaltyEngine strict = new PenaltyEngine(properties, new LedgerMetrics(registry));

        PenaltyView view = strict.computePenalty(subscription(false, null), END_DATE.plusDays(3));

        assertEquals(3, view.getDaysOverdue());
        assertEquals(new BigDecimal("150.00"), view.getTotalAmount());
    }

    @Test
    @DisplayName("Days overdue helper")
    void daysOverdueHelper() {
        assertEquals(0, PenaltyEngine.daysOverdue(END_DATE, END_DATE, 4));
        assertEquals(2, PenaltyEngine.daysOverdue(END_DATE, END_DATE.plusDays(6), 4));
        assertEquals(26, PenaltyEngine.daysOverdue(END_DATE, END_DATE.plusDays(30), 4));
    }
}
