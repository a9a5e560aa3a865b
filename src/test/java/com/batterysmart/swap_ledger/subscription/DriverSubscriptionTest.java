package com.batterysmart.swap_ledger.subscription;

import com.batterysmart.swap_ledger.exception.IllegalTransitionException;
import com.batterysmart.swap_ledger.plan.SubscriptionPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DriverSubscriptionTest {

    private static final Instant NOW = Instant.parse("2024-06-15T04:30:00Z");

    private static DriverSubscription active() {
        SubscriptionPlan plan = new SubscriptionPlan(UUID.randomUUID(), "MONTHLY", "Monthly Plan",
            new BigDecimal("999.00"), 30, 60, 2, new BigDecimal("35.00"), new BigDecimal("18.00"), null, true,
            NOW, NOW);
        return DriverSubscription.start(UUID.randomUUID(), plan, LocalDate.of(2024, 6, 15), false, NOW);
    }

    @Test
    @DisplayName("An active subscription can expire, be cancelled or be suspended")
    void fromActive() {
        assertEquals(SubscriptionStatus.EXPIRED, active().expire(NOW).getStatus());
        assertEquals(SubscriptionStatus.CANCELLED, active().cancel(NOW).getStatus());
        assertEquals(SubscriptionStatus.SUSPENDED, active().suspend(NOW).getStatus());
    }

    @Test
    @DisplayName("A suspended subscription can only be resumed or cancelled")
    void fromSuspended() {
        DriverSubscription suspended = active().suspend(NOW);

        assertEquals(SubscriptionStatus.ACTIVE, suspended.resume(NOW).getStatus());
        assertEquals(SubscriptionStatus.CANCELLED, suspended.cancel(NOW).getStatus());
        assertThrows(IllegalTransitionException.class, () -> suspended.expire(NOW));
        assertThrows(IllegalTransitionException.class, () -> suspended.suspend(NOW));
    }

    @Test
    @DisplayName("Expired and cancelled subscriptions never come back")
    void finalStates() {
        DriverSubscription expired = active().expire(NOW);
        DriverSubscription cancelled = active().cancel(NOW);

        for (DriverSubscription done : new DriverSubscription[]{expired, cancelled}) {
            for (SubscriptionStatus target : SubscriptionStatus.values()) {
                assertFalse(done.canTransitionTo(target), done.getStatus() + " -> " + target);
            }
        }
        assertThrows(IllegalTransitionException.class, () -> expired.resume(NOW));
        assertThrows(IllegalTransitionException.class, () -> cancelled.resume(NOW));
    }

    @Test
    @DisplayName("An active subscription cannot be resumed")
    void resumeNeedsSuspension() {
        assertThrows(IllegalTransitionException.class, () -> active().resume(NOW));
    }
}
