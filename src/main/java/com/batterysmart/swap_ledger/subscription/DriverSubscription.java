package com.batterysmart.swap_ledger.subscription;

import com.batterysmart.swap_ledger.exception.IllegalTransitionException;
import com.batterysmart.swap_ledger.plan.SubscriptionPlan;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * A driver's subscription to a plan, with the custody state of the battery
 * the driver currently holds under it.
 *
 * Immutable: every transition returns a new instance stamped with the
 * caller's clock.
 */
@Value
public class DriverSubscription {
    UUID id;
    UUID driverId;
    UUID planId;
    LocalDate startDate;
    LocalDate endDate;
    SubscriptionStatus status;
    int swapsUsed;
    boolean autoRenew;
    String batteryId;
    boolean batteryReturned;
    boolean misplaced;
    Instant batteryReturnedAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Starts a subscription today. The plan's validity is counted from the
     * start date, so a 30-day plan bought on the 1st ends on the 31st.
     */
    public static DriverSubscription start(UUID driverId, SubscriptionPlan plan, LocalDate today,
                                           boolean autoRenew, Instant now) {
        return new DriverSubscription(
            UUID.randomUUID(),
            driverId,
            plan.getId(),
            today,
            today.plusDays(plan.getValidityDays()),
            SubscriptionStatus.ACTIVE,
            0,
            autoRenew,
            null,
            false,
            false,
            null,
            now,
            now
        );
    }

    public boolean isActiveOn(LocalDate today) {
        return status == SubscriptionStatus.ACTIVE && !endDate.isBefore(today);
    }

    public long daysRemaining(LocalDate today) {
        return Math.max(0, ChronoUnit.DAYS.between(today, endDate));
    }

    public boolean holdsBattery() {
        return batteryId != null && !batteryReturned;
    }

    /**
     * Returned flag and return timestamp must agree.
     */
    public boolean isCustodyCoherent() {
        return batteryReturned == (batteryReturnedAt != null);
    }

    /**
     * Counts one more swap against the plan. Swaps beyond the quota are
     * counted too; whether they are charged is decided by {@link CoverageRule}.
     */
    public DriverSubscription recordSwap(Instant now) {
        if (status != SubscriptionStatus.ACTIVE) {
            throw new IllegalTransitionException("subscription " + id, status, "swap");
        }
        return copy(status, swapsUsed + 1, batteryId, batteryReturned, misplaced, batteryReturnedAt, now);
    }

    public DriverSubscription assignBattery(String newBatteryId, Instant now) {
        return copy(status, swapsUsed, newBatteryId, false, false, null, now);
    }

    /**
     * Idempotent: a battery already returned keeps its original timestamp.
     */
    public DriverSubscription markReturned(Instant at) {
        if (batteryReturned) {
            return this;
        }
        return copy(status, swapsUsed, batteryId, true, false, at, at);
    }

    public DriverSubscription markMisplaced(Instant now) {
        if (batteryReturned) {
            throw new IllegalTransitionException("battery " + batteryId, "RETURNED", "MISPLACED");
        }
        return copy(status, swapsUsed, batteryId, false, true, null, now);
    }

    public DriverSubscription cancel(Instant now) {
        return transitionTo(SubscriptionStatus.CANCELLED, now);
    }

    public DriverSubscription suspend(Instant now) {
        return transitionTo(SubscriptionStatus.SUSPENDED, now);
    }

    public DriverSubscription resume(Instant now) {
        return transitionTo(SubscriptionStatus.ACTIVE, now);
    }

    public DriverSubscription expire(Instant now) {
        return transitionTo(SubscriptionStatus.EXPIRED, now);
    }

    /**
     * Administrative correction. The only path on which swaps_used goes down.
     */
    public DriverSubscription resetUsage(Instant now) {
        return copy(status, 0, batteryId, batteryReturned, misplaced, batteryReturnedAt, now);
    }

    /**
     * Out of SUSPENDED only an operator's resume or cancel is allowed.
     * EXPIRED and CANCELLED are final.
     */
    public boolean canTransitionTo(SubscriptionStatus target) {
        return switch (status) {
            case ACTIVE -> target == SubscriptionStatus.EXPIRED
                || target == SubscriptionStatus.CANCELLED
                || target == SubscriptionStatus.SUSPENDED;
            case SUSPENDED -> target == SubscriptionStatus.ACTIVE
                || target == SubscriptionStatus.CANCELLED;
            case EXPIRED, CANCELLED -> false;
        };
    }

    private DriverSubscription transitionTo(SubscriptionStatus target, Instant now) {
        if (!canTransitionTo(target)) {
            throw new IllegalTransitionException("subscription " + id, status, target);
        }
        return copy(target, swapsUsed, batteryId, batteryReturned, misplaced, batteryReturnedAt, now);
    }

    private DriverSubscription copy(SubscriptionStatus newStatus, int newSwapsUsed, String newBatteryId,
                                    boolean returned, boolean isMisplaced, Instant returnedAt, Instant now) {
        return new DriverSubscription(
            id,
            driverId,
            planId,
            startDate,
            endDate,
            newStatus,
            newSwapsUsed,
            autoRenew,
            newBatteryId,
            returned,
            isMisplaced,
            returnedAt,
            createdAt,
            now
        );
    }
}
