package com.batterysmart.swap_ledger.penalty;

import com.batterysmart.swap_ledger.exception.IllegalTransitionException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A materialized penalty. At most one per subscription and reason.
 */
@Value
public class PenaltyRecord {
    UUID id;
    UUID driverId;
    UUID subscriptionId;
    PenaltyReason reason;
    int daysOverdue;
    BigDecimal dailyRate;
    BigDecimal totalAmount;
    PenaltyStatus status;
    Instant settledAt;
    String settledBy;
    Instant createdAt;
    Instant updatedAt;

    public PenaltyRecord markPaid(String actor, Instant now) {
        return settle(PenaltyStatus.PAID, actor, now);
    }

    public PenaltyRecord waive(String actor, Instant now) {
        return settle(PenaltyStatus.WAIVED, actor, now);
    }

    private PenaltyRecord settle(PenaltyStatus target, String actor, Instant now) {
        if (status.isFinal()) {
            throw new IllegalTransitionException("penalty " + id, status, target);
        }
        return new PenaltyRecord(id, driverId, subscriptionId, reason, daysOverdue, dailyRate, totalAmount,
            target, now, actor, createdAt, now);
    }
}
