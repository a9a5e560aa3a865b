package com.batterysmart.swap_ledger.penalty;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Penalty owed on a subscription as of a given date. {@code degraded} marks
 * a result computed over inconsistent custody flags.
 */
@Value
public class PenaltyView {
    boolean hasPenalty;
    int daysOverdue;
    BigDecimal dailyRate;
    BigDecimal totalAmount;
    int gracePeriodDays;
    boolean degraded;

    static PenaltyView none(BigDecimal dailyRate, int gracePeriodDays, boolean degraded) {
        return new PenaltyView(false, 0, dailyRate, BigDecimal.ZERO.setScale(2), gracePeriodDays, degraded);
    }
}
