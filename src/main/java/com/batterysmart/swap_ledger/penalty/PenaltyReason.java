package com.batterysmart.swap_ledger.penalty;

public enum PenaltyReason {
    BATTERY_NOT_RETURNED,
    LATE_RETURN,
    DAMAGE
}
