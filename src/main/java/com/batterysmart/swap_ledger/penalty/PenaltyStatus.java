package com.batterysmart.swap_ledger.penalty;

/**
 * PENDING records follow the computed figures; PAID and WAIVED are final.
 */
public enum PenaltyStatus {
    PENDING,
    PAID,
    WAIVED;

    public boolean isFinal() {
        return this != PENDING;
    }
}
