package com.batterysmart.swap_ledger.leave;

/**
 * PENDING is the only state with outgoing transitions.
 */
public enum LeaveStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public boolean isFinal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(LeaveStatus target) {
        return this == PENDING && target != PENDING;
    }
}
