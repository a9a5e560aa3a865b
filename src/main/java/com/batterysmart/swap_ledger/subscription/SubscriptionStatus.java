package com.batterysmart.swap_ledger.subscription;

/**
 * Lifecycle of a driver subscription.
 *
 * ACTIVE -> EXPIRED | CANCELLED | SUSPENDED
 * SUSPENDED -> ACTIVE (explicit resume only) | CANCELLED | EXPIRED
 * EXPIRED and CANCELLED are terminal.
 */
public enum SubscriptionStatus {
    ACTIVE,
    EXPIRED,
    CANCELLED,
    SUSPENDED;

    public boolean isTerminal() {
        return this == EXPIRED || this == CANCELLED;
    }
}
