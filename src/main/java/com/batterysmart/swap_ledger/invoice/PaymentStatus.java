package com.batterysmart.swap_ledger.invoice;

/**
 * Payment state of an invoice. PENDING moves to PAID or FAILED; both are final.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED;

    public boolean canTransitionTo(PaymentStatus target) {
        return this == PENDING && (target == PAID || target == FAILED);
    }
}
