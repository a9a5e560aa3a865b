package com.batterysmart.swap_ledger.swap;

/**
 * COMPLETED is the state every recorded swap starts in, whatever its
 * billing outcome. FAILED marks an operational failure reported afterwards
 * (e.g. the station rejected the exchange); REFUNDED a reversed charge.
 */
public enum SwapStatus {
    COMPLETED,
    FAILED,
    REFUNDED;

    public boolean canTransitionTo(SwapStatus target) {
        return this == COMPLETED && (target == FAILED || target == REFUNDED);
    }
}
