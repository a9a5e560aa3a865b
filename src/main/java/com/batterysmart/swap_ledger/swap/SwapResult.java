package com.batterysmart.swap_ledger.swap;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Outcome of recording a swap.
 *
 * {@code swapsRemaining} is null when no subscription was involved and -1
 * for unlimited plans. {@code replayed} marks an answer served from an
 * earlier request with the same idempotency key.
 */
@Value
public class SwapResult {

    public enum Coverage {
        /** Counted against the plan at no charge. */
        COVERED,
        /** Counted against the plan and billed at the plan's extra swap price. */
        EXTRA_SWAP,
        /** No current subscription; billed at the pay-per-swap price. */
        PAY_PER_SWAP
    }

    UUID swapId;
    UUID driverId;
    UUID stationId;
    UUID subscriptionId;
    boolean covered;
    Coverage coverage;
    BigDecimal chargeAmount;
    BigDecimal taxAmount;
    BigDecimal totalAmount;
    String invoiceNumber;
    Integer swapsRemaining;
    boolean replayed;
}
