package com.batterysmart.swap_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A battery exchange was written to the ledger, covered or charged.
 */
@Value
public class SwapRecordedEvent implements LedgerEvent {
    UUID eventId;
    UUID swapId;
    UUID driverId;
    UUID stationId;
    UUID subscriptionId;
    String newBatteryId;
    boolean covered;
    BigDecimal chargeAmount;
    String invoiceNumber;
    /** Null for pay-per-swap swaps, -1 on unlimited plans. */
    Integer swapsRemaining;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SwapRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_SWAP;
    }

    @Override
    public UUID getAggregateId() {
        return swapId;
    }
}
