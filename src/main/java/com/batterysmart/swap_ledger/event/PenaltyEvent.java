package com.batterysmart.swap_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A penalty record was assessed, paid or waived.
 */
@Value
public class PenaltyEvent implements LedgerEvent {
    UUID eventId;
    String eventType;
    UUID penaltyId;
    UUID subscriptionId;
    UUID driverId;
    int daysOverdue;
    BigDecimal totalAmount;
    String status;
    Instant occurredAt;

    public static final String ASSESSED = "PenaltyAssessed";
    public static final String PAID = "PenaltyPaid";
    public static final String WAIVED = "PenaltyWaived";

    @Override
    public String getAggregateType() {
        return AGGREGATE_PENALTY;
    }

    @Override
    public UUID getAggregateId() {
        return penaltyId;
    }
}
