package com.batterysmart.swap_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A subscription started, was cancelled, suspended or expired.
 */
@Value
public class SubscriptionChangedEvent implements LedgerEvent {
    UUID eventId;
    String eventType;
    UUID subscriptionId;
    UUID driverId;
    String planCode;
    String status;
    LocalDate startDate;
    LocalDate endDate;
    Instant occurredAt;

    public static final String STARTED = "SubscriptionStarted";
    public static final String CANCELLED = "SubscriptionCancelled";
    public static final String SUSPENDED = "SubscriptionSuspended";
    public static final String EXPIRED = "SubscriptionExpired";

    @Override
    public String getAggregateType() {
        return AGGREGATE_SUBSCRIPTION;
    }

    @Override
    public UUID getAggregateId() {
        return subscriptionId;
    }
}
