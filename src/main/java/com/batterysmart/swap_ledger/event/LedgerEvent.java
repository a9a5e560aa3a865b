package com.batterysmart.swap_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact the ledger publishes through the outbox.
 *
 * The event id is what consumers deduplicate on; the aggregate id is the
 * Kafka record key.
 */
public interface LedgerEvent {

    String AGGREGATE_SWAP = "Swap";
    String AGGREGATE_INVOICE = "Invoice";
    String AGGREGATE_SUBSCRIPTION = "Subscription";
    String AGGREGATE_PENALTY = "Penalty";
    String AGGREGATE_LEAVE = "LeaveRequest";

    UUID getEventId();

    String getEventType();

    @JsonIgnore
    String getAggregateType();

    @JsonIgnore
    UUID getAggregateId();

    Instant getOccurredAt();
}
