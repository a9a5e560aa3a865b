package com.batterysmart.swap_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A leave request was approved or rejected.
 */
@Value
public class LeaveDecidedEvent implements LedgerEvent {
    UUID eventId;
    String eventType;
    UUID leaveRequestId;
    UUID driverId;
    LocalDate startDate;
    LocalDate endDate;
    int days;
    String decidedBy;
    Instant occurredAt;

    public static final String APPROVED = "LeaveApproved";
    public static final String REJECTED = "LeaveRejected";

    @Override
    public String getAggregateType() {
        return AGGREGATE_LEAVE;
    }

    @Override
    public UUID getAggregateId() {
        return leaveRequestId;
    }
}
