package com.batterysmart.swap_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An invoice number was allocated and the invoice persisted.
 */
@Value
public class InvoiceIssuedEvent implements LedgerEvent {
    UUID eventId;
    UUID invoiceId;
    String invoiceNumber;
    UUID driverId;
    String invoiceType;
    BigDecimal amount;
    BigDecimal taxAmount;
    BigDecimal totalAmount;
    String paymentStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceIssued";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_INVOICE;
    }

    @Override
    public UUID getAggregateId() {
        return invoiceId;
    }
}
