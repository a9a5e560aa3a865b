package com.batterysmart.swap_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger fact waiting to be published to Kafka.
 *
 * Written in the same transaction as the swap, invoice, penalty or leave
 * change it describes; published later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    String correlationId;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String payload, String correlationId, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            correlationId,
            null  // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean hasExceededRetries(int maxRetries) {
        return publishedAt == null && retryCount >= maxRetries;
    }
}
