package com.batterysmart.swap_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled a station report. One per
 * (eventId, consumerGroup).
 *
 * {@code driverId} is null when the report named nobody we know, and
 * {@code swapId} is set only when the report produced a swap.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String consumerGroup;
    String eventType;
    String stationCode;
    UUID driverId;
    UUID swapId;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED,
        /** Rejected by the ledger; redelivery would fail the same way. */
        REJECTED
    }

    static ProcessedEvent recorded(InboundMessage message, UUID driverId, UUID swapId, Instant now) {
        return new ProcessedEvent(message.getEventId(), message.getConsumerGroup(), message.getEventType(),
            message.getStationCode(), driverId, swapId, now, ProcessingResult.SUCCESS, null);
    }

    static ProcessedEvent unrecorded(InboundMessage message, UUID driverId, ProcessingResult result,
                                     String reason, Instant now) {
        return new ProcessedEvent(message.getEventId(), message.getConsumerGroup(), message.getEventType(),
            message.getStationCode(), driverId, null, now, result, truncate(reason));
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 1000) {
            return message;
        }
        return message.substring(0, 1000);
    }
}
