package com.batterysmart.swap_ledger.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "processed_events")
@IdClass(ProcessedEventEntity.Key.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessedEventEntity {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Id
    @Column(name = "consumer_group", nullable = false, updatable = false, length = 100)
    private String consumerGroup;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "station_code", length = 64)
    private String stationCode;

    @Column(name = "driver_id")
    private UUID driverId;

    @Column(name = "swap_id")
    private UUID swapId;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", nullable = false, length = 20)
    private ProcessedEvent.ProcessingResult processingResult;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    static ProcessedEventEntity fromDomain(ProcessedEvent event) {
        return new ProcessedEventEntity(event.getEventId(), event.getConsumerGroup(), event.getEventType(),
            event.getStationCode(), event.getDriverId(), event.getSwapId(), event.getProcessedAt(),
            event.getResult(), event.getErrorMessage());
    }

    public ProcessedEvent toDomain() {
        return new ProcessedEvent(eventId, consumerGroup, eventType, stationCode, driverId, swapId,
            processedAt, processingResult, errorMessage);
    }

    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {
        private UUID eventId;
        private String consumerGroup;
    }
}
