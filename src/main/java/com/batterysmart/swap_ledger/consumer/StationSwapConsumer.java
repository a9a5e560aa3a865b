package com.batterysmart.swap_ledger.consumer;

import com.batterysmart.swap_ledger.driver.DriverService;
import com.batterysmart.swap_ledger.exception.ConflictException;
import com.batterysmart.swap_ledger.exception.LedgerException;
import com.batterysmart.swap_ledger.observability.CorrelationContext;
import com.batterysmart.swap_ledger.observability.LedgerMetrics;
import com.batterysmart.swap_ledger.swap.RecordSwapCommand;
import com.batterysmart.swap_ledger.swap.SwapProcessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Feeds swaps reported by stations into the ledger.
 *
 * Offsets are committed only after the report has been recorded, skipped
 * or rejected. Retryable conflicts are rethrown so the message is
 * redelivered. Each report is also recorded under an idempotency key
 * derived from its id, so a replay after a lost processed_events row still
 * returns the original swap.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class StationSwapConsumer {

    static final String CONSUMER_GROUP = "station-swap-consumer";
    static final String EVENT_TYPE = "StationSwapReported";
    static final String IDEMPOTENCY_PREFIX = "station-report:";

    private final IdempotentEventProcessor eventProcessor;
    private final SwapProcessor swapProcessor;
    private final DriverService driverService;
    private final LedgerMetrics metrics;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.station-swaps:station-swaps}",
        groupId = "${spring.kafka.consumer.group-id:swap-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received station report: partition={}, offset={}, key={}",
            record.partition(), record.offset(), record.key());

        StationSwapReport report = parse(record.value());
        if (report == null) {
            metrics.recordStationReport("unparseable");
            ack.acknowledge();
            return;
        }

        CorrelationContext.setCorrelationId(IDEMPOTENCY_PREFIX + report.getReportId());
        CorrelationContext.tagStation(report.getStationCode());
        try {
            handle(report);
            ack.acknowledge();
        } finally {
            CorrelationContext.clear();
        }
    }

    void handle(StationSwapReport report) {
        InboundMessage message = InboundMessage.of(report.getReportId(), EVENT_TYPE, CONSUMER_GROUP,
            report.getStationCode());
        UUID driverId;
        try {
            driverId = resolveDriver(report);
        } catch (LedgerException e) {
            log.warn("Station report {} names an unknown driver: {}", report.getReportId(), e.getMessage());
            eventProcessor.skipEvent(message, e.getMessage());
            metrics.recordStationReport("unknown_driver");
            return;
        }

        try {
            boolean processed = eventProcessor.processEvent(message, driverId,
                () -> swapProcessor.recordSwap(toCommand(report, driverId)).getSwapId());
            metrics.recordStationReport(processed ? "recorded" : "duplicate");
        } catch (ConflictException e) {
            if (e.isRetryable()) {
                metrics.recordStationReport("retry");
                throw e;
            }
            reject(message, driverId, e);
        } catch (LedgerException e) {
            reject(message, driverId, e);
        }
    }

    private void reject(InboundMessage message, UUID driverId, LedgerException e) {
        log.warn("Station report {} rejected: {}", message.getEventId(), e.getMessage());
        eventProcessor.recordRejected(message, driverId, e.getErrorCode() + ": " + e.getMessage());
        metrics.recordStationReport("rejected");
    }

    private UUID resolveDriver(StationSwapReport report) {
        if (report.getDriverId() != null) {
            return driverService.getDriver(report.getDriverId()).getId();
        }
        return driverService.getDriver(report.getDriverPhone()).getId();
    }

    private static RecordSwapCommand toCommand(StationSwapReport report, UUID driverId) {
        return RecordSwapCommand.builder()
            .driverId(driverId)
            .stationCode(report.getStationCode())
            .oldBatteryId(report.getOldBatteryId())
            .newBatteryId(report.getNewBatteryId())
            .oldChargePct(report.getOldChargePct())
            .newChargePct(report.getNewChargePct())
            .idempotencyKey(IDEMPOTENCY_PREFIX + report.getReportId())
            .build();
    }

    private StationSwapReport parse(String json) {
        try {
            StationSwapReport report = objectMapper.readValue(json, StationSwapReport.class);
            if (report.getReportId() == null) {
                log.warn("Station report without report_id, skipping: {}", json);
                return null;
            }
            return report;
        } catch (JsonProcessingException e) {
            log.warn("Could not parse station report, skipping: {}", e.getOriginalMessage());
            return null;
        }
    }
}
