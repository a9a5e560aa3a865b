package com.batterysmart.swap_ledger.outbox;

import com.batterysmart.swap_ledger.event.LedgerEvent;
import com.batterysmart.swap_ledger.observability.CorrelationContext;
import com.batterysmart.swap_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Polls the outbox and publishes ledger events to Kafka.
 *
 * Sends are synchronous so events of one aggregate keep their order; the
 * aggregate id is the record key. Invoices go to the billing topic, every
 * other aggregate to the ledger events topic. Events that exhaust their
 * retries stay in the table for manual replay.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${kafka.topic.billing:billing-invoices}")
    private String billingTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.claimUnpublishedEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Publishing {} outbox events", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = topicFor(event);
        ProducerRecord<String, String> record = new ProducerRecord<>(
                topic, event.getAggregateId().toString(), event.getPayload());
        record.headers().add("eventType", event.getEventType().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                    event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }

        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType(), topic);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType(), topic);
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType(), topic);

            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} exhausted {} publish attempts and is parked: eventType={}, aggregateId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    String topicFor(OutboxEvent event) {
        return LedgerEvent.AGGREGATE_INVOICE.equals(event.getAggregateType())
                ? billingTopic
                : ledgerEventsTopic;
    }

    /**
     * Runs one publishing pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
