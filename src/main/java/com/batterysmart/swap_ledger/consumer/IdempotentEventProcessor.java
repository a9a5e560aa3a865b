package com.batterysmart.swap_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs a swap handler at most once per (message, consumer group).
 *
 * The swap and the processed_events row commit together, so a crash
 * between them leaves neither and the redelivered message runs again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    /**
     * @param handler records the swap and returns its id
     * @return true if the handler ran, false if the message was seen before
     */
    @Transactional
    public boolean processEvent(InboundMessage message, UUID driverId, Supplier<UUID> handler) {
        if (isAlreadyProcessed(message)) {
            log.info("Message {} already processed by consumer group {}, skipping",
                message.getEventId(), message.getConsumerGroup());
            return false;
        }

        UUID swapId = handler.get();

        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.recorded(message, driverId, swapId, clock.instant())));
        log.debug("Message {} from {} produced swap {}", message.getEventId(), message.getStationCode(), swapId);
        return true;
    }

    /**
     * Marks a message the ledger refused so that redelivery does not retry
     * it. Runs in its own transaction, after the handler's has rolled back.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordRejected(InboundMessage message, UUID driverId, String reason) {
        finish(message, driverId, ProcessedEvent.ProcessingResult.REJECTED, reason);
    }

    /**
     * Marks a message that never reached the ledger, such as one naming an
     * unknown driver.
     */
    @Transactional
    public void skipEvent(InboundMessage message, String reason) {
        finish(message, null, ProcessedEvent.ProcessingResult.SKIPPED, reason);
    }

    public boolean isAlreadyProcessed(InboundMessage message) {
        return repository.existsByEventIdAndConsumerGroup(message.getEventId(), message.getConsumerGroup());
    }

    private void finish(InboundMessage message, UUID driverId, ProcessedEvent.ProcessingResult result,
                        String reason) {
        if (isAlreadyProcessed(message)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.unrecorded(message, driverId, result, reason, clock.instant())));
        log.debug("Message {} {} by consumer group {}: {}",
            message.getEventId(), result, message.getConsumerGroup(), reason);
    }
}
