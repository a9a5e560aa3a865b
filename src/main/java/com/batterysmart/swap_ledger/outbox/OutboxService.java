package com.batterysmart.swap_ledger.outbox;

import com.batterysmart.swap_ledger.event.LedgerEvent;
import com.batterysmart.swap_ledger.observability.CorrelationContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the outbox inside the caller's transaction.
 *
 * If the swap, invoice, penalty or leave change commits, its event is
 * guaranteed to exist; if it rolls back, so does the event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Must run inside an existing transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(LedgerEvent event) {
        String correlationId = CorrelationContext.hasCorrelationId()
                ? CorrelationContext.getCorrelationId()
                : null;

        OutboxEvent outboxEvent = OutboxEvent.create(
                event.getAggregateType(),
                event.getAggregateId(),
                event.getEventType(),
                serializePayload(event),
                correlationId,
                clock.instant());

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                event.getEventType(), event.getAggregateType(), event.getAggregateId());

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> claimUnpublishedEvents(int limit, int maxRetries) {
        return repository.claimUnpublished(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Outbox event {} failed to publish (attempt #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
