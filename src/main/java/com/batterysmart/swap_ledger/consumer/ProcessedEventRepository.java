package com.batterysmart.swap_ledger.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, ProcessedEventEntity.Key> {

    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    Optional<ProcessedEventEntity> findByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    long countByConsumerGroupAndProcessingResult(String consumerGroup, ProcessedEvent.ProcessingResult result);
}
