package com.batterysmart.swap_ledger.observability;

import com.batterysmart.swap_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox backlog gauges and publish counters.
 *
 * Gauge values are cached and refreshed by {@link MetricsScheduler}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished ledger events")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished ledger event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", deadLetterCount, AtomicLong::get)
                .description("Ledger events that exceeded max publish attempts")
                .tag("status", "failed")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            backlogSize.set(outboxRepository.countUnpublished());

            outboxRepository.findOldestUnpublishedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestEventAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, clock.instant()).getSeconds())),
                            () -> oldestEventAgeSeconds.set(0)
                    );

            deadLetterCount.set(outboxRepository.countDeadLetters(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLetters={}",
                    backlogSize.get(), oldestEventAgeSeconds.get(), deadLetterCount.get());
        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public void recordEventPublished(String eventType, String topic) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "topic", topic,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType, String topic) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "topic", topic,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
