package com.batterysmart.swap_ledger.outbox;

import com.batterysmart.swap_ledger.driver.Driver;
import com.batterysmart.swap_ledger.event.InvoiceIssuedEvent;
import com.batterysmart.swap_ledger.event.LedgerEvent;
import com.batterysmart.swap_ledger.event.SwapRecordedEvent;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import com.batterysmart.swap_ledger.station.Station;
import com.batterysmart.swap_ledger.support.LedgerIntegrationTest;
import com.batterysmart.swap_ledger.swap.RecordSwapCommand;
import com.batterysmart.swap_ledger.swap.SwapProcessor;
import com.batterysmart.swap_ledger.swap.SwapResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox writes, claims and retry bookkeeping.
 */
class OutboxServiceTest extends LedgerIntegrationTest {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private SwapProcessor swapProcessor;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private Driver driver;
    private Station station;

    @BeforeEach
    void setUp() {
        driver = registerDriver();
        station = createStation("BLR-HSR-01", 12.9116, 77.6389, 8);
    }

    private SwapResult payPerSwap() {
        return swapProcessor.recordSwap(RecordSwapCommand.builder()
            .driverId(driver.getId())
            .stationId(station.getId())
            .oldBatteryId("BAT-OLD")
            .newBatteryId("BAT-NEW")
            .oldChargePct(8)
            .newChargePct(97)
            .idempotencyKey(UUID.randomUUID().toString())
            .build());
    }

    private OutboxEvent saveSwapEvent(UUID swapId) {
        return transactionTemplate.execute(status -> outboxService.saveEvent(new SwapRecordedEvent(
            UUID.randomUUID(), swapId, driver.getId(), station.getId(), null, "BAT-NEW",
            true, BigDecimal.ZERO, null, 3, Instant.now(clock))));
    }

    @Test
    @DisplayName("A charged swap writes its swap and invoice events with the ledger change")
    void chargedSwapWritesBothEvents() throws Exception {
        printTestHeader("Charged Swap Events");

        SwapResult result = payPerSwap();
        printOutput("Swap", result.getSwapId());

        List<OutboxEvent> swapEvents = outboxService.getEventsForAggregate(LedgerEvent.AGGREGATE_SWAP, result.getSwapId());
        assertEquals(1, swapEvents.size());
        OutboxEvent swapEvent = swapEvents.get(0);
        assertEquals(SwapRecordedEvent.EVENT_TYPE, swapEvent.getEventType());
        assertFalse(swapEvent.isPublished());
        assertEquals(0, swapEvent.getRetryCount());
        assertNotNull(swapEvent.getSequenceNumber());

        JsonNode payload = objectMapper.readTree(swapEvent.getPayload());
        assertEquals(result.getSwapId().toString(), payload.get("swapId").asText());
        assertEquals(driver.getId().toString(), payload.get("driverId").asText());
        assertFalse(payload.get("covered").asBoolean());
        assertEquals(result.getInvoiceNumber(), payload.get("invoiceNumber").asText());
        assertNull(result.getSwapsRemaining());
        assertTrue(payload.get("swapsRemaining").isNull(), "pay-per-swap has no quota to report");

        Integer invoiceEvents = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM outbox_events WHERE event_type = ?", Integer.class, InvoiceIssuedEvent.EVENT_TYPE);
        assertEquals(1, invoiceEvents);

        printSuccess("Swap and invoice events written together");
    }

    @Test
    @DisplayName("A rejected swap leaves no event behind")
    void rejectedSwapWritesNothing() {
        printTestHeader("Rejected Swap Events");

        assertThrows(NotFoundException.class, () -> swapProcessor.recordSwap(RecordSwapCommand.builder()
            .driverId(driver.getId())
            .stationCode("NOPE-99")
            .oldBatteryId("BAT-OLD")
            .newBatteryId("BAT-NEW")
            .oldChargePct(10)
            .newChargePct(95)
            .idempotencyKey(UUID.randomUUID().toString())
            .build()));

        assertEquals(0, outboxService.countUnpublished());
        printSuccess("No orphan events");
    }

    @Test
    @DisplayName("Saving an event outside a transaction is refused")
    void saveRequiresTransaction() {
        printTestHeader("Mandatory Transaction");

        SwapRecordedEvent event = new SwapRecordedEvent(UUID.randomUUID(), UUID.randomUUID(), driver.getId(),
            station.getId(), null, "BAT-NEW", true, BigDecimal.ZERO, null, 3, Instant.now(clock));

        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(event));
        printSuccess("Outbox writes only join an existing transaction");
    }

    @Test
    @DisplayName("Claimed events come back in write order and leave the backlog once published")
    void claimAndPublish() {
        printTestHeader("Claim and Mark Published");

        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        saveSwapEvent(first);
        saveSwapEvent(second);
        assertEquals(2, outboxService.countUnpublished());

        List<OutboxEvent> claimed = outboxService.claimUnpublishedEvents(10, 5);
        assertEquals(2, claimed.size());
        assertEquals(first, claimed.get(0).getAggregateId());
        assertEquals(second, claimed.get(1).getAggregateId());

        outboxService.markPublished(claimed.get(0).getId());

        assertEquals(1, outboxService.countUnpublished());
        List<OutboxEvent> remaining = outboxService.claimUnpublishedEvents(10, 5);
        assertEquals(1, remaining.size());
        assertEquals(second, remaining.get(0).getAggregateId());

        OutboxEventEntity published = outboxEventRepository.findById(claimed.get(0).getId()).orElseThrow();
        assertNotNull(published.getPublishedAt());
        printSuccess("Backlog shrinks as events are published");
    }

    @Test
    @DisplayName("Failures count retries and park the event once the limit is reached")
    void failuresAreCounted() {
        printTestHeader("Retry Bookkeeping");

        OutboxEvent event = saveSwapEvent(UUID.randomUUID());

        outboxService.markFailed(event.getId(), "Broker not available");
        outboxService.markFailed(event.getId(), "Broker not available");
        outboxService.markFailed(event.getId(), "Broker not available");

        OutboxEventEntity entity = outboxEventRepository.findById(event.getId()).orElseThrow();
        printOutput("Retry count", entity.getRetryCount());
        assertEquals(3, entity.getRetryCount());
        assertEquals("Broker not available", entity.getLastError());
        assertNull(entity.getPublishedAt());

        assertTrue(outboxService.claimUnpublishedEvents(10, 3).isEmpty());
        assertEquals(1, outboxService.claimUnpublishedEvents(10, 5).size());
        assertEquals(1, outboxEventRepository.countDeadLetters(3));

        printSuccess("Parked events stay in the table");
    }
}
