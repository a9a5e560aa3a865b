package com.batterysmart.swap_ledger.consumer;

import com.batterysmart.swap_ledger.driver.Driver;
import com.batterysmart.swap_ledger.observability.LedgerMetrics;
import com.batterysmart.swap_ledger.subscription.EntitlementStore;
import com.batterysmart.swap_ledger.subscription.SubscriptionService;
import com.batterysmart.swap_ledger.support.LedgerIntegrationTest;
import com.batterysmart.swap_ledger.swap.SwapEventRepository;
import com.batterysmart.swap_ledger.swap.SwapProcessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the consumer directly; the Kafka listener itself is disabled for
 * integration tests.
 */
class StationSwapConsumerTest extends LedgerIntegrationTest {

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository processedEventRepository;

    @Autowired
    private SwapProcessor swapProcessor;

    @Autowired
    private SwapEventRepository swapRepository;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private EntitlementStore entitlementStore;

    @Autowired
    private LedgerMetrics metrics;

    @Autowired
    private ObjectMapper objectMapper;

    private StationSwapConsumer consumer;
    private Driver driver;

    @BeforeEach
    void setUp() {
        consumer = new StationSwapConsumer(eventProcessor, swapProcessor, driverService, metrics, objectMapper);
        driver = registerDriver();
        createStation("BLR-HSR-02", 12.9116, 77.6389, 8);
    }

    private StationSwapReport report(UUID reportId, String stationCode) {
        return StationSwapReport.builder()
            .reportId(reportId)
            .stationCode(stationCode)
            .driverPhone(driver.getPhoneNumber())
            .oldBatteryId("BAT-OLD-9")
            .newBatteryId("BAT-NEW-9")
            .oldChargePct(8)
            .newChargePct(99)
            .build();
    }

    private ProcessedEvent processed(UUID reportId) {
        return processedEventRepository.findByEventIdAndConsumerGroup(reportId, StationSwapConsumer.CONSUMER_GROUP)
            .map(ProcessedEventEntity::toDomain)
            .orElse(null);
    }

    private ProcessedEvent.ProcessingResult resultOf(UUID reportId) {
        ProcessedEvent event = processed(reportId);
        return event == null ? null : event.getResult();
    }

    @Test
    @DisplayName("A report is recorded once however often it is delivered")
    void duplicateDelivery() {
        printTestHeader("Duplicate station report");
        UUID subscriptionId = subscriptionService.subscribe(driver.getId(), "MONTHLY", false)
            .getSubscription().getId();
        UUID reportId = UUID.randomUUID();
        StationSwapReport report = report(reportId, "BLR-HSR-02");

        consumer.handle(report);
        consumer.handle(report);

        assertEquals(1, swapRepository.countByDriverId(driver.getId()));
        assertEquals(1, entitlementStore.getSubscription(subscriptionId).getSwapsUsed());
        ProcessedEvent processed = processed(reportId);
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, processed.getResult());
        assertEquals("BLR-HSR-02", processed.getStationCode());
        assertEquals(driver.getId(), processed.getDriverId());
        UUID swapId = jdbcTemplate.queryForObject(
            "SELECT id FROM swaps WHERE driver_id = ?", UUID.class, driver.getId());
        assertEquals(swapId, processed.getSwapId());
        printSuccess("Second delivery skipped");
    }

    @Test
    @DisplayName("A replay after the processed row is lost still returns the original swap")
    void replayAfterLostMarker() {
        UUID reportId = UUID.randomUUID();
        consumer.handle(report(reportId, "BLR-HSR-02"));
        jdbcTemplate.update("DELETE FROM processed_events WHERE event_id = ?", reportId);

        consumer.handle(report(reportId, "BLR-HSR-02"));

        assertEquals(1, swapRepository.countByDriverId(driver.getId()));
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, resultOf(reportId));
    }

    @Test
    @DisplayName("Reports for unknown drivers are skipped")
    void unknownDriver() {
        UUID reportId = UUID.randomUUID();
        StationSwapReport report = StationSwapReport.builder()
            .reportId(reportId)
            .stationCode("BLR-HSR-02")
            .driverPhone("9000000000")
            .oldBatteryId("BAT-1")
            .newBatteryId("BAT-2")
            .oldChargePct(5)
            .newChargePct(97)
            .build();

        consumer.handle(report);

        ProcessedEvent processed = processed(reportId);
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, processed.getResult());
        assertNull(processed.getDriverId());
        assertNull(processed.getSwapId());
    }

    @Test
    @DisplayName("Reports the ledger refuses are marked rejected and not retried")
    void rejected() {
        UUID reportId = UUID.randomUUID();

        consumer.handle(report(reportId, "NO-SUCH-STATION"));

        assertEquals(ProcessedEvent.ProcessingResult.REJECTED, resultOf(reportId));
        assertEquals(0, swapRepository.countByDriverId(driver.getId()));
        String message = processedEventRepository
            .findByEventIdAndConsumerGroup(reportId, StationSwapConsumer.CONSUMER_GROUP)
            .orElseThrow().toDomain().getErrorMessage();
        assertTrue(message.startsWith("NOT_FOUND"), message);
    }

    @Test
    @DisplayName("Unparseable messages are acknowledged and dropped")
    void unparseable() {
        AtomicInteger acks = new AtomicInteger();
        ConsumerRecord<String, String> record = new ConsumerRecord<>("station-swaps", 0, 0L, "key", "{not json");

        consumer.consume(record, acks::incrementAndGet);

        assertEquals(1, acks.get());
        assertEquals(0, swapRepository.countByDriverId(driver.getId()));
    }

    @Test
    @DisplayName("A JSON report off the topic is recorded and acknowledged")
    void fromJson() {
        AtomicInteger acks = new AtomicInteger();
        UUID reportId = UUID.randomUUID();
        String json = "{\"report_id\":\"" + reportId + "\",\"station_code\":\"BLR-HSR-02\","
            + "\"driver_id\":\"" + driver.getId() + "\",\"old_battery_id\":\"BAT-A\",\"new_battery_id\":\"BAT-B\","
            + "\"old_charge_pct\":11,\"new_charge_pct\":96,\"firmware\":\"2.1.0\"}";

        consumer.consume(new ConsumerRecord<>("station-swaps", 0, 1L, reportId.toString(), json), acks::incrementAndGet);

        assertEquals(1, acks.get());
        assertEquals(1, swapRepository.countByDriverId(driver.getId()));
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, resultOf(reportId));
    }
}
