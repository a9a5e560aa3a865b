package com.batterysmart.swap_ledger.penalty;

import com.batterysmart.swap_ledger.driver.Driver;
import com.batterysmart.swap_ledger.event.PenaltyEvent;
import com.batterysmart.swap_ledger.exception.IllegalTransitionException;
import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.invoice.InvoiceType;
import com.batterysmart.swap_ledger.invoice.PaymentStatus;
import com.batterysmart.swap_ledger.station.Station;
import com.batterysmart.swap_ledger.subscription.DriverSubscription;
import com.batterysmart.swap_ledger.subscription.EntitlementStore;
import com.batterysmart.swap_ledger.subscription.SubscriptionService;
import com.batterysmart.swap_ledger.subscription.SubscriptionStatus;
import com.batterysmart.swap_ledger.support.LedgerIntegrationTest;
import com.batterysmart.swap_ledger.swap.RecordSwapCommand;
import com.batterysmart.swap_ledger.swap.SwapProcessor;
import com.batterysmart.swap_ledger.swap.SwapResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PenaltyServiceTest extends LedgerIntegrationTest {

    @Autowired
    private PenaltyService penaltyService;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private EntitlementStore entitlementStore;

    @Autowired
    private SwapProcessor swapProcessor;

    private Driver driver;
    private DriverSubscription subscription;

    /**
     * A one-day subscription with battery BAT-555 still held by the driver.
     */
    @BeforeEach
    void setUp() {
        driver = registerDriver();
        subscription = subscriptionService.subscribe(driver.getId(), "DAILY", false).getSubscription();
        entitlementStore.setCustody(subscription.getId(), "BAT-555");
    }

    private void moveToDaysAfterEnd(int days) {
        clock.setDate(subscription.getEndDate().plusDays(days));
    }

    private SwapResult handIn(Station station, String oldBatteryId, String newBatteryId) {
        return swapProcessor.recordSwap(RecordSwapCommand.builder()
            .driverId(driver.getId())
            .stationId(station.getId())
            .oldBatteryId(oldBatteryId)
            .newBatteryId(newBatteryId)
            .oldChargePct(9)
            .newChargePct(98)
            .idempotencyKey(UUID.randomUUID().toString())
            .build());
    }

    private long countOutboxEvents(String eventType) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM outbox_events WHERE event_type = ?", Long.class, eventType);
        return count == null ? 0 : count;
    }

    @Nested
    @DisplayName("Reading the penalty")
    class Reading {

        @Test
        @DisplayName("Six days after the end date two days are owed")
        void overdue() {
            printTestHeader("Penalty six days after end");
            moveToDaysAfterEnd(6);

            PenaltyView view = penaltyService.getPenalty(subscription.getId());
            printOutput("Penalty", view);

            assertTrue(view.isHasPenalty());
            assertEquals(2, view.getDaysOverdue());
            assertEquals(new BigDecimal("160.00"), view.getTotalAmount());
            printSuccess("Rs.160 owed for two days past grace");
        }

        @Test
        @DisplayName("Three days after the end date nothing is owed")
        void withinGrace() {
            moveToDaysAfterEnd(3);

            PenaltyView view = penaltyService.getPenalty(subscription.getId());

            assertFalse(view.isHasPenalty());
            assertEquals(new BigDecimal("0.00"), view.getTotalAmount());
        }

        @Test
        @DisplayName("Reading never writes a record")
        void readIsPure() {
            moveToDaysAfterEnd(10);

            penaltyService.getPenalty(subscription.getId());
            DriverPenaltySummary summary = penaltyService.getPenaltyForDriver(driver.getId());

            assertEquals(subscription.getId(), summary.getSubscriptionId());
            assertEquals(6, summary.getCurrent().getDaysOverdue());
            assertTrue(summary.getRecords().isEmpty());
        }
    }

    @Nested
    @DisplayName("Assessment")
    class Assessment {

        @Test
        @DisplayName("Assessing twice on the same day keeps one record and one event")
        void idempotent() {
            printTestHeader("Idempotent assessment");
            moveToDaysAfterEnd(6);

            PenaltyRecord first = penaltyService.assessPenalty(subscription.getId()).orElseThrow();
            PenaltyRecord second = penaltyService.assessPenalty(subscription.getId()).orElseThrow();

            assertEquals(first.getId(), second.getId());
            assertEquals(PenaltyStatus.PENDING, first.getStatus());
            assertEquals(new BigDecimal("160.00"), first.getTotalAmount());
            assertEquals(1, countOutboxEvents(PenaltyEvent.ASSESSED));
            printSuccess("Second assessment changed nothing");
        }

        @Test
        @DisplayName("A pending record follows the growing overdue count")
        void followsDays() {
            moveToDaysAfterEnd(6);
            PenaltyRecord first = penaltyService.assessPenalty(subscription.getId()).orElseThrow();

            moveToDaysAfterEnd(9);
            PenaltyRecord later = penaltyService.assessPenalty(subscription.getId()).orElseThrow();

            assertEquals(first.getId(), later.getId());
            assertEquals(5, later.getDaysOverdue());
            assertEquals(new BigDecimal("400.00"), later.getTotalAmount());
        }

        @Test
        @DisplayName("Nothing is recorded within grace")
        void nothingOwed() {
            moveToDaysAfterEnd(2);

            assertEquals(Optional.empty(), penaltyService.assessPenalty(subscription.getId()));
        }

        @Test
        @DisplayName("Sweep assesses overdue batteries and skips returned ones")
        void sweep() {
            Driver returning = registerDriver();
            DriverSubscription returned = subscriptionService.subscribe(returning.getId(), "DAILY", false).getSubscription();
            entitlementStore.setCustody(returned.getId(), "BAT-556");
            entitlementStore.markReturned(returned.getId(), null);

            moveToDaysAfterEnd(7);
            int assessed = penaltyService.sweep(clock.today());

            assertEquals(1, assessed);
            assertEquals(1, penaltyService.getPenaltyForDriver(driver.getId()).getRecords().size());
            assertTrue(penaltyService.getPenaltyForDriver(returning.getId()).getRecords().isEmpty());
        }
    }

    @Nested
    @DisplayName("Custody after the subscription lapsed")
    class LapsedCustody {

        @Test
        @DisplayName("Renewing after the expiry sweep moves the battery and clears the lapsed subscription")
        void renewalAfterExpirySweep() {
            printTestHeader("Renewal the day after expiry");
            Station station = createStation("BLR-IND-07", 12.9784, 77.6408, 6);

            clock.setDate(subscription.getEndDate().plusDays(1));
            assertEquals(1, subscriptionService.expireLapsed(clock.today()));

            DriverSubscription renewed = subscriptionService.subscribe(driver.getId(), "DAILY", false).getSubscription();
            assertEquals("BAT-555", renewed.getBatteryId());

            SwapResult swap = handIn(station, "BAT-555", "BAT-600");
            assertEquals(renewed.getId(), swap.getSubscriptionId());

            DriverSubscription lapsed = entitlementStore.getSubscription(subscription.getId());
            printOutput("Lapsed subscription", lapsed);
            assertEquals(SubscriptionStatus.EXPIRED, lapsed.getStatus());
            assertTrue(lapsed.isBatteryReturned());
            assertEquals("BAT-600", entitlementStore.getSubscription(renewed.getId()).getBatteryId());

            moveToDaysAfterEnd(6);
            assertFalse(penaltyService.getPenalty(subscription.getId()).isHasPenalty());
            assertEquals(0, penaltyService.sweep(clock.today()));
            assertEquals(0, countOutboxEvents(PenaltyEvent.ASSESSED));
            printSuccess("No penalty for a battery that came back");
        }

        @Test
        @DisplayName("Handing the battery in on a pay-per-swap visit closes custody on the expired subscription")
        void payPerSwapHandIn() {
            Station station = createStation("BLR-IND-08", 12.9790, 77.6400, 6);

            clock.setDate(subscription.getEndDate().plusDays(1));
            subscriptionService.expireLapsed(clock.today());

            SwapResult swap = handIn(station, "BAT-555", "BAT-601");
            assertNull(swap.getSubscriptionId());

            DriverSubscription lapsed = entitlementStore.getSubscription(subscription.getId());
            assertTrue(lapsed.isBatteryReturned());
            assertNotNull(lapsed.getBatteryReturnedAt());

            moveToDaysAfterEnd(6);
            assertFalse(penaltyService.getPenalty(subscription.getId()).isHasPenalty());
            assertEquals(0, penaltyService.sweep(clock.today()));
        }

        @Test
        @DisplayName("Handing in some other battery leaves the lapsed subscription overdue")
        void unrelatedBattery() {
            Station station = createStation("BLR-IND-09", 12.9795, 77.6395, 6);

            clock.setDate(subscription.getEndDate().plusDays(1));
            subscriptionService.expireLapsed(clock.today());
            handIn(station, "BAT-999", "BAT-602");

            moveToDaysAfterEnd(6);
            assertTrue(penaltyService.getPenalty(subscription.getId()).isHasPenalty());
        }
    }

    @Nested
    @DisplayName("Settlement")
    class Settlement {

        @Test
        @DisplayName("Paying issues a paid penalty invoice and freezes the record")
        void pay() {
            printTestHeader("Pay a penalty");
            moveToDaysAfterEnd(6);
            PenaltyRecord record = penaltyService.assessPenalty(subscription.getId()).orElseThrow();

            PenaltySettlement settlement = penaltyService.markPaid(record.getId(), "cashier-7");
            printOutput("Invoice", settlement.getInvoice());

            assertEquals(PenaltyStatus.PAID, settlement.getPenalty().getStatus());
            assertEquals("cashier-7", settlement.getPenalty().getSettledBy());
            assertEquals(InvoiceType.PENALTY, settlement.getInvoice().getInvoiceType());
            assertEquals(PaymentStatus.PAID, settlement.getInvoice().getPaymentStatus());
            assertEquals(new BigDecimal("160.00"), settlement.getInvoice().getTotalAmount());
            assertEquals(new BigDecimal("0.00"), settlement.getInvoice().getTaxAmount());

            moveToDaysAfterEnd(12);
            PenaltyRecord after = penaltyService.assessPenalty(subscription.getId()).orElseThrow();
            assertEquals(PenaltyStatus.PAID, after.getStatus());
            assertEquals(2, after.getDaysOverdue());

            assertThrows(IllegalTransitionException.class, () -> penaltyService.waive(record.getId(), "ops"));
            printSuccess("Paid penalty is final");
        }

        @Test
        @DisplayName("Waiving needs an actor and cannot be followed by payment")
        void waive() {
            moveToDaysAfterEnd(8);
            PenaltyRecord record = penaltyService.assessPenalty(subscription.getId()).orElseThrow();

            assertThrows(InvalidInputException.class, () -> penaltyService.waive(record.getId(), ""));
            PenaltyRecord waived = penaltyService.waive(record.getId(), "area-manager");

            assertEquals(PenaltyStatus.WAIVED, waived.getStatus());
            assertThrows(IllegalTransitionException.class, () -> penaltyService.markPaid(record.getId(), "cashier"));
        }
    }
}
