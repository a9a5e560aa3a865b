package com.batterysmart.swap_ledger.swap;

import com.batterysmart.swap_ledger.driver.Driver;
import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import com.batterysmart.swap_ledger.invoice.Invoice;
import com.batterysmart.swap_ledger.invoice.InvoiceService;
import com.batterysmart.swap_ledger.invoice.InvoiceType;
import com.batterysmart.swap_ledger.invoice.PaymentStatus;
import com.batterysmart.swap_ledger.station.Station;
import com.batterysmart.swap_ledger.subscription.DriverSubscription;
import com.batterysmart.swap_ledger.subscription.EntitlementStore;
import com.batterysmart.swap_ledger.subscription.EntitlementView;
import com.batterysmart.swap_ledger.subscription.SubscriptionResult;
import com.batterysmart.swap_ledger.subscription.SubscriptionService;
import com.batterysmart.swap_ledger.support.LedgerIntegrationTest;
import com.batterysmart.swap_ledger.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SwapProcessorTest extends LedgerIntegrationTest {

    @Autowired
    private SwapProcessor swapProcessor;

    @Autowired
    private SwapHistoryService swapHistoryService;

    @Autowired
    private SwapEventRepository swapRepository;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private EntitlementStore entitlementStore;

    @Autowired
    private InvoiceService invoiceService;

    private Driver driver;
    private Station station;
    private int batterySequence;

    @BeforeEach
    void setUp() {
        driver = registerDriver();
        station = createStation("BLR-KRM-01", 12.9352, 77.6245, 12);
        batterySequence = 0;
    }

    private RecordSwapCommand swap(String idempotencyKey) {
        batterySequence++;
        return RecordSwapCommand.builder()
            .driverId(driver.getId())
            .stationId(station.getId())
            .oldBatteryId("BAT-OLD-" + batterySequence)
            .newBatteryId("BAT-NEW-" + batterySequence)
            .oldChargePct(12)
            .newChargePct(98)
            .idempotencyKey(idempotencyKey)
            .build();
    }

    private SwapResult recordSwap() {
        return swapProcessor.recordSwap(swap(UUID.randomUUID().toString()));
    }

    @Nested
    @DisplayName("Quota plans")
    class QuotaPlans {

        @Test
        @DisplayName("Fifth swap on a four-swap plan is billed at the extra swap price plus GST")
        void overageIsBilled() {
            printTestHeader("Overage swap on a four-swap plan");
            fourSwapPlan();
            SubscriptionResult subscription = subscriptionService.subscribe(driver.getId(), "TEST4", false);
            printInput("Plan", "TEST4: 4 swaps, extra Rs.35, GST 18%");

            for (int i = 1; i <= 4; i++) {
                SwapResult covered = recordSwap();
                assertTrue(covered.isCovered(), "swap " + i + " should be covered");
                assertEquals(SwapResult.Coverage.COVERED, covered.getCoverage());
                assertEquals(0, covered.getChargeAmount().signum());
                assertNull(covered.getInvoiceNumber());
                assertEquals(4 - i, covered.getSwapsRemaining());
            }

            SwapResult fifth = recordSwap();
            printOutput("Fifth swap", fifth);

            assertFalse(fifth.isCovered());
            assertEquals(SwapResult.Coverage.EXTRA_SWAP, fifth.getCoverage());
            assertEquals(new BigDecimal("35.00"), fifth.getChargeAmount());
            assertEquals(new BigDecimal("6.30"), fifth.getTaxAmount());
            assertEquals(new BigDecimal("41.30"), fifth.getTotalAmount());
            assertNotNull(fifth.getInvoiceNumber());
            assertTrue(fifth.getInvoiceNumber().startsWith("INV-202406-"));

            Invoice invoice = invoiceService.findByNumber(fifth.getInvoiceNumber());
            assertEquals(InvoiceType.EXTRA_SWAP, invoice.getInvoiceType());
            assertEquals(PaymentStatus.PENDING, invoice.getPaymentStatus());
            assertEquals(fifth.getSwapId(), invoice.getSwapId());

            DriverSubscription after = entitlementStore.getSubscription(subscription.getSubscription().getId());
            assertEquals(5, after.getSwapsUsed());

            EntitlementView entitlement = entitlementStore.getActiveEntitlement(driver.getId());
            assertEquals(0, entitlement.getSwapsRemaining());
            printSuccess("Overage swap billed Rs.41.30 and counted against the plan");
        }

        @Test
        @DisplayName("Seeded daily pass covers four swaps and bills the fifth at Rs.41.30")
        void dailyPassOverage() {
            printTestHeader("Daily pass overage");
            SubscriptionResult subscription = subscriptionService.subscribe(driver.getId(), "DAILY", false);
            assertEquals(4, subscription.getPlan().getSwapsIncluded());

            for (int i = 1; i <= 4; i++) {
                SwapResult covered = recordSwap();
                assertEquals(SwapResult.Coverage.COVERED, covered.getCoverage(), "swap " + i + " should be covered");
                assertEquals(0, covered.getChargeAmount().signum());
            }

            SwapResult fifth = recordSwap();
            printOutput("Fifth swap", fifth);
            assertEquals(SwapResult.Coverage.EXTRA_SWAP, fifth.getCoverage());
            assertEquals(new BigDecimal("35.00"), fifth.getChargeAmount());
            assertEquals(new BigDecimal("6.30"), fifth.getTaxAmount());
            assertEquals(new BigDecimal("41.30"), fifth.getTotalAmount());
            printSuccess("Swaps 1-4 free, swap 5 billed");
        }

        @Test
        @DisplayName("Daily cap bills the third swap of the day and resets the next day")
        void dailyCap() {
            printTestHeader("Daily cap on the monthly plan");
            subscriptionService.subscribe(driver.getId(), "MONTHLY", false);

            assertTrue(recordSwap().isCovered());
            assertTrue(recordSwap().isCovered());
            SwapResult third = recordSwap();
            printOutput("Third swap today", third.getCoverage());

            assertEquals(SwapResult.Coverage.EXTRA_SWAP, third.getCoverage());
            assertTrue(third.getChargeAmount().signum() > 0);

            clock.advance(Duration.ofDays(1));
            assertTrue(recordSwap().isCovered());
            printSuccess("Cap applies per business day");
        }

        @Test
        @DisplayName("Unlimited plan covers fifty swaps in a single day")
        void unlimitedPlan() {
            printTestHeader("Unlimited plan");
            subscriptionService.subscribe(driver.getId(), "YEARLY", false);

            SwapResult last = null;
            for (int i = 0; i < 50; i++) {
                last = recordSwap();
                assertTrue(last.isCovered());
                assertEquals(SwapResult.Coverage.COVERED, last.getCoverage());
            }

            assertEquals(-1, last.getSwapsRemaining());
            EntitlementView entitlement = entitlementStore.getActiveEntitlement(driver.getId());
            assertTrue(entitlement.isUnlimited());
            assertEquals(50, entitlement.getSwapsUsed());
            printSuccess("50 swaps covered, no invoices");
        }

        @Test
        @DisplayName("The new battery moves into the driver's custody")
        void custody() {
            SubscriptionResult subscription = subscriptionService.subscribe(driver.getId(), "MONTHLY", false);

            SwapResult result = swapProcessor.recordSwap(swap("custody-1"));

            DriverSubscription after = entitlementStore.getSubscription(subscription.getSubscription().getId());
            assertEquals("BAT-NEW-1", after.getBatteryId());
            assertFalse(after.isBatteryReturned());
            assertEquals(subscription.getSubscription().getId(), result.getSubscriptionId());
        }
    }

    @Nested
    @DisplayName("Without a subscription")
    class PayPerSwap {

        @Test
        @DisplayName("Swap is billed at the pay-per-swap price")
        void payPerSwap() {
            printTestHeader("Pay-per-swap");

            SwapResult result = recordSwap();
            printOutput("Result", result);

            assertEquals(SwapResult.Coverage.PAY_PER_SWAP, result.getCoverage());
            assertNull(result.getSubscriptionId());
            assertNull(result.getSwapsRemaining());
            assertEquals(new BigDecimal("35.00"), result.getChargeAmount());
            assertEquals(new BigDecimal("6.30"), result.getTaxAmount());
            assertEquals(new BigDecimal("41.30"), result.getTotalAmount());
            assertEquals(InvoiceType.SWAP, invoiceService.findByNumber(result.getInvoiceNumber()).getInvoiceType());
            printSuccess("Pay-per-swap invoice issued");
        }
    }

    @Nested
    @DisplayName("Idempotency")
    class Idempotency {

        @Test
        @DisplayName("Repeating a key returns the first swap and writes nothing")
        void replay() {
            printTestHeader("Idempotent replay");
            SubscriptionResult subscription = subscriptionService.subscribe(driver.getId(), "MONTHLY", false);
            RecordSwapCommand command = swap("station-report-42");

            SwapResult first = swapProcessor.recordSwap(command);
            SwapResult second = swapProcessor.recordSwap(command);
            printOutput("First", first.getSwapId());
            printOutput("Second", second.getSwapId());

            assertEquals(first.getSwapId(), second.getSwapId());
            assertFalse(first.isReplayed());
            assertTrue(second.isReplayed());
            assertEquals(1, swapRepository.countByDriverId(driver.getId()));
            assertEquals(1, entitlementStore.getSubscription(subscription.getSubscription().getId()).getSwapsUsed());
            printSuccess("Duplicate report did not consume quota");
        }

        @Test
        @DisplayName("Replay is answered from the database when the cache is empty")
        void replayWithoutCache() {
            RecordSwapCommand command = swap("station-report-77");
            SwapResult first = swapProcessor.recordSwap(command);

            flushCache();

            SwapResult second = swapProcessor.recordSwap(command);
            assertEquals(first.getSwapId(), second.getSwapId());
            assertEquals(first.getInvoiceNumber(), second.getInvoiceNumber());
            assertEquals(1, swapRepository.countByDriverId(driver.getId()));
        }

        @Test
        @DisplayName("Concurrent swaps never cover more than the quota")
        void concurrentSwaps() throws InterruptedException {
            printTestHeader("Concurrent swaps on a four-swap plan");
            fourSwapPlan();
            SubscriptionResult subscription = subscriptionService.subscribe(driver.getId(), "TEST4", false);

            int threadCount = 10;
            List<RecordSwapCommand> commands = new ArrayList<>();
            for (int i = 0; i < threadCount; i++) {
                commands.add(swap("concurrent-" + i));
            }
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);
            ConcurrentLinkedQueue<SwapResult> results = new ConcurrentLinkedQueue<>();
            ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            for (RecordSwapCommand command : commands) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        results.add(swapProcessor.recordSwap(command));
                    } catch (Throwable e) {
                        errors.add(e);
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }
            startLatch.countDown();
            assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            printOutput("Errors", errors);
            assertTrue(errors.isEmpty());
            long covered = results.stream().filter(SwapResult::isCovered).count();
            assertEquals(4, covered);
            assertEquals(6, results.size() - covered);
            assertEquals(10, entitlementStore.getSubscription(subscription.getSubscription().getId()).getSwapsUsed());
            printSuccess("Exactly four covered swaps under contention");
        }
    }

    @Nested
    @DisplayName("Validation and corrections")
    class Corrections {

        @Test
        @DisplayName("Bad charge levels and unknown stations are rejected")
        void rejected() {
            RecordSwapCommand badCharge = RecordSwapCommand.builder()
                .driverId(driver.getId())
                .stationId(station.getId())
                .oldBatteryId("BAT-A")
                .newBatteryId("BAT-B")
                .oldChargePct(10)
                .newChargePct(101)
                .build();
            assertThrows(InvalidInputException.class, () -> swapProcessor.recordSwap(badCharge));

            RecordSwapCommand unknownStation = RecordSwapCommand.builder()
                .driverId(driver.getId())
                .stationCode("NOWHERE-99")
                .oldBatteryId("BAT-A")
                .newBatteryId("BAT-B")
                .oldChargePct(10)
                .newChargePct(95)
                .build();
            assertThrows(NotFoundException.class, () -> swapProcessor.recordSwap(unknownStation));
            assertEquals(0, swapRepository.countByDriverId(driver.getId()));
        }

        @Test
        @DisplayName("Refund fails the pending invoice and keeps the quota counted")
        void refund() {
            fourSwapPlan();
            SubscriptionResult subscription = subscriptionService.subscribe(driver.getId(), "TEST4", false);
            for (int i = 0; i < 4; i++) {
                recordSwap();
            }
            SwapResult extra = recordSwap();

            SwapEvent refunded = swapProcessor.refund(extra.getSwapId());

            assertEquals(SwapStatus.REFUNDED, refunded.getStatus());
            assertEquals(PaymentStatus.FAILED, invoiceService.findByNumber(extra.getInvoiceNumber()).getPaymentStatus());
            assertEquals(5, entitlementStore.getSubscription(subscription.getSubscription().getId()).getSwapsUsed());
        }

        @Test
        @DisplayName("Failed swaps need a reason and show up in history")
        void markFailed() {
            SwapResult result = recordSwap();

            assertThrows(InvalidInputException.class, () -> swapProcessor.markFailed(result.getSwapId(), " "));
            SwapEvent failed = swapProcessor.markFailed(result.getSwapId(), "battery latch jammed");
            assertEquals(SwapStatus.FAILED, failed.getStatus());

            SwapHistory history = swapHistoryService.listSwapHistory(driver.getId(), null, null, null, null);
            assertEquals(1, history.getTotalSwaps());
            assertEquals(SwapStatus.FAILED, history.getSwaps().get(0).getStatus());
        }
    }

    @Nested
    @DisplayName("History")
    class History {

        @Test
        @DisplayName("Named periods and custom ranges select swaps by business day")
        void periods() {
            subscriptionService.subscribe(driver.getId(), "MONTHLY", false);
            recordSwap();
            clock.advance(Duration.ofDays(1));
            recordSwap();
            recordSwap();

            SwapHistory today = swapHistoryService.listSwapHistory(driver.getId(), HistoryPeriod.TODAY, null, null, null);
            SwapHistory yesterday = swapHistoryService.listSwapHistory(driver.getId(), HistoryPeriod.YESTERDAY, null, null, null);
            SwapHistory custom = swapHistoryService.listSwapHistory(driver.getId(), null,
                clock.today().minusDays(1), clock.today(), 10);

            assertEquals(2, today.getTotalSwaps());
            assertEquals(1, yesterday.getTotalSwaps());
            assertEquals(HistoryPeriod.CUSTOM, custom.getPeriod());
            assertEquals(3, custom.getTotalSwaps());
            assertEquals(3, custom.getFreeSwaps());
            assertEquals(new BigDecimal("0.00"), custom.getTotalCharged());
            assertTrue(!custom.getSwaps().get(0).getSwapTime().isBefore(custom.getSwaps().get(2).getSwapTime()));
        }

        @Test
        @DisplayName("Totals cover every swap in the window, not just the returned page")
        void totalsIgnoreLimit() {
            printTestHeader("History totals beyond the page");
            recordSwap();
            recordSwap();
            recordSwap();

            SwapHistory history = swapHistoryService.listSwapHistory(driver.getId(), HistoryPeriod.ALL, null, null, 1);
            printOutput("History", history);

            assertEquals(1, history.getSwaps().size());
            assertEquals(3, history.getTotalSwaps());
            assertEquals(0, history.getFreeSwaps());
            assertEquals(new BigDecimal("105.00"), history.getTotalCharged());
            printSuccess("Three pay-per-swap charges totalled across one page");
        }

        @Test
        @DisplayName("ALL has no lower date bound")
        void allIsUnbounded() {
            clock.setDate(LocalDate.of(2018, 3, 1));
            recordSwap();
            clock.setDate(TestClockConfig.START_DATE);
            recordSwap();

            SwapHistory history = swapHistoryService.listSwapHistory(driver.getId(), HistoryPeriod.ALL, null, null, null);

            assertNull(history.getFrom());
            assertEquals(2, history.getTotalSwaps());
            assertEquals(2, history.getSwaps().size());
        }

        @Test
        @DisplayName("Inverted custom range is rejected")
        void invertedRange() {
            assertThrows(InvalidInputException.class, () -> swapHistoryService.listSwapHistory(
                driver.getId(), HistoryPeriod.CUSTOM, clock.today(), clock.today().minusDays(3), null));
        }
    }
}
