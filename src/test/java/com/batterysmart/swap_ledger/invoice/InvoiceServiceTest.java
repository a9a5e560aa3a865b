package com.batterysmart.swap_ledger.invoice;

import com.batterysmart.swap_ledger.driver.Driver;
import com.batterysmart.swap_ledger.exception.IllegalTransitionException;
import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import com.batterysmart.swap_ledger.subscription.SubscriptionResult;
import com.batterysmart.swap_ledger.subscription.SubscriptionService;
import com.batterysmart.swap_ledger.support.LedgerIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class InvoiceServiceTest extends LedgerIntegrationTest {

    @Autowired
    private InvoiceService invoiceService;

    @Autowired
    private SubscriptionService subscriptionService;

    private Driver driver;

    @BeforeEach
    void setUp() {
        driver = registerDriver();
    }

    private InvoiceRequest swapCharge(String amount) {
        return InvoiceRequest.builder()
            .type(InvoiceType.SWAP)
            .driverId(driver.getId())
            .amount(new BigDecimal(amount))
            .taxRate(new BigDecimal("0.18"))
            .description("Pay-per-swap")
            .paymentStatus(PaymentStatus.PENDING)
            .build();
    }

    @Nested
    @DisplayName("Numbering")
    class Numbering {

        @Test
        @DisplayName("Numbers restart at 1 each month")
        void monthlyRollover() {
            printTestHeader("Invoice numbers per month");

            Invoice june = invoiceService.createInvoice(swapCharge("35.00"));
            Invoice juneAgain = invoiceService.createInvoice(swapCharge("35.00"));
            clock.setDate(LocalDate.of(2024, 7, 1));
            Invoice july = invoiceService.createInvoice(swapCharge("35.00"));

            printOutput("Numbers", List.of(june.getInvoiceNumber(), juneAgain.getInvoiceNumber(), july.getInvoiceNumber()));
            assertEquals("INV-202406-000001", june.getInvoiceNumber());
            assertEquals("INV-202406-000002", juneAgain.getInvoiceNumber());
            assertEquals("INV-202407-000001", july.getInvoiceNumber());
            printSuccess("Sequence is per calendar month");
        }

        @Test
        @DisplayName("One hundred concurrent invoices get one hundred distinct consecutive numbers")
        void concurrentAllocation() throws InterruptedException {
            printTestHeader("Concurrent invoice numbering");
            int invoices = 100;
            int threads = 16;
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(invoices);
            ConcurrentLinkedQueue<String> numbers = new ConcurrentLinkedQueue<>();
            ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

            ExecutorService executor = Executors.newFixedThreadPool(threads);
            for (int i = 0; i < invoices; i++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        numbers.add(invoiceService.createInvoice(swapCharge("35.00")).getInvoiceNumber());
                    } catch (Throwable e) {
                        errors.add(e);
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }
            startLatch.countDown();
            assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
            executor.shutdown();

            assertTrue(errors.isEmpty(), () -> "Unexpected errors: " + errors);
            Set<String> distinct = new TreeSet<>(numbers);
            Set<String> expected = IntStream.rangeClosed(1, invoices)
                .mapToObj(n -> InvoiceSequencer.format(YearMonth.of(2024, 6), n))
                .collect(Collectors.toCollection(TreeSet::new));
            printOutput("Distinct numbers", distinct.size());
            assertEquals(expected, distinct);
            printSuccess("No duplicates and no gaps");
        }
    }

    @Nested
    @DisplayName("Amounts and status")
    class AmountsAndStatus {

        @Test
        @DisplayName("Tax is rounded half up to paise")
        void taxRounding() {
            Invoice invoice = invoiceService.createInvoice(swapCharge("12.25"));

            assertEquals(new BigDecimal("12.25"), invoice.getAmount());
            assertEquals(new BigDecimal("2.21"), invoice.getTaxAmount());
            assertEquals(new BigDecimal("14.46"), invoice.getTotalAmount());
        }

        @Test
        @DisplayName("Pending invoice can be paid once and then stays paid")
        void paymentStatus() {
            Invoice invoice = invoiceService.createInvoice(swapCharge("35.00"));

            Invoice paid = invoiceService.updatePaymentStatus(invoice.getInvoiceNumber(), PaymentStatus.PAID);
            assertEquals(PaymentStatus.PAID, paid.getPaymentStatus());
            assertEquals(PaymentStatus.PAID,
                invoiceService.updatePaymentStatus(invoice.getInvoiceNumber(), PaymentStatus.PAID).getPaymentStatus());
            assertThrows(IllegalTransitionException.class,
                () -> invoiceService.updatePaymentStatus(invoice.getInvoiceNumber(), PaymentStatus.FAILED));
        }

        @Test
        @DisplayName("Unknown invoice numbers are not found")
        void unknown() {
            assertThrows(NotFoundException.class, () -> invoiceService.findByNumber("INV-202406-999999"));
        }

        @Test
        @DisplayName("Negative amounts are refused")
        void negativeAmount() {
            assertThrows(InvalidInputException.class, () -> invoiceService.createInvoice(swapCharge("-1.00")));
        }
    }

    @Nested
    @DisplayName("Explanations")
    class Explanations {

        @Test
        @DisplayName("Subscription invoice names the plan")
        void subscriptionInvoice() {
            SubscriptionResult result = subscriptionService.subscribe(driver.getId(), "MONTHLY", false);

            InvoiceExplanation explanation = invoiceService.explain(driver.getId(), null);
            printOutput("Explanation", explanation.getExplanation());

            assertEquals(result.getInvoice().getInvoiceNumber(), explanation.getInvoice().getInvoiceNumber());
            assertTrue(explanation.getExplanation().contains("Monthly Plan"));
            assertEquals(3, explanation.getBreakdown().size());
            assertEquals(new BigDecimal("999.00"), explanation.getBreakdown().get(0).getAmount());
            assertEquals(new BigDecimal("179.82"), explanation.getBreakdown().get(1).getAmount());
            assertEquals(new BigDecimal("1178.82"), explanation.getBreakdown().get(2).getAmount());
        }

        @Test
        @DisplayName("Another driver's invoice is not explained")
        void otherDriver() {
            Invoice invoice = invoiceService.createInvoice(swapCharge("35.00"));
            Driver other = registerDriver();

            assertThrows(NotFoundException.class, () -> invoiceService.explain(other.getId(), invoice.getInvoiceNumber()));
        }
    }
}
