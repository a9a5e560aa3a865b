package com.batterysmart.swap_ledger.invoice;

import com.batterysmart.swap_ledger.event.InvoiceIssuedEvent;
import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import com.batterysmart.swap_ledger.observability.LedgerMetrics;
import com.batterysmart.swap_ledger.outbox.OutboxService;
import com.batterysmart.swap_ledger.plan.PlanCatalog;
import com.batterysmart.swap_ledger.plan.SubscriptionPlan;
import com.batterysmart.swap_ledger.subscription.DriverSubscription;
import com.batterysmart.swap_ledger.subscription.EntitlementStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

/**
 * Issues invoices and answers questions about them.
 *
 * Number allocation, the invoice row and its InvoiceIssued outbox record
 * commit together or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceService {

    private static final int MAX_LIST_LIMIT = 100;

    private final InvoiceRepository invoiceRepository;
    private final InvoiceSequencer sequencer;
    private final OutboxService outboxService;
    private final EntitlementStore entitlementStore;
    private final PlanCatalog planCatalog;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Allocates the next number of the current month and persists the
     * invoice. Joins the caller's transaction when there is one.
     */
    @Transactional
    public Invoice createInvoice(InvoiceRequest request) {
        validate(request);

        Instant now = clock.instant();
        String number = sequencer.nextInvoiceNumber(YearMonth.from(now.atZone(clock.getZone())));
        Invoice invoice = Invoice.issue(number, request, now);

        invoiceRepository.save(InvoiceEntity.fromDomain(invoice));
        outboxService.saveEvent(new InvoiceIssuedEvent(
            UUID.randomUUID(),
            invoice.getId(),
            invoice.getInvoiceNumber(),
            invoice.getDriverId(),
            invoice.getInvoiceType().name(),
            invoice.getAmount(),
            invoice.getTaxAmount(),
            invoice.getTotalAmount(),
            invoice.getPaymentStatus().name(),
            now
        ));

        metrics.recordInvoiceIssued(invoice.getInvoiceType().name());
        log.info("Issued invoice {} ({}) for driver {}: total={}",
            number, invoice.getInvoiceType(), invoice.getDriverId(), invoice.getTotalAmount());
        return invoice;
    }

    @Transactional(readOnly = true)
    public Invoice findByNumber(String invoiceNumber) {
        return invoiceRepository.findByInvoiceNumber(invoiceNumber)
            .map(InvoiceEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Invoice", invoiceNumber));
    }

    @Transactional(readOnly = true)
    public Invoice latestForDriver(UUID driverId) {
        return invoiceRepository.findFirstByDriverIdOrderByGeneratedAtDescInvoiceNumberDesc(driverId)
            .map(InvoiceEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Invoice for driver", driverId));
    }

    @Transactional(readOnly = true)
    public List<Invoice> listForDriver(UUID driverId, int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return invoiceRepository.findByDriverIdOrderByGeneratedAtDescInvoiceNumberDesc(
                driverId, PageRequest.of(0, pageSize))
            .stream()
            .map(InvoiceEntity::toDomain)
            .toList();
    }

    /**
     * Explains the invoice in plain language. Without a number, explains the
     * driver's latest invoice.
     */
    @Transactional(readOnly = true)
    public InvoiceExplanation explain(UUID driverId, String invoiceNumber) {
        Invoice invoice = invoiceNumber != null && !invoiceNumber.isBlank()
            ? findByNumber(invoiceNumber.trim())
            : latestForDriver(driverId);
        if (driverId != null && !driverId.equals(invoice.getDriverId())) {
            throw new NotFoundException("Invoice for driver " + driverId, invoiceNumber);
        }

        SubscriptionPlan plan = invoice.getSubscriptionId() != null ? planOf(invoice.getSubscriptionId()) : null;
        String taxLabel = "GST (" + taxPercent(invoice) + "%)";

        String explanation;
        String chargeLabel;
        switch (invoice.getInvoiceType()) {
            case EXTRA_SWAP -> {
                explanation = "This charge of Rs." + invoice.getAmount() + " was for a swap beyond your plan limit."
                    + (plan != null ? " Your " + plan.getName() + " plan includes "
                        + describeQuota(plan) + "." : "");
                chargeLabel = "Extra Swap Charge";
            }
            case SUBSCRIPTION -> {
                explanation = "This is your subscription payment for the "
                    + (plan != null ? plan.getName() : "selected") + " plan.";
                chargeLabel = (plan != null ? plan.getName() : "Subscription") + " Plan";
            }
            case SWAP -> {
                explanation = "This charge of Rs." + invoice.getAmount()
                    + " was for a pay-per-swap battery exchange made without an active plan.";
                chargeLabel = "Swap Charge";
            }
            case PENALTY -> {
                explanation = "This is a penalty for a battery that was not returned within the grace period.";
                chargeLabel = "Late Return Penalty";
            }
            default -> throw new IllegalStateException("Unhandled invoice type " + invoice.getInvoiceType());
        }

        return new InvoiceExplanation(invoice, explanation, List.of(
            new InvoiceExplanation.LineItem(chargeLabel, invoice.getAmount()),
            new InvoiceExplanation.LineItem(taxLabel, invoice.getTaxAmount()),
            new InvoiceExplanation.LineItem("Total", invoice.getTotalAmount())
        ));
    }

    @Transactional
    public Invoice updatePaymentStatus(String invoiceNumber, PaymentStatus status) {
        InvoiceEntity entity = invoiceRepository.findByInvoiceNumberForUpdate(invoiceNumber)
            .orElseThrow(() -> new NotFoundException("Invoice", invoiceNumber));
        Invoice current = entity.toDomain();
        Invoice updated = current.withPaymentStatus(status, clock.instant());
        if (updated == current) {
            return current;
        }

        entity.updateFromDomain(updated);
        invoiceRepository.save(entity);
        log.info("Invoice {} payment status {} -> {}", invoiceNumber, current.getPaymentStatus(), status);
        return updated;
    }

    private SubscriptionPlan planOf(UUID subscriptionId) {
        DriverSubscription subscription = entitlementStore.getSubscription(subscriptionId);
        return planCatalog.findById(subscription.getPlanId());
    }

    private static String describeQuota(SubscriptionPlan plan) {
        if (plan.hasDailyCap()) {
            return plan.getSwapsPerDay() + " swaps per day";
        }
        return plan.isUnlimited() ? "unlimited swaps" : plan.getSwapsIncluded() + " swaps";
    }

    private static String taxPercent(Invoice invoice) {
        if (invoice.getAmount().signum() == 0) {
            return "0";
        }
        return invoice.getTaxAmount()
            .multiply(BigDecimal.valueOf(100))
            .divide(invoice.getAmount(), 0, RoundingMode.HALF_UP)
            .toPlainString();
    }

    private static void validate(InvoiceRequest request) {
        if (request.getType() == null) {
            throw new InvalidInputException("type", "Invoice type is required");
        }
        if (request.getDriverId() == null) {
            throw new InvalidInputException("driverId", "Driver is required");
        }
        if (request.getAmount() == null || request.getAmount().signum() < 0) {
            throw new InvalidInputException("amount", "Amount must be zero or more");
        }
        if (request.getTaxRate() == null || request.getTaxRate().signum() < 0) {
            throw new InvalidInputException("taxRate", "Tax rate must be zero or more");
        }
        if (request.getPaymentStatus() == null) {
            throw new InvalidInputException("paymentStatus", "Payment status is required");
        }
    }
}
