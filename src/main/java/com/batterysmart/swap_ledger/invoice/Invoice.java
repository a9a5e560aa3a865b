package com.batterysmart.swap_ledger.invoice;

import com.batterysmart.swap_ledger.exception.IllegalTransitionException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * An issued invoice. Amounts are fixed at issue time; only the payment
 * status changes afterwards.
 */
@Value
public class Invoice {
    UUID id;
    String invoiceNumber;
    UUID driverId;
    UUID swapId;
    UUID subscriptionId;
    InvoiceType invoiceType;
    BigDecimal amount;
    BigDecimal taxAmount;
    BigDecimal totalAmount;
    String description;
    PaymentStatus paymentStatus;
    Instant generatedAt;
    Instant updatedAt;

    /**
     * tax = round(amount * taxRate, 2, HALF_UP), total = amount + tax.
     */
    static Invoice issue(String invoiceNumber, InvoiceRequest request, Instant now) {
        BigDecimal amount = request.getAmount().setScale(2, RoundingMode.HALF_UP);
        BigDecimal tax = computeTax(amount, request.getTaxRate());
        return new Invoice(
            UUID.randomUUID(),
            invoiceNumber,
            request.getDriverId(),
            request.getSwapId(),
            request.getSubscriptionId(),
            request.getType(),
            amount,
            tax,
            amount.add(tax),
            request.getDescription(),
            request.getPaymentStatus(),
            now,
            now
        );
    }

    public static BigDecimal computeTax(BigDecimal amount, BigDecimal taxRate) {
        return amount.multiply(taxRate).setScale(2, RoundingMode.HALF_UP);
    }

    public Invoice withPaymentStatus(PaymentStatus target, Instant now) {
        if (paymentStatus == target) {
            return this;
        }
        if (!paymentStatus.canTransitionTo(target)) {
            throw new IllegalTransitionException("invoice " + invoiceNumber, paymentStatus, target);
        }
        return new Invoice(id, invoiceNumber, driverId, swapId, subscriptionId, invoiceType,
            amount, taxAmount, totalAmount, description, target, generatedAt, now);
    }
}
