package com.batterysmart.swap_ledger.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "invoices")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_number", nullable = false, updatable = false, unique = true, length = 20)
    private String invoiceNumber;

    @Column(name = "driver_id", nullable = false, updatable = false)
    private UUID driverId;

    @Column(name = "swap_id", updatable = false)
    private UUID swapId;

    @Column(name = "subscription_id", updatable = false)
    private UUID subscriptionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "invoice_type", nullable = false, updatable = false, length = 20)
    private InvoiceType invoiceType;

    @Column(nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "tax_amount", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "description", updatable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "generated_at", nullable = false, updatable = false)
    private Instant generatedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static InvoiceEntity fromDomain(Invoice invoice) {
        return new InvoiceEntity(
            invoice.getId(),
            invoice.getInvoiceNumber(),
            invoice.getDriverId(),
            invoice.getSwapId(),
            invoice.getSubscriptionId(),
            invoice.getInvoiceType(),
            invoice.getAmount(),
            invoice.getTaxAmount(),
            invoice.getTotalAmount(),
            invoice.getDescription(),
            invoice.getPaymentStatus(),
            invoice.getGeneratedAt(),
            invoice.getUpdatedAt()
        );
    }

    public Invoice toDomain() {
        return new Invoice(
            id,
            invoiceNumber,
            driverId,
            swapId,
            subscriptionId,
            invoiceType,
            amount,
            taxAmount,
            totalAmount,
            description,
            paymentStatus,
            generatedAt,
            updatedAt
        );
    }

    void updateFromDomain(Invoice invoice) {
        this.paymentStatus = invoice.getPaymentStatus();
        this.updatedAt = invoice.getUpdatedAt();
    }
}
