package com.batterysmart.swap_ledger.invoice.dto;

import com.batterysmart.swap_ledger.invoice.Invoice;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InvoiceResponse {

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("driver_id")
    UUID driverId;

    @JsonProperty("invoice_type")
    String invoiceType;

    @JsonProperty("swap_id")
    UUID swapId;

    @JsonProperty("subscription_id")
    UUID subscriptionId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("description")
    String description;

    @JsonProperty("payment_status")
    String paymentStatus;

    @JsonProperty("generated_at")
    Instant generatedAt;

    public static InvoiceResponse from(Invoice invoice) {
        if (invoice == null) {
            return null;
        }
        return InvoiceResponse.builder()
            .invoiceNumber(invoice.getInvoiceNumber())
            .driverId(invoice.getDriverId())
            .invoiceType(invoice.getInvoiceType().name())
            .swapId(invoice.getSwapId())
            .subscriptionId(invoice.getSubscriptionId())
            .amount(invoice.getAmount())
            .taxAmount(invoice.getTaxAmount())
            .totalAmount(invoice.getTotalAmount())
            .description(invoice.getDescription())
            .paymentStatus(invoice.getPaymentStatus().name())
            .generatedAt(invoice.getGeneratedAt())
            .build();
    }
}
