package com.batterysmart.swap_ledger.invoice;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * What to bill. Swap and subscription links are optional.
 */
@Value
@Builder
public class InvoiceRequest {
    InvoiceType type;
    UUID driverId;
    BigDecimal amount;
    BigDecimal taxRate;
    UUID swapId;
    UUID subscriptionId;
    String description;
    @Builder.Default
    PaymentStatus paymentStatus = PaymentStatus.PENDING;
}
