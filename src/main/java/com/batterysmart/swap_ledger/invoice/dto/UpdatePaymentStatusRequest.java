package com.batterysmart.swap_ledger.invoice.dto;

import com.batterysmart.swap_ledger.invoice.PaymentStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class UpdatePaymentStatusRequest {

    @NotNull(message = "Payment status is required")
    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;
}
