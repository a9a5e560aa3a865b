package com.batterysmart.swap_ledger.swap.dto;

import com.batterysmart.swap_ledger.swap.SwapEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SwapStatusResponse {

    @JsonProperty("swap_id")
    UUID swapId;

    @JsonProperty("status")
    String status;

    @JsonProperty("charge_amount")
    BigDecimal chargeAmount;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static SwapStatusResponse from(SwapEvent swap) {
        return new SwapStatusResponse(swap.getId(), swap.getStatus().name(), swap.getChargeAmount(),
            swap.getFailureReason(), swap.getUpdatedAt());
    }
}
