package com.batterysmart.swap_ledger.swap.dto;

import com.batterysmart.swap_ledger.swap.SwapResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SwapResponse {

    @JsonProperty("swap_id")
    UUID swapId;

    @JsonProperty("driver_id")
    UUID driverId;

    @JsonProperty("station_id")
    UUID stationId;

    @JsonProperty("subscription_id")
    UUID subscriptionId;

    @JsonProperty("covered")
    boolean covered;

    @JsonProperty("coverage")
    String coverage;

    @JsonProperty("charge_amount")
    BigDecimal chargeAmount;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("swaps_remaining")
    Integer swapsRemaining;

    @JsonProperty("replayed")
    boolean replayed;

    public static SwapResponse from(SwapResult result) {
        return SwapResponse.builder()
            .swapId(result.getSwapId())
            .driverId(result.getDriverId())
            .stationId(result.getStationId())
            .subscriptionId(result.getSubscriptionId())
            .covered(result.isCovered())
            .coverage(result.getCoverage().name())
            .chargeAmount(result.getChargeAmount())
            .taxAmount(result.getTaxAmount())
            .totalAmount(result.getTotalAmount())
            .invoiceNumber(result.getInvoiceNumber())
            .swapsRemaining(result.getSwapsRemaining())
            .replayed(result.isReplayed())
            .build();
    }
}
