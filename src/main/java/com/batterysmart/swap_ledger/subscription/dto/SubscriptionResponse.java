package com.batterysmart.swap_ledger.subscription.dto;

import com.batterysmart.swap_ledger.invoice.dto.InvoiceResponse;
import com.batterysmart.swap_ledger.subscription.DriverSubscription;
import com.batterysmart.swap_ledger.subscription.SubscriptionResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubscriptionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("driver_id")
    UUID driverId;

    @JsonProperty("plan_code")
    String planCode;

    @JsonProperty("status")
    String status;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("swaps_used")
    int swapsUsed;

    @JsonProperty("auto_renew")
    boolean autoRenew;

    @JsonProperty("battery_id")
    String batteryId;

    @JsonProperty("battery_returned")
    boolean batteryReturned;

    @JsonProperty("battery_misplaced")
    boolean batteryMisplaced;

    @JsonProperty("battery_returned_at")
    Instant batteryReturnedAt;

    @JsonProperty("invoice")
    InvoiceResponse invoice;

    public static SubscriptionResponse from(DriverSubscription subscription) {
        return base(subscription).build();
    }

    public static SubscriptionResponse from(SubscriptionResult result) {
        return base(result.getSubscription())
            .planCode(result.getPlan().getCode())
            .invoice(InvoiceResponse.from(result.getInvoice()))
            .build();
    }

    private static SubscriptionResponseBuilder base(DriverSubscription subscription) {
        return SubscriptionResponse.builder()
            .id(subscription.getId())
            .driverId(subscription.getDriverId())
            .status(subscription.getStatus().name())
            .startDate(subscription.getStartDate())
            .endDate(subscription.getEndDate())
            .swapsUsed(subscription.getSwapsUsed())
            .autoRenew(subscription.isAutoRenew())
            .batteryId(subscription.getBatteryId())
            .batteryReturned(subscription.isBatteryReturned())
            .batteryMisplaced(subscription.isMisplaced())
            .batteryReturnedAt(subscription.getBatteryReturnedAt());
    }
}
