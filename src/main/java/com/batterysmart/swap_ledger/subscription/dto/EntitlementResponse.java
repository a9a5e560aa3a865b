package com.batterysmart.swap_ledger.subscription.dto;

import com.batterysmart.swap_ledger.penalty.dto.PenaltyResponse;
import com.batterysmart.swap_ledger.subscription.EntitlementView;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * {@code swaps_remaining} is -1 on unlimited plans.
 */
@Value
@Builder
public class EntitlementResponse {

    @JsonProperty("subscription_id")
    UUID subscriptionId;

    @JsonProperty("driver_id")
    UUID driverId;

    @JsonProperty("status")
    String status;

    @JsonProperty("plan_code")
    String planCode;

    @JsonProperty("plan_name")
    String planName;

    @JsonProperty("plan_price")
    BigDecimal planPrice;

    @JsonProperty("swaps_included")
    int swapsIncluded;

    @JsonProperty("swaps_used")
    int swapsUsed;

    @JsonProperty("swaps_remaining")
    int swapsRemaining;

    @JsonProperty("unlimited")
    boolean unlimited;

    @JsonProperty("swaps_per_day")
    int swapsPerDay;

    @JsonProperty("swaps_used_today")
    int swapsUsedToday;

    @JsonProperty("extra_swap_price")
    BigDecimal extraSwapPrice;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("days_remaining")
    long daysRemaining;

    @JsonProperty("expiring_soon")
    boolean expiringSoon;

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

    @JsonProperty("penalty")
    PenaltyResponse penalty;

    @JsonProperty("integrity_warning")
    boolean integrityWarning;

    public static EntitlementResponse from(EntitlementView view) {
        return EntitlementResponse.builder()
            .subscriptionId(view.getSubscriptionId())
            .driverId(view.getDriverId())
            .status(view.getStatus().name())
            .planCode(view.getPlanCode())
            .planName(view.getPlanName())
            .planPrice(view.getPlanPrice())
            .swapsIncluded(view.getSwapsIncluded())
            .swapsUsed(view.getSwapsUsed())
            .swapsRemaining(view.getSwapsRemaining())
            .unlimited(view.isUnlimited())
            .swapsPerDay(view.getSwapsPerDay())
            .swapsUsedToday(view.getSwapsUsedToday())
            .extraSwapPrice(view.getExtraSwapPrice())
            .startDate(view.getStartDate())
            .endDate(view.getEndDate())
            .daysRemaining(view.getDaysRemaining())
            .expiringSoon(view.isExpiringSoon())
            .autoRenew(view.isAutoRenew())
            .batteryId(view.getBatteryId())
            .batteryReturned(view.isBatteryReturned())
            .batteryMisplaced(view.isBatteryMisplaced())
            .batteryReturnedAt(view.getBatteryReturnedAt())
            .penalty(PenaltyResponse.from(view.getPenalty()))
            .integrityWarning(view.isIntegrityWarning())
            .build();
    }
}
