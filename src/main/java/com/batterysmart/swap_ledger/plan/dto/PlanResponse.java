package com.batterysmart.swap_ledger.plan.dto;

import com.batterysmart.swap_ledger.plan.SubscriptionPlan;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A plan as shown on the pricing menu, with its GST breakdown.
 */
@Value
@Builder
public class PlanResponse {

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("gst_percentage")
    BigDecimal gstPercentage;

    @JsonProperty("gst_amount")
    BigDecimal gstAmount;

    @JsonProperty("total_price")
    BigDecimal totalPrice;

    @JsonProperty("validity_days")
    int validityDays;

    @JsonProperty("swaps_included")
    int swapsIncluded;

    @JsonProperty("swaps_per_day")
    int swapsPerDay;

    @JsonProperty("unlimited")
    boolean unlimited;

    @JsonProperty("extra_swap_price")
    BigDecimal extraSwapPrice;

    @JsonProperty("per_swap_cost")
    BigDecimal perSwapCost;

    @JsonProperty("description")
    String description;

    public static PlanResponse from(SubscriptionPlan plan) {
        return PlanResponse.builder()
            .code(plan.getCode())
            .name(plan.getName())
            .price(plan.getPrice())
            .gstPercentage(plan.getGstPercentage())
            .gstAmount(plan.gstAmount())
            .totalPrice(plan.totalPrice())
            .validityDays(plan.getValidityDays())
            .swapsIncluded(plan.getSwapsIncluded())
            .swapsPerDay(plan.getSwapsPerDay())
            .unlimited(plan.isUnlimited())
            .extraSwapPrice(plan.getExtraSwapPrice())
            .perSwapCost(plan.perSwapCost())
            .description(plan.getDescription())
            .build();
    }
}
