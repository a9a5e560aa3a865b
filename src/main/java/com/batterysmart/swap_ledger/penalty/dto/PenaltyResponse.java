package com.batterysmart.swap_ledger.penalty.dto;

import com.batterysmart.swap_ledger.penalty.PenaltyView;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PenaltyResponse {

    @JsonProperty("has_penalty")
    boolean hasPenalty;

    @JsonProperty("days_overdue")
    int daysOverdue;

    @JsonProperty("daily_rate")
    BigDecimal dailyRate;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("grace_period_days")
    int gracePeriodDays;

    @JsonProperty("degraded")
    boolean degraded;

    public static PenaltyResponse from(PenaltyView view) {
        if (view == null) {
            return null;
        }
        return PenaltyResponse.builder()
            .hasPenalty(view.isHasPenalty())
            .daysOverdue(view.getDaysOverdue())
            .dailyRate(view.getDailyRate())
            .totalAmount(view.getTotalAmount())
            .gracePeriodDays(view.getGracePeriodDays())
            .degraded(view.isDegraded())
            .build();
    }
}
