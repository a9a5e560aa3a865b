package com.batterysmart.swap_ledger.penalty.dto;

import com.batterysmart.swap_ledger.penalty.PenaltyRecord;
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
public class PenaltyRecordResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("subscription_id")
    UUID subscriptionId;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("days_overdue")
    int daysOverdue;

    @JsonProperty("daily_rate")
    BigDecimal dailyRate;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("status")
    String status;

    @JsonProperty("settled_at")
    Instant settledAt;

    @JsonProperty("settled_by")
    String settledBy;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    public static PenaltyRecordResponse from(PenaltyRecord record) {
        return from(record, null);
    }

    public static PenaltyRecordResponse from(PenaltyRecord record, String invoiceNumber) {
        return PenaltyRecordResponse.builder()
            .id(record.getId())
            .subscriptionId(record.getSubscriptionId())
            .reason(record.getReason().name())
            .daysOverdue(record.getDaysOverdue())
            .dailyRate(record.getDailyRate())
            .totalAmount(record.getTotalAmount())
            .status(record.getStatus().name())
            .settledAt(record.getSettledAt())
            .settledBy(record.getSettledBy())
            .invoiceNumber(invoiceNumber)
            .build();
    }
}
