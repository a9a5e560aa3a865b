package com.batterysmart.swap_ledger.penalty.dto;

import com.batterysmart.swap_ledger.penalty.DriverPenaltySummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
public class DriverPenaltyResponse {

    @JsonProperty("driver_id")
    UUID driverId;

    @JsonProperty("subscription_id")
    UUID subscriptionId;

    @JsonProperty("subscription_end_date")
    LocalDate subscriptionEndDate;

    @JsonProperty("current")
    PenaltyResponse current;

    @JsonProperty("records")
    List<PenaltyRecordResponse> records;

    public static DriverPenaltyResponse from(DriverPenaltySummary summary) {
        return new DriverPenaltyResponse(
            summary.getDriverId(),
            summary.getSubscriptionId(),
            summary.getSubscriptionEndDate(),
            PenaltyResponse.from(summary.getCurrent()),
            summary.getRecords().stream().map(PenaltyRecordResponse::from).toList()
        );
    }
}
