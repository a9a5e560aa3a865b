package com.batterysmart.swap_ledger.leave.dto;

import com.batterysmart.swap_ledger.leave.LeaveRequest;
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
public class LeaveRequestResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("driver_id")
    UUID driverId;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("days")
    int days;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("status")
    String status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("processed_at")
    Instant processedAt;

    @JsonProperty("processed_by")
    String processedBy;

    public static LeaveRequestResponse from(LeaveRequest request) {
        return LeaveRequestResponse.builder()
            .id(request.getId())
            .driverId(request.getDriverId())
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .days(request.days())
            .reason(request.getReason())
            .status(request.getStatus().name())
            .createdAt(request.getCreatedAt())
            .processedAt(request.getProcessedAt())
            .processedBy(request.getProcessedBy())
            .build();
    }
}
