package com.batterysmart.swap_ledger.leave.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.LocalDate;

@Value
public class LeaveRequestBody {

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonProperty("end_date")
    LocalDate endDate;

    @Size(max = 500)
    @JsonProperty("reason")
    String reason;
}
