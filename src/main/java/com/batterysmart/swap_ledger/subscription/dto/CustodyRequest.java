package com.batterysmart.swap_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CustodyRequest {

    @NotBlank(message = "Battery id is required")
    @Size(max = 50)
    @JsonProperty("battery_id")
    String batteryId;
}
