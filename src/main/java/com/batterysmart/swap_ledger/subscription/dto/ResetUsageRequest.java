package com.batterysmart.swap_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class ResetUsageRequest {

    @NotBlank(message = "Actor is required")
    @Size(max = 100)
    @JsonProperty("actor")
    String actor;
}
