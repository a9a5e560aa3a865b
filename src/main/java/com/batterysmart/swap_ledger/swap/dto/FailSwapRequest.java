package com.batterysmart.swap_ledger.swap.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class FailSwapRequest {

    @NotBlank(message = "Failure reason is required")
    @Size(max = 500)
    @JsonProperty("reason")
    String reason;
}
