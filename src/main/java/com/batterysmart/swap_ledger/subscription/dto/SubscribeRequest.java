package com.batterysmart.swap_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class SubscribeRequest {

    @NotBlank(message = "Plan code is required")
    @JsonProperty("plan_code")
    String planCode;

    @JsonProperty("auto_renew")
    Boolean autoRenew;
}
