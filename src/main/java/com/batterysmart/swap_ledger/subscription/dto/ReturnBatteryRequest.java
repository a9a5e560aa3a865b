package com.batterysmart.swap_ledger.subscription.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/**
 * Return time defaults to now when absent.
 */
@Value
public class ReturnBatteryRequest {

    @JsonProperty("returned_at")
    Instant returnedAt;
}
