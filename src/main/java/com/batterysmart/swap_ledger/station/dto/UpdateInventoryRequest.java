package com.batterysmart.swap_ledger.station.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class UpdateInventoryRequest {

    @NotNull
    @Min(0)
    @JsonProperty("available_batteries")
    Integer availableBatteries;

    @NotNull
    @Min(0)
    @JsonProperty("charging_batteries")
    Integer chargingBatteries;

    @NotNull
    @Min(0)
    @JsonProperty("total_slots")
    Integer totalSlots;
}
