package com.batterysmart.swap_ledger.swap.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Station identified by {@code station_id} or {@code station_code}.
 */
@Value
public class RecordSwapRequest {

    @NotNull(message = "Driver id is required")
    @JsonProperty("driver_id")
    UUID driverId;

    @JsonProperty("station_id")
    UUID stationId;

    @Size(max = 20)
    @JsonProperty("station_code")
    String stationCode;

    @NotBlank(message = "Old battery id is required")
    @Size(max = 50)
    @JsonProperty("old_battery_id")
    String oldBatteryId;

    @NotBlank(message = "New battery id is required")
    @Size(max = 50)
    @JsonProperty("new_battery_id")
    String newBatteryId;

    @NotNull
    @Min(0)
    @Max(100)
    @JsonProperty("old_charge_pct")
    Integer oldChargePct;

    @NotNull
    @Min(0)
    @Max(100)
    @JsonProperty("new_charge_pct")
    Integer newChargePct;
}
