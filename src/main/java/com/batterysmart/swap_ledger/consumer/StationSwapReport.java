package com.batterysmart.swap_ledger.consumer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.Builder;

import java.time.Instant;
import java.util.UUID;

/**
 * A swap reported by station hardware over Kafka. The driver is given by
 * id or by phone number.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class StationSwapReport {

    @JsonProperty("report_id")
    UUID reportId;

    @JsonProperty("station_code")
    String stationCode;

    @JsonProperty("driver_id")
    UUID driverId;

    @JsonProperty("driver_phone")
    String driverPhone;

    @JsonProperty("old_battery_id")
    String oldBatteryId;

    @JsonProperty("new_battery_id")
    String newBatteryId;

    @JsonProperty("old_charge_pct")
    Integer oldChargePct;

    @JsonProperty("new_charge_pct")
    Integer newChargePct;

    @JsonProperty("reported_at")
    Instant reportedAt;
}
