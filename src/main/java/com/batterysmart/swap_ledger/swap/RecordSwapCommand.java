package com.batterysmart.swap_ledger.swap;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A station's report of one battery exchange. The station is identified by
 * id or, failing that, by code.
 */
@Value
@Builder
public class RecordSwapCommand {
    UUID driverId;
    UUID stationId;
    String stationCode;
    String oldBatteryId;
    String newBatteryId;
    Integer oldChargePct;
    Integer newChargePct;
    String idempotencyKey;
}
