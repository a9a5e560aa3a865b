package com.batterysmart.swap_ledger.penalty;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Live penalty on a driver's latest subscription plus the records already
 * materialized for the driver.
 */
@Value
public class DriverPenaltySummary {
    UUID driverId;
    UUID subscriptionId;
    LocalDate subscriptionEndDate;
    PenaltyView current;
    List<PenaltyRecord> records;
}
