package com.batterysmart.swap_ledger.swap;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A driver's swaps over a date range, newest first. {@code swaps} is one
 * page; the counts and the charged total cover every swap in the range.
 * {@code from} is null for an unbounded range.
 */
@Value
public class SwapHistory {
    UUID driverId;
    HistoryPeriod period;
    LocalDate from;
    LocalDate to;
    List<Entry> swaps;
    int totalSwaps;
    BigDecimal totalCharged;
    int freeSwaps;

    @Value
    static class Totals {
        int swaps;
        BigDecimal charged;
        int free;
    }

    @Value
    public static class Entry {
        UUID swapId;
        Instant swapTime;
        UUID stationId;
        String stationCode;
        String stationName;
        UUID subscriptionId;
        String oldBatteryId;
        String newBatteryId;
        int oldChargeLevel;
        int newChargeLevel;
        boolean subscriptionSwap;
        BigDecimal chargeAmount;
        SwapStatus status;
        String invoiceNumber;
    }
}
