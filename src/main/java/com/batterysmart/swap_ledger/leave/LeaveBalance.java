package com.batterysmart.swap_ledger.leave;

import lombok.Value;

import java.util.UUID;

/**
 * Leave allowance of one driver for one calendar month ({@code yyyy-MM}).
 */
@Value
public class LeaveBalance {
    UUID id;
    UUID driverId;
    String monthKey;
    int totalLeaves;
    int usedLeaves;

    public int getRemaining() {
        return totalLeaves - usedLeaves;
    }
}
