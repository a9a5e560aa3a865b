package com.batterysmart.swap_ledger.leave;

import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class LeaveSummary {
    UUID driverId;
    LeaveBalance currentMonth;
    List<LeaveRequest> pending;
    List<LeaveRequest> upcoming;
    long pendingCount;
    long approvedCount;
    long rejectedCount;
}
