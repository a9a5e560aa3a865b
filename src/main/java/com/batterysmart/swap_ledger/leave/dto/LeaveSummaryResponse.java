package com.batterysmart.swap_ledger.leave.dto;

import com.batterysmart.swap_ledger.leave.LeaveBalance;
import com.batterysmart.swap_ledger.leave.LeaveSummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class LeaveSummaryResponse {

    @JsonProperty("driver_id")
    UUID driverId;

    @JsonProperty("month")
    String month;

    @JsonProperty("total_leaves")
    int totalLeaves;

    @JsonProperty("used_leaves")
    int usedLeaves;

    @JsonProperty("remaining_leaves")
    int remainingLeaves;

    @JsonProperty("pending_count")
    long pendingCount;

    @JsonProperty("approved_count")
    long approvedCount;

    @JsonProperty("rejected_count")
    long rejectedCount;

    @JsonProperty("pending")
    List<LeaveRequestResponse> pending;

    @JsonProperty("upcoming")
    List<LeaveRequestResponse> upcoming;

    public static LeaveSummaryResponse from(LeaveSummary summary) {
        LeaveBalance balance = summary.getCurrentMonth();
        return new LeaveSummaryResponse(
            summary.getDriverId(),
            balance.getMonthKey(),
            balance.getTotalLeaves(),
            balance.getUsedLeaves(),
            balance.getRemaining(),
            summary.getPendingCount(),
            summary.getApprovedCount(),
            summary.getRejectedCount(),
            summary.getPending().stream().map(LeaveRequestResponse::from).toList(),
            summary.getUpcoming().stream().map(LeaveRequestResponse::from).toList()
        );
    }
}
