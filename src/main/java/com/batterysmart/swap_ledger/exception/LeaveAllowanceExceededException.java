package com.batterysmart.swap_ledger.exception;

/**
 * Approving a leave request would take a month's balance below zero.
 */
public class LeaveAllowanceExceededException extends ConflictException {

    private final String monthKey;
    private final int requested;
    private final int remaining;

    public LeaveAllowanceExceededException(String monthKey, int requested, int remaining) {
        super(String.format("Leave allowance exceeded for %s: requested %d day(s), %d remaining",
                monthKey, requested, remaining));
        this.monthKey = monthKey;
        this.requested = requested;
        this.remaining = remaining;
    }

    public String getMonthKey() {
        return monthKey;
    }

    public int getRequested() {
        return requested;
    }

    public int getRemaining() {
        return remaining;
    }

    @Override
    public String getErrorCode() {
        return "LEAVE_ALLOWANCE_EXCEEDED";
    }
}
