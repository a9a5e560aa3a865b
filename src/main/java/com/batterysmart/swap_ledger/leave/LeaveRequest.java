package com.batterysmart.swap_ledger.leave;

import com.batterysmart.swap_ledger.exception.IllegalTransitionException;
import com.batterysmart.swap_ledger.exception.InvalidInputException;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * A driver's request for days off, inclusive of both dates.
 */
@Value
public class LeaveRequest {
    UUID id;
    UUID driverId;
    LocalDate startDate;
    LocalDate endDate;
    String reason;
    LeaveStatus status;
    Instant createdAt;
    Instant processedAt;
    String processedBy;

    static LeaveRequest request(UUID driverId, LocalDate startDate, LocalDate endDate, String reason, Instant now) {
        if (startDate == null || endDate == null) {
            throw new InvalidInputException("dates", "Leave start and end dates are required");
        }
        if (endDate.isBefore(startDate)) {
            throw new InvalidInputException("endDate",
                String.format("Leave ends on %s, before it starts on %s", endDate, startDate));
        }
        return new LeaveRequest(UUID.randomUUID(), driverId, startDate, endDate, reason,
            LeaveStatus.PENDING, now, null, null);
    }

    public int days() {
        return (int) ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    /**
     * Days of the request grouped by the calendar month they fall in,
     * earliest month first.
     */
    public Map<YearMonth, Integer> daysByMonth() {
        Map<YearMonth, Integer> byMonth = new TreeMap<>();
        for (LocalDate day = startDate; !day.isAfter(endDate); day = day.plusDays(1)) {
            byMonth.merge(YearMonth.from(day), 1, Integer::sum);
        }
        return byMonth;
    }

    public LeaveRequest approve(String actor, Instant now) {
        return decide(LeaveStatus.APPROVED, actor, now);
    }

    public LeaveRequest reject(String actor, Instant now) {
        return decide(LeaveStatus.REJECTED, actor, now);
    }

    private LeaveRequest decide(LeaveStatus target, String actor, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalTransitionException("leave request " + id, status, target);
        }
        return new LeaveRequest(id, driverId, startDate, endDate, reason, target, createdAt, now, actor);
    }
}
