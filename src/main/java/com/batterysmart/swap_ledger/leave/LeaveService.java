package com.batterysmart.swap_ledger.leave;

import com.batterysmart.swap_ledger.driver.DriverService;
import com.batterysmart.swap_ledger.event.LeaveDecidedEvent;
import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import com.batterysmart.swap_ledger.observability.CorrelationContext;
import com.batterysmart.swap_ledger.observability.LedgerMetrics;
import com.batterysmart.swap_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Leave request workflow. Approval charges every day of the request to
 * the month it falls in, in the same transaction as the status change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeaveService {

    private static final int MAX_REASON_LENGTH = 500;

    private final LeaveRequestRepository leaveRepository;
    private final LeaveLedger leaveLedger;
    private final DriverService driverService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    @Transactional
    public LeaveRequest requestLeave(UUID driverId, LocalDate startDate, LocalDate endDate, String reason) {
        CorrelationContext.tagDriver(driverId);
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            throw new InvalidInputException("reason", "Leave reason must be at most " + MAX_REASON_LENGTH + " characters");
        }
        driverService.lockActiveDriver(driverId);

        LeaveRequest request = LeaveRequest.request(driverId, startDate, endDate, reason, clock.instant());

        long overlapping = leaveRepository.countOverlapping(driverId,
            EnumSet.of(LeaveStatus.PENDING, LeaveStatus.APPROVED), startDate, endDate);
        if (overlapping > 0) {
            throw new InvalidInputException("dates",
                String.format("Leave %s to %s overlaps an existing request", startDate, endDate));
        }

        leaveLedger.getOrCreate(driverId, YearMonth.from(startDate));
        leaveRepository.save(LeaveRequestEntity.fromDomain(request));

        metrics.recordLeaveTransition(LeaveStatus.PENDING.name());
        log.info("Driver {} requested {} day(s) of leave from {} to {}",
            driverId, request.days(), startDate, endDate);
        return request;
    }

    @Transactional
    public LeaveRequest approve(UUID requestId, String actor) {
        LeaveRequestEntity entity = lockForDecision(requestId);
        LeaveRequest approved = entity.toDomain().approve(requireActor(actor), clock.instant());

        for (Map.Entry<YearMonth, Integer> month : approved.daysByMonth().entrySet()) {
            LeaveBalance balance = leaveLedger.consume(approved.getDriverId(), month.getKey(), month.getValue());
            log.debug("Charged {} day(s) to {}, {} remaining", month.getValue(), balance.getMonthKey(),
                balance.getRemaining());
        }

        return decide(entity, approved, LeaveDecidedEvent.APPROVED);
    }

    @Transactional
    public LeaveRequest reject(UUID requestId, String actor) {
        LeaveRequestEntity entity = lockForDecision(requestId);
        LeaveRequest rejected = entity.toDomain().reject(requireActor(actor), clock.instant());
        return decide(entity, rejected, LeaveDecidedEvent.REJECTED);
    }

    @Transactional(readOnly = true)
    public LeaveRequest getRequest(UUID requestId) {
        return leaveRepository.findById(requestId)
            .map(LeaveRequestEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Leave request", requestId));
    }

    /**
     * Current-month balance with pending and upcoming approved leave.
     * Opens the current month's balance if the driver has none yet.
     */
    @Transactional
    public LeaveSummary getLeaveSummary(UUID driverId) {
        driverService.getDriver(driverId);
        LocalDate today = LocalDate.now(clock);

        LeaveBalance balance = leaveLedger.getOrCreate(driverId, YearMonth.from(today));
        List<LeaveRequest> pending = leaveRepository
            .findByDriverIdAndStatusOrderByStartDateAsc(driverId, LeaveStatus.PENDING)
            .stream()
            .map(LeaveRequestEntity::toDomain)
            .toList();
        List<LeaveRequest> upcoming = leaveRepository
            .findByDriverIdAndStatusAndEndDateGreaterThanEqualOrderByStartDateAsc(driverId, LeaveStatus.APPROVED, today)
            .stream()
            .map(LeaveRequestEntity::toDomain)
            .toList();

        return new LeaveSummary(
            driverId,
            balance,
            pending,
            upcoming,
            pending.size(),
            leaveRepository.countByDriverIdAndStatus(driverId, LeaveStatus.APPROVED),
            leaveRepository.countByDriverIdAndStatus(driverId, LeaveStatus.REJECTED)
        );
    }

    private LeaveRequestEntity lockForDecision(UUID requestId) {
        UUID driverId = leaveRepository.findDriverIdById(requestId)
            .orElseThrow(() -> new NotFoundException("Leave request", requestId));
        CorrelationContext.tagDriver(driverId);
        driverService.lockActiveDriver(driverId);
        return leaveRepository.findByIdForUpdate(requestId)
            .orElseThrow(() -> new NotFoundException("Leave request", requestId));
    }

    private LeaveRequest decide(LeaveRequestEntity entity, LeaveRequest decided, String eventType) {
        entity.updateFromDomain(decided);
        leaveRepository.save(entity);

        Instant now = decided.getProcessedAt();
        outboxService.saveEvent(new LeaveDecidedEvent(
            UUID.randomUUID(),
            eventType,
            decided.getId(),
            decided.getDriverId(),
            decided.getStartDate(),
            decided.getEndDate(),
            decided.days(),
            decided.getProcessedBy(),
            now
        ));

        metrics.recordLeaveTransition(decided.getStatus().name());
        log.info("Leave request {} {} by {}", decided.getId(), decided.getStatus(), decided.getProcessedBy());
        return decided;
    }

    private static String requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new InvalidInputException("actor", "Deciding a leave request requires the acting user");
        }
        return actor.trim();
    }
}
