package com.batterysmart.swap_ledger.penalty;

import com.batterysmart.swap_ledger.config.LedgerProperties;
import com.batterysmart.swap_ledger.event.PenaltyEvent;
import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import com.batterysmart.swap_ledger.invoice.Invoice;
import com.batterysmart.swap_ledger.invoice.InvoiceRequest;
import com.batterysmart.swap_ledger.invoice.InvoiceService;
import com.batterysmart.swap_ledger.invoice.InvoiceType;
import com.batterysmart.swap_ledger.invoice.PaymentStatus;
import com.batterysmart.swap_ledger.observability.LedgerMetrics;
import com.batterysmart.swap_ledger.outbox.OutboxService;
import com.batterysmart.swap_ledger.subscription.DriverSubscription;
import com.batterysmart.swap_ledger.subscription.EntitlementStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads penalties on demand and materializes them as records.
 *
 * Computing a penalty never writes. {@link #assessPenalty} is the explicit
 * write: it keeps the PENDING record of a subscription in line with the
 * computed figures and leaves PAID or WAIVED records alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PenaltyService {

    private static final String SELECT_RECORD =
        "SELECT id, driver_id, subscription_id, reason, days_overdue, daily_rate, total_amount, status, " +
        "settled_at, settled_by, created_at, updated_at FROM penalty_records ";

    private static final String UPSERT_PENDING =
        "INSERT INTO penalty_records (id, driver_id, subscription_id, reason, days_overdue, daily_rate, " +
        "total_amount, status, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, 'PENDING', ?, ?) " +
        "ON CONFLICT (subscription_id, reason) DO UPDATE SET days_overdue = EXCLUDED.days_overdue, " +
        "daily_rate = EXCLUDED.daily_rate, total_amount = EXCLUDED.total_amount, " +
        "updated_at = EXCLUDED.updated_at " +
        "WHERE penalty_records.status = 'PENDING'";

    private final PenaltyEngine penaltyEngine;
    private final EntitlementStore entitlementStore;
    private final PenaltyRecordRepository penaltyRepository;
    private final InvoiceService invoiceService;
    private final OutboxService outboxService;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    @Transactional(readOnly = true)
    public PenaltyView getPenalty(UUID subscriptionId) {
        DriverSubscription subscription = entitlementStore.getSubscription(subscriptionId);
        return penaltyEngine.computePenalty(subscription, LocalDate.now(clock));
    }

    /**
     * Penalty on the driver's most recent subscription, with every record
     * materialized for the driver.
     */
    @Transactional(readOnly = true)
    public DriverPenaltySummary getPenaltyForDriver(UUID driverId) {
        DriverSubscription latest = entitlementStore.latestSubscription(driverId);
        PenaltyView current = penaltyEngine.computePenalty(latest, LocalDate.now(clock));
        List<PenaltyRecord> records = jdbcTemplate.query(
            SELECT_RECORD + "WHERE driver_id = ? ORDER BY created_at DESC", recordRowMapper(), driverId);
        return new DriverPenaltySummary(driverId, latest.getId(), latest.getEndDate(), current, records);
    }

    /**
     * Writes the current figures of an overdue battery penalty.
     *
     * @return the record for the subscription, or empty when nothing is
     *         owed and nothing was recorded before
     */
    @Transactional
    public Optional<PenaltyRecord> assessPenalty(UUID subscriptionId) {
        return assess(subscriptionId, LocalDate.now(clock));
    }

    private Optional<PenaltyRecord> assess(UUID subscriptionId, LocalDate today) {
        DriverSubscription subscription = entitlementStore.getSubscription(subscriptionId);
        PenaltyView view = penaltyEngine.computePenalty(subscription, today);
        Optional<PenaltyRecord> existing = findRecord(subscriptionId, PenaltyReason.BATTERY_NOT_RETURNED);

        if (!view.isHasPenalty()) {
            return existing;
        }
        if (existing.isPresent() && (existing.get().getStatus().isFinal()
                || existing.get().getDaysOverdue() == view.getDaysOverdue())) {
            return existing;
        }

        Instant now = clock.instant();
        int updated = jdbcTemplate.update(UPSERT_PENDING,
            UUID.randomUUID(), subscription.getDriverId(), subscriptionId,
            PenaltyReason.BATTERY_NOT_RETURNED.name(), view.getDaysOverdue(), view.getDailyRate(),
            view.getTotalAmount(), Timestamp.from(now), Timestamp.from(now));

        PenaltyRecord record = findRecord(subscriptionId, PenaltyReason.BATTERY_NOT_RETURNED)
            .orElseThrow(() -> new IllegalStateException("Penalty record missing after upsert: " + subscriptionId));
        if (updated == 0) {
            return Optional.of(record);
        }

        publish(PenaltyEvent.ASSESSED, record, now);
        metrics.recordPenaltyAssessed();
        log.info("Assessed penalty on subscription {}: {} days overdue, total {}",
            subscriptionId, record.getDaysOverdue(), record.getTotalAmount());
        return Optional.of(record);
    }

    /**
     * Settles a PENDING penalty and issues a paid PENALTY invoice for it.
     */
    @Transactional
    public PenaltySettlement markPaid(UUID penaltyId, String actor) {
        PenaltyRecordEntity entity = lockRecord(penaltyId);
        Instant now = clock.instant();
        PenaltyRecord paid = entity.toDomain().markPaid(requireActor(actor), now);
        entity.updateFromDomain(paid);
        penaltyRepository.save(entity);

        Invoice invoice = invoiceService.createInvoice(InvoiceRequest.builder()
            .type(InvoiceType.PENALTY)
            .driverId(paid.getDriverId())
            .subscriptionId(paid.getSubscriptionId())
            .amount(paid.getTotalAmount())
            .taxRate(BigDecimal.ZERO)
            .description("Battery not returned: " + paid.getDaysOverdue() + " days at Rs." + paid.getDailyRate())
            .paymentStatus(PaymentStatus.PAID)
            .build());

        publish(PenaltyEvent.PAID, paid, now);
        metrics.recordPenaltySettled(PenaltyStatus.PAID.name());
        log.info("Penalty {} paid, invoice {}", penaltyId, invoice.getInvoiceNumber());
        return new PenaltySettlement(paid, invoice);
    }

    @Transactional
    public PenaltyRecord waive(UUID penaltyId, String actor) {
        PenaltyRecordEntity entity = lockRecord(penaltyId);
        Instant now = clock.instant();
        PenaltyRecord waived = entity.toDomain().waive(requireActor(actor), now);
        entity.updateFromDomain(waived);
        penaltyRepository.save(entity);

        publish(PenaltyEvent.WAIVED, waived, now);
        metrics.recordPenaltySettled(PenaltyStatus.WAIVED.name());
        log.info("Penalty {} waived by {}", penaltyId, actor);
        return waived;
    }

    /**
     * Assesses every subscription whose battery is still out past the grace
     * period.
     *
     * @return number of subscriptions holding a penalty record afterwards
     */
    @Transactional
    public int sweep(LocalDate today) {
        LocalDate cutoff = today.minusDays(properties.getPenalty().getGracePeriodDays());
        int assessed = 0;
        for (UUID subscriptionId : entitlementStore.findUnreturnedEndedBefore(cutoff)) {
            if (assess(subscriptionId, today).isPresent()) {
                assessed++;
            }
        }
        log.info("Penalty sweep for {} assessed {} subscriptions", today, assessed);
        return assessed;
    }

    private Optional<PenaltyRecord> findRecord(UUID subscriptionId, PenaltyReason reason) {
        return jdbcTemplate.query(SELECT_RECORD + "WHERE subscription_id = ? AND reason = ?",
                recordRowMapper(), subscriptionId, reason.name())
            .stream()
            .findFirst();
    }

    private PenaltyRecordEntity lockRecord(UUID penaltyId) {
        return penaltyRepository.findByIdForUpdate(penaltyId)
            .orElseThrow(() -> new NotFoundException("Penalty", penaltyId));
    }

    private void publish(String eventType, PenaltyRecord record, Instant now) {
        outboxService.saveEvent(new PenaltyEvent(
            UUID.randomUUID(),
            eventType,
            record.getId(),
            record.getSubscriptionId(),
            record.getDriverId(),
            record.getDaysOverdue(),
            record.getTotalAmount(),
            record.getStatus().name(),
            now
        ));
    }

    private static String requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new InvalidInputException("actor", "Settling a penalty requires the acting user");
        }
        return actor.trim();
    }

    private RowMapper<PenaltyRecord> recordRowMapper() {
        return (rs, rowNum) -> new PenaltyRecord(
            rs.getObject("id", UUID.class),
            rs.getObject("driver_id", UUID.class),
            rs.getObject("subscription_id", UUID.class),
            PenaltyReason.valueOf(rs.getString("reason")),
            rs.getInt("days_overdue"),
            rs.getBigDecimal("daily_rate"),
            rs.getBigDecimal("total_amount"),
            PenaltyStatus.valueOf(rs.getString("status")),
            rs.getTimestamp("settled_at") != null ? rs.getTimestamp("settled_at").toInstant() : null,
            rs.getString("settled_by"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
