package com.batterysmart.swap_ledger.subscription;

import com.batterysmart.swap_ledger.config.TransactionLockTimeout;
import com.batterysmart.swap_ledger.driver.DriverService;
import com.batterysmart.swap_ledger.exception.ConflictException;
import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import com.batterysmart.swap_ledger.observability.CorrelationContext;
import com.batterysmart.swap_ledger.observability.LedgerMetrics;
import com.batterysmart.swap_ledger.penalty.PenaltyEngine;
import com.batterysmart.swap_ledger.plan.PlanCatalog;
import com.batterysmart.swap_ledger.plan.SubscriptionPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Usage counters and battery custody of driver subscriptions.
 *
 * Every write locks the subscription row first, so two stations reporting
 * swaps for the same driver at once are applied one after the other against
 * fresh counters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntitlementStore {

    private static final String COUNT_COVERED_SINCE =
        "SELECT COUNT(*) FROM swaps WHERE subscription_id = ? AND is_subscription_swap = TRUE " +
        "AND status <> 'FAILED' AND swap_time >= ?";

    private final DriverSubscriptionRepository subscriptionRepository;
    private final PlanCatalog planCatalog;
    private final PenaltyEngine penaltyEngine;
    private final DriverService driverService;
    private final TransactionLockTimeout lockTimeout;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * The driver's current subscription: ACTIVE and not past its end date,
     * newest start first. Several matches are answered with the newest one
     * and flagged rather than failed.
     *
     * @throws NotFoundException if the driver is unknown or has no current subscription
     */
    @Transactional(readOnly = true)
    public EntitlementView getActiveEntitlement(UUID driverId) {
        driverService.getDriver(driverId);
        LocalDate today = LocalDate.now(clock);

        List<DriverSubscriptionEntity> current =
            subscriptionRepository.findCurrent(driverId, SubscriptionStatus.ACTIVE, today);
        if (current.isEmpty()) {
            throw new NotFoundException("Active subscription for driver", driverId);
        }

        boolean integrityWarning = current.size() > 1;
        if (integrityWarning) {
            reportMultipleActive(driverId, current.size());
        }

        DriverSubscription subscription = current.get(0).toDomain();
        SubscriptionPlan plan = planCatalog.findById(subscription.getPlanId());
        return toView(subscription, plan, today, integrityWarning);
    }

    /**
     * Id of the driver's current subscription, if any. Used by writers that
     * go on to lock the row.
     */
    @Transactional(readOnly = true)
    public Optional<UUID> findCurrentSubscriptionId(UUID driverId) {
        List<UUID> ids = subscriptionRepository.findCurrentIds(
            driverId, SubscriptionStatus.ACTIVE, LocalDate.now(clock));
        if (ids.size() > 1) {
            reportMultipleActive(driverId, ids.size());
        }
        return ids.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public DriverSubscription getSubscription(UUID subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
            .map(DriverSubscriptionEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Subscription", subscriptionId));
    }

    /**
     * The driver's most recently started subscription in any status.
     */
    @Transactional(readOnly = true)
    public DriverSubscription latestSubscription(UUID driverId) {
        return subscriptionRepository.findFirstByDriverIdOrderByStartDateDescCreatedAtDesc(driverId)
            .map(DriverSubscriptionEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Subscription for driver", driverId));
    }

    /**
     * Subscriptions that ended before {@code cutoff} with the battery still out.
     */
    @Transactional(readOnly = true)
    public List<UUID> findUnreturnedEndedBefore(LocalDate cutoff) {
        return subscriptionRepository.findUnreturnedEndedBefore(cutoff);
    }

    /**
     * Counts one swap against the subscription and decides whether it is
     * covered. Overage swaps are counted too.
     *
     * @throws ConflictException (retryable) if the row lock is not acquired in time,
     *                           (not retryable) if the subscription is no longer current
     */
    @Transactional
    public SwapConsumption consumeSwap(UUID subscriptionId) {
        DriverSubscriptionEntity entity = lockSubscription(subscriptionId);
        DriverSubscription subscription = entity.toDomain();
        LocalDate today = LocalDate.now(clock);

        if (!subscription.isActiveOn(today)) {
            throw new ConflictException("Subscription " + subscriptionId + " is not current ("
                + subscription.getStatus() + ", ends " + subscription.getEndDate() + ")");
        }

        SubscriptionPlan plan = planCatalog.findById(subscription.getPlanId());
        int usedToday = countCoveredSwapsSince(subscriptionId, startOfDay(today));
        CoverageRule.Outcome outcome = CoverageRule.decide(plan, subscription.getSwapsUsed(), usedToday);

        DriverSubscription updated = subscription.recordSwap(clock.instant());
        entity.updateFromDomain(updated);
        subscriptionRepository.save(entity);

        log.debug("Swap counted on subscription {}: outcome={}, used={}",
            subscriptionId, outcome, updated.getSwapsUsed());
        return SwapConsumption.of(updated, plan, outcome);
    }

    /**
     * Hands a battery to the driver. Clears any earlier return or misplaced flag.
     */
    @Transactional
    public DriverSubscription setCustody(UUID subscriptionId, String batteryId) {
        if (batteryId == null || batteryId.isBlank()) {
            throw new InvalidInputException("batteryId", "Battery id is required");
        }
        DriverSubscriptionEntity entity = lockSubscription(subscriptionId);
        DriverSubscription updated = entity.toDomain().assignBattery(batteryId.trim(), clock.instant());
        entity.updateFromDomain(updated);
        subscriptionRepository.save(entity);
        return updated;
    }

    /**
     * Records the battery as returned. Calling it again keeps the first
     * return timestamp.
     */
    @Transactional
    public DriverSubscription markReturned(UUID subscriptionId, Instant returnedAt) {
        DriverSubscriptionEntity entity = lockSubscription(subscriptionId);
        DriverSubscription current = entity.toDomain();
        DriverSubscription updated = current.markReturned(returnedAt != null ? returnedAt : clock.instant());
        if (updated == current) {
            log.debug("Battery on subscription {} already returned at {}", subscriptionId,
                current.getBatteryReturnedAt());
            return current;
        }

        entity.updateFromDomain(updated);
        subscriptionRepository.save(entity);
        log.info("Battery {} returned on subscription {}", updated.getBatteryId(), subscriptionId);
        return updated;
    }

    /**
     * Closes custody of a battery the driver handed in at a station, on
     * whichever of the driver's subscriptions still shows it as out,
     * expired or cancelled ones included. Callers hold the driver lock.
     *
     * @return number of subscriptions whose custody was closed
     */
    @Transactional
    public int returnHandedInBattery(UUID driverId, String batteryId, Instant returnedAt) {
        if (batteryId == null || batteryId.isBlank()) {
            return 0;
        }
        return closeCustody(subscriptionRepository.findHoldingBatteryForUpdate(driverId, batteryId.trim()),
            returnedAt);
    }

    /**
     * Takes back every battery still out on the driver's subscriptions and
     * returns the one held under the most recent of them, so it can move to
     * a new subscription.
     */
    @Transactional
    public Optional<String> releaseHeldBattery(UUID driverId, Instant now) {
        List<DriverSubscriptionEntity> holding = subscriptionRepository.findHoldingBatteryForUpdate(driverId);
        if (holding.isEmpty()) {
            return Optional.empty();
        }
        String latest = holding.get(0).getBatteryId();
        closeCustody(holding, now);
        return Optional.of(latest);
    }

    private int closeCustody(List<DriverSubscriptionEntity> holding, Instant returnedAt) {
        for (DriverSubscriptionEntity entity : holding) {
            DriverSubscription updated = entity.toDomain().markReturned(returnedAt);
            entity.updateFromDomain(updated);
            subscriptionRepository.save(entity);
            log.info("Battery {} closed on {} subscription {}", updated.getBatteryId(), updated.getStatus(),
                updated.getId());
        }
        return holding.size();
    }

    @Transactional
    public DriverSubscription markMisplaced(UUID subscriptionId) {
        DriverSubscriptionEntity entity = lockSubscription(subscriptionId);
        DriverSubscription updated = entity.toDomain().markMisplaced(clock.instant());
        entity.updateFromDomain(updated);
        subscriptionRepository.save(entity);
        log.warn("Battery {} reported misplaced on subscription {}", updated.getBatteryId(), subscriptionId);
        return updated;
    }

    private EntitlementView toView(DriverSubscription subscription, SubscriptionPlan plan,
                                   LocalDate today, boolean integrityWarning) {
        int usedToday = countCoveredSwapsSince(subscription.getId(), startOfDay(today));
        return EntitlementView.builder()
            .subscriptionId(subscription.getId())
            .driverId(subscription.getDriverId())
            .status(subscription.getStatus())
            .planCode(plan.getCode())
            .planName(plan.getName())
            .planPrice(plan.getPrice())
            .swapsIncluded(plan.getSwapsIncluded())
            .swapsUsed(subscription.getSwapsUsed())
            .swapsRemaining(CoverageRule.swapsRemaining(plan, subscription.getSwapsUsed()))
            .swapsPerDay(plan.getSwapsPerDay())
            .swapsUsedToday(usedToday)
            .extraSwapPrice(plan.getExtraSwapPrice())
            .startDate(subscription.getStartDate())
            .endDate(subscription.getEndDate())
            .daysRemaining(subscription.daysRemaining(today))
            .autoRenew(subscription.isAutoRenew())
            .batteryId(subscription.getBatteryId())
            .batteryReturned(subscription.isBatteryReturned())
            .batteryMisplaced(subscription.isMisplaced())
            .batteryReturnedAt(subscription.getBatteryReturnedAt())
            .penalty(penaltyEngine.computePenalty(subscription, today))
            .integrityWarning(integrityWarning)
            .build();
    }

    private DriverSubscriptionEntity lockSubscription(UUID subscriptionId) {
        lockTimeout.apply();
        try {
            DriverSubscriptionEntity entity = subscriptionRepository.findByIdForUpdate(subscriptionId)
                .orElseThrow(() -> new NotFoundException("Subscription", subscriptionId));
            CorrelationContext.tagSubscription(subscriptionId);
            return entity;
        } catch (PessimisticLockingFailureException e) {
            throw new ConflictException("Subscription " + subscriptionId + " is busy, retry the request", e);
        }
    }

    private int countCoveredSwapsSince(UUID subscriptionId, Instant since) {
        Integer count = jdbcTemplate.queryForObject(
            COUNT_COVERED_SINCE, Integer.class, subscriptionId, Timestamp.from(since));
        return count != null ? count : 0;
    }

    private Instant startOfDay(LocalDate today) {
        return today.atStartOfDay(clock.getZone()).toInstant();
    }

    private void reportMultipleActive(UUID driverId, int count) {
        log.warn("Driver {} has {} current subscriptions; answering with the newest", driverId, count);
        metrics.recordIntegrityViolation("multiple_active");
    }
}
