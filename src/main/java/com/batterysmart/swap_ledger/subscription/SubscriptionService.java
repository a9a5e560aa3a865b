package com.batterysmart.swap_ledger.subscription;

import com.batterysmart.swap_ledger.config.TransactionLockTimeout;
import com.batterysmart.swap_ledger.driver.DriverService;
import com.batterysmart.swap_ledger.event.SubscriptionChangedEvent;
import com.batterysmart.swap_ledger.exception.ConflictException;
import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import com.batterysmart.swap_ledger.invoice.Invoice;
import com.batterysmart.swap_ledger.invoice.InvoiceRequest;
import com.batterysmart.swap_ledger.invoice.InvoiceService;
import com.batterysmart.swap_ledger.invoice.InvoiceType;
import com.batterysmart.swap_ledger.invoice.PaymentStatus;
import com.batterysmart.swap_ledger.observability.LedgerMetrics;
import com.batterysmart.swap_ledger.outbox.OutboxService;
import com.batterysmart.swap_ledger.plan.PlanCatalog;
import com.batterysmart.swap_ledger.plan.SubscriptionPlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Subscription lifecycle: purchase, cancellation, suspension, expiry and
 * administrative usage reset.
 *
 * Writers lock the driver row before any subscription row, the same order
 * the swap path uses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final DriverSubscriptionRepository subscriptionRepository;
    private final EntitlementStore entitlementStore;
    private final DriverService driverService;
    private final PlanCatalog planCatalog;
    private final InvoiceService invoiceService;
    private final OutboxService outboxService;
    private final TransactionLockTimeout lockTimeout;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Starts a subscription today and bills it. Any subscription still
     * ACTIVE for the driver is expired first. The battery held under the
     * driver's latest subscription, whatever its status, moves to the new one.
     */
    @Transactional
    public SubscriptionResult subscribe(UUID driverId, String planCode, boolean autoRenew) {
        driverService.lockActiveDriver(driverId);
        SubscriptionPlan plan = planCatalog.findByCode(planCode);
        if (!plan.isActive()) {
            throw new InvalidInputException("planCode", "Plan " + plan.getCode() + " is not offered");
        }

        Instant now = clock.instant();
        LocalDate today = LocalDate.now(clock);

        for (DriverSubscriptionEntity entity : subscriptionRepository.findByDriverIdAndStatusForUpdate(
                driverId, SubscriptionStatus.ACTIVE)) {
            DriverSubscription expired = entity.toDomain().expire(now);
            entity.updateFromDomain(expired);
            subscriptionRepository.save(entity);
            publish(SubscriptionChangedEvent.EXPIRED, expired, plan.getCode(), now);
            log.info("Expired subscription {} on renewal for driver {}", expired.getId(), driverId);
        }

        Optional<String> carriedBattery = entitlementStore.releaseHeldBattery(driverId, now);
        DriverSubscription subscription = DriverSubscription.start(driverId, plan, today, autoRenew, now);
        if (carriedBattery.isPresent()) {
            subscription = subscription.assignBattery(carriedBattery.get(), now);
        }
        subscriptionRepository.save(DriverSubscriptionEntity.fromDomain(subscription));

        Invoice invoice = invoiceService.createInvoice(InvoiceRequest.builder()
            .type(InvoiceType.SUBSCRIPTION)
            .driverId(driverId)
            .subscriptionId(subscription.getId())
            .amount(plan.getPrice())
            .taxRate(plan.taxRate())
            .description(plan.getName() + " plan subscription")
            .paymentStatus(PaymentStatus.PENDING)
            .build());

        publish(SubscriptionChangedEvent.STARTED, subscription, plan.getCode(), now);
        log.info("Driver {} subscribed to {} until {} (invoice {})",
            driverId, plan.getCode(), subscription.getEndDate(), invoice.getInvoiceNumber());
        return new SubscriptionResult(subscription, plan, invoice);
    }

    @Transactional
    public DriverSubscription cancel(UUID subscriptionId) {
        DriverSubscriptionEntity entity = lockForLifecycle(subscriptionId);
        DriverSubscription updated = entity.toDomain().cancel(clock.instant());
        return apply(entity, updated, SubscriptionChangedEvent.CANCELLED);
    }

    @Transactional
    public DriverSubscription suspend(UUID subscriptionId) {
        DriverSubscriptionEntity entity = lockForLifecycle(subscriptionId);
        DriverSubscription updated = entity.toDomain().suspend(clock.instant());
        return apply(entity, updated, SubscriptionChangedEvent.SUSPENDED);
    }

    /**
     * Explicit administrative resume of a SUSPENDED subscription. Refused
     * while the driver has another current subscription.
     */
    @Transactional
    public DriverSubscription resume(UUID subscriptionId) {
        DriverSubscriptionEntity entity = lockForLifecycle(subscriptionId);
        List<UUID> current = subscriptionRepository.findCurrentIds(
            entity.getDriverId(), SubscriptionStatus.ACTIVE, LocalDate.now(clock));
        if (!current.isEmpty()) {
            throw new ConflictException("Driver " + entity.getDriverId() + " already has current subscription "
                + current.get(0));
        }
        DriverSubscription updated = entity.toDomain().resume(clock.instant());
        return apply(entity, updated, SubscriptionChangedEvent.STARTED);
    }

    /**
     * Sets swaps_used back to zero. The only operation that lowers the counter.
     */
    @Transactional
    public DriverSubscription resetUsage(UUID subscriptionId, String actor) {
        if (actor == null || actor.isBlank()) {
            throw new InvalidInputException("actor", "Reset requires the acting administrator");
        }
        DriverSubscriptionEntity entity = lockForLifecycle(subscriptionId);
        DriverSubscription current = entity.toDomain();
        DriverSubscription updated = current.resetUsage(clock.instant());
        entity.updateFromDomain(updated);
        subscriptionRepository.save(entity);
        log.warn("Usage on subscription {} reset from {} to 0 by {}", subscriptionId, current.getSwapsUsed(), actor);
        return updated;
    }

    /**
     * Moves every ACTIVE subscription whose end date is before {@code today}
     * to EXPIRED.
     *
     * @return number of subscriptions expired
     */
    @Transactional
    public int expireLapsed(LocalDate today) {
        List<UUID> lapsed = subscriptionRepository.findIdsByStatusAndEndDateBefore(SubscriptionStatus.ACTIVE, today);

        int expired = 0;
        for (UUID id : lapsed) {
            DriverSubscriptionEntity entity = lock(id);
            DriverSubscription current = entity.toDomain();
            if (current.getStatus() != SubscriptionStatus.ACTIVE || !current.getEndDate().isBefore(today)) {
                continue;
            }
            apply(entity, current.expire(clock.instant()), SubscriptionChangedEvent.EXPIRED);
            expired++;
        }

        if (expired > 0) {
            metrics.recordSubscriptionsExpired(expired);
            log.info("Expired {} lapsed subscriptions as of {}", expired, today);
        }
        return expired;
    }

    private DriverSubscriptionEntity lockForLifecycle(UUID subscriptionId) {
        UUID driverId = subscriptionRepository.findDriverIdById(subscriptionId)
            .orElseThrow(() -> new NotFoundException("Subscription", subscriptionId));
        driverService.lockActiveDriver(driverId);
        return lock(subscriptionId);
    }

    private DriverSubscriptionEntity lock(UUID subscriptionId) {
        lockTimeout.apply();
        return subscriptionRepository.findByIdForUpdate(subscriptionId)
            .orElseThrow(() -> new NotFoundException("Subscription", subscriptionId));
    }

    private DriverSubscription apply(DriverSubscriptionEntity entity, DriverSubscription updated, String eventType) {
        entity.updateFromDomain(updated);
        subscriptionRepository.save(entity);
        String planCode = planCatalog.findById(updated.getPlanId()).getCode();
        publish(eventType, updated, planCode, updated.getUpdatedAt());
        log.info("Subscription {} is now {}", updated.getId(), updated.getStatus());
        return updated;
    }

    private void publish(String eventType, DriverSubscription subscription, String planCode, Instant now) {
        outboxService.saveEvent(new SubscriptionChangedEvent(
            UUID.randomUUID(),
            eventType,
            subscription.getId(),
            subscription.getDriverId(),
            planCode,
            subscription.getStatus().name(),
            subscription.getStartDate(),
            subscription.getEndDate(),
            now
        ));
    }
}
