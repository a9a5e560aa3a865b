package com.batterysmart.swap_ledger.swap;

import com.batterysmart.swap_ledger.config.LedgerProperties;
import com.batterysmart.swap_ledger.driver.DriverService;
import com.batterysmart.swap_ledger.event.SwapRecordedEvent;
import com.batterysmart.swap_ledger.exception.ConflictException;
import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import com.batterysmart.swap_ledger.invoice.Invoice;
import com.batterysmart.swap_ledger.invoice.InvoiceRepository;
import com.batterysmart.swap_ledger.invoice.InvoiceEntity;
import com.batterysmart.swap_ledger.invoice.InvoiceRequest;
import com.batterysmart.swap_ledger.invoice.InvoiceService;
import com.batterysmart.swap_ledger.invoice.InvoiceType;
import com.batterysmart.swap_ledger.invoice.PaymentStatus;
import com.batterysmart.swap_ledger.observability.CorrelationContext;
import com.batterysmart.swap_ledger.observability.LedgerMetrics;
import com.batterysmart.swap_ledger.outbox.OutboxService;
import com.batterysmart.swap_ledger.plan.PlanCatalog;
import com.batterysmart.swap_ledger.subscription.CoverageRule;
import com.batterysmart.swap_ledger.subscription.DriverSubscription;
import com.batterysmart.swap_ledger.subscription.EntitlementStore;
import com.batterysmart.swap_ledger.subscription.SwapConsumption;
import com.batterysmart.swap_ledger.station.Station;
import com.batterysmart.swap_ledger.station.StationDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Records battery exchanges and decides what each one costs.
 *
 * One transaction per swap: driver lock, subscription lock and counter
 * update, swap row, invoice (when something is charged) and outbox events
 * commit together. Lock order is driver row, then subscription row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SwapProcessor {

    private final DriverService driverService;
    private final StationDirectory stationDirectory;
    private final EntitlementStore entitlementStore;
    private final PlanCatalog planCatalog;
    private final InvoiceService invoiceService;
    private final InvoiceRepository invoiceRepository;
    private final SwapEventRepository swapRepository;
    private final SwapIdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Records one swap. Repeating a request with the same idempotency key
     * returns the original outcome without writing anything.
     *
     * @throws InvalidInputException if charge levels are outside 0..100 or battery ids are blank
     * @throws NotFoundException     if the driver or station is unknown or inactive
     * @throws ConflictException     (retryable) if the driver or subscription lock is not acquired in time
     */
    @Transactional
    public SwapResult recordSwap(RecordSwapCommand command) {
        long start = System.nanoTime();
        validate(command);
        CorrelationContext.tagDriver(command.getDriverId());

        String key = command.getIdempotencyKey();
        if (key != null) {
            Optional<SwapResult> replay = idempotencyService.findSwapId(key).flatMap(id -> replay(id, command));
            if (replay.isPresent()) {
                return replay.get();
            }
        }

        driverService.lockActiveDriver(command.getDriverId());
        Station station = resolveStation(command);

        if (key != null) {
            Optional<SwapResult> replay = idempotencyService.findInDatabase(key).flatMap(id -> replay(id, command));
            if (replay.isPresent()) {
                return replay.get();
            }
        }

        entitlementStore.returnHandedInBattery(command.getDriverId(), command.getOldBatteryId(), clock.instant());

        Optional<UUID> subscriptionId = entitlementStore.findCurrentSubscriptionId(command.getDriverId());
        SwapResult result = subscriptionId
            .map(id -> recordUnderSubscription(command, station, id))
            .orElseGet(() -> recordPayPerSwap(command, station));

        if (key != null) {
            idempotencyService.rememberAfterCommit(key, result.getSwapId());
        }

        metrics.recordSwap(result.isCovered(), Duration.ofNanos(System.nanoTime() - start));
        log.info("Swap {} recorded at {}: coverage={}, charge={}, invoice={}",
            result.getSwapId(), station.getCode(), result.getCoverage(), result.getChargeAmount(),
            result.getInvoiceNumber());
        return result;
    }

    /**
     * Marks a completed swap as operationally failed. Quota already counted
     * stays counted.
     */
    @Transactional
    public SwapEvent markFailed(UUID swapId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new InvalidInputException("reason", "Failure reason is required");
        }
        SwapEventEntity entity = lockSwap(swapId);
        SwapEvent updated = entity.toDomain().markFailed(reason.trim(), clock.instant());
        entity.updateFromDomain(updated);
        swapRepository.save(entity);
        log.warn("Swap {} marked FAILED: {}", swapId, reason);
        return updated;
    }

    /**
     * Reverses the charge of a swap: the swap becomes REFUNDED and an unpaid
     * invoice for it is marked FAILED.
     */
    @Transactional
    public SwapEvent refund(UUID swapId) {
        SwapEventEntity entity = lockSwap(swapId);
        SwapEvent updated = entity.toDomain().refund(clock.instant());
        entity.updateFromDomain(updated);
        swapRepository.save(entity);

        invoiceRepository.findFirstBySwapId(swapId)
            .map(InvoiceEntity::toDomain)
            .filter(invoice -> invoice.getPaymentStatus() == PaymentStatus.PENDING)
            .ifPresent(invoice -> invoiceService.updatePaymentStatus(invoice.getInvoiceNumber(), PaymentStatus.FAILED));

        log.info("Swap {} refunded", swapId);
        return updated;
    }

    private SwapResult recordUnderSubscription(RecordSwapCommand command, Station station, UUID subscriptionId) {
        SwapConsumption consumption = entitlementStore.consumeSwap(subscriptionId);
        Instant now = clock.instant();

        SwapEvent swap = SwapEvent.completed(command.getDriverId(), station.getId(), subscriptionId, command,
            consumption.isCovered(), consumption.getChargeAmount(), now);
        swapRepository.save(SwapEventEntity.fromDomain(swap, command.getIdempotencyKey()));
        entitlementStore.setCustody(subscriptionId, swap.getNewBatteryId());

        Invoice invoice = null;
        if (consumption.getChargeAmount().signum() > 0) {
            invoice = invoiceService.createInvoice(InvoiceRequest.builder()
                .type(InvoiceType.EXTRA_SWAP)
                .driverId(command.getDriverId())
                .swapId(swap.getId())
                .subscriptionId(subscriptionId)
                .amount(consumption.getChargeAmount())
                .taxRate(consumption.getTaxRate())
                .description("Extra swap at " + station.getName() + " (" + consumption.getOutcome() + ")")
                .paymentStatus(PaymentStatus.PENDING)
                .build());
        }

        SwapResult.Coverage coverage = consumption.isCovered()
            ? SwapResult.Coverage.COVERED
            : SwapResult.Coverage.EXTRA_SWAP;
        publish(swap, invoice, consumption.getSwapsRemainingAfter(), now);
        return toResult(swap, coverage, invoice, consumption.getSwapsRemainingAfter(), false);
    }

    private SwapResult recordPayPerSwap(RecordSwapCommand command, Station station) {
        Instant now = clock.instant();
        BigDecimal price = properties.getSwap().getPayPerSwapPrice();

        SwapEvent swap = SwapEvent.completed(command.getDriverId(), station.getId(), null, command,
            false, price, now);
        swapRepository.save(SwapEventEntity.fromDomain(swap, command.getIdempotencyKey()));

        Invoice invoice = null;
        if (price.signum() > 0) {
            invoice = invoiceService.createInvoice(InvoiceRequest.builder()
                .type(InvoiceType.SWAP)
                .driverId(command.getDriverId())
                .swapId(swap.getId())
                .amount(price)
                .taxRate(properties.getSwap().getPayPerSwapTaxRate())
                .description("Pay-per-swap at " + station.getName())
                .paymentStatus(PaymentStatus.PENDING)
                .build());
        }

        publish(swap, invoice, null, now);
        return toResult(swap, SwapResult.Coverage.PAY_PER_SWAP, invoice, null, false);
    }

    private Optional<SwapResult> replay(UUID swapId, RecordSwapCommand command) {
        Optional<SwapEvent> stored = swapRepository.findById(swapId).map(SwapEventEntity::toDomain);
        if (stored.isEmpty()) {
            return Optional.empty();
        }

        SwapEvent swap = stored.get();
        if (!swap.getDriverId().equals(command.getDriverId())) {
            throw new ConflictException("Idempotency key " + command.getIdempotencyKey()
                + " was already used for another driver");
        }

        Invoice invoice = invoiceRepository.findFirstBySwapId(swapId).map(InvoiceEntity::toDomain).orElse(null);
        SwapResult.Coverage coverage;
        Integer remaining = null;
        if (swap.getSubscriptionId() == null) {
            coverage = SwapResult.Coverage.PAY_PER_SWAP;
        } else {
            coverage = swap.isSubscriptionSwap() ? SwapResult.Coverage.COVERED : SwapResult.Coverage.EXTRA_SWAP;
            DriverSubscription subscription = entitlementStore.getSubscription(swap.getSubscriptionId());
            remaining = CoverageRule.swapsRemaining(
                planCatalog.findById(subscription.getPlanId()), subscription.getSwapsUsed());
        }

        metrics.incrementDuplicateSwaps();
        log.info("Swap request with idempotency key {} answered from swap {}", command.getIdempotencyKey(), swapId);
        return Optional.of(toResult(swap, coverage, invoice, remaining, true));
    }

    private Station resolveStation(RecordSwapCommand command) {
        if (command.getStationId() != null) {
            return stationDirectory.requireActive(command.getStationId());
        }
        return stationDirectory.requireActive(command.getStationCode());
    }

    private SwapEventEntity lockSwap(UUID swapId) {
        return swapRepository.findByIdForUpdate(swapId)
            .orElseThrow(() -> new NotFoundException("Swap", swapId));
    }

    private void publish(SwapEvent swap, Invoice invoice, Integer swapsRemaining, Instant now) {
        outboxService.saveEvent(new SwapRecordedEvent(
            UUID.randomUUID(),
            swap.getId(),
            swap.getDriverId(),
            swap.getStationId(),
            swap.getSubscriptionId(),
            swap.getNewBatteryId(),
            swap.isSubscriptionSwap(),
            swap.getChargeAmount(),
            invoice != null ? invoice.getInvoiceNumber() : null,
            swapsRemaining,
            now
        ));
    }

    private static SwapResult toResult(SwapEvent swap, SwapResult.Coverage coverage, Invoice invoice,
                                       Integer swapsRemaining, boolean replayed) {
        return new SwapResult(
            swap.getId(),
            swap.getDriverId(),
            swap.getStationId(),
            swap.getSubscriptionId(),
            swap.isSubscriptionSwap(),
            coverage,
            swap.getChargeAmount(),
            invoice != null ? invoice.getTaxAmount() : BigDecimal.ZERO.setScale(2),
            invoice != null ? invoice.getTotalAmount() : swap.getChargeAmount(),
            invoice != null ? invoice.getInvoiceNumber() : null,
            swapsRemaining,
            replayed
        );
    }

    private void validate(RecordSwapCommand command) {
        if (command.getDriverId() == null) {
            throw new InvalidInputException("driverId", "Driver is required");
        }
        if (command.getStationId() == null && (command.getStationCode() == null || command.getStationCode().isBlank())) {
            throw new InvalidInputException("stationId", "Station id or code is required");
        }
        requireBatteryId("oldBatteryId", command.getOldBatteryId());
        requireBatteryId("newBatteryId", command.getNewBatteryId());
        requireChargeLevel("oldChargePct", command.getOldChargePct());
        requireChargeLevel("newChargePct", command.getNewChargePct());
        if (command.getIdempotencyKey() != null) {
            SwapIdempotencyService.validate(command.getIdempotencyKey());
        }
    }

    private static void requireBatteryId(String field, String batteryId) {
        if (batteryId == null || batteryId.isBlank()) {
            throw new InvalidInputException(field, "Battery id is required");
        }
        if (batteryId.trim().length() > 50) {
            throw new InvalidInputException(field, "Battery id must be at most 50 characters");
        }
    }

    private static void requireChargeLevel(String field, Integer chargePct) {
        if (chargePct == null || chargePct < 0 || chargePct > 100) {
            throw new InvalidInputException(field, "Charge level must be between 0 and 100, got " + chargePct);
        }
    }
}
