package com.batterysmart.swap_ledger.swap;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of the swaps table.
 *
 * The idempotency key is a persistence concern and is passed alongside the
 * domain object rather than carried by it.
 */
@Entity
@Table(name = "swaps")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SwapEventEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "driver_id", nullable = false, updatable = false)
    private UUID driverId;

    @Column(name = "station_id", nullable = false, updatable = false)
    private UUID stationId;

    @Column(name = "subscription_id", updatable = false)
    private UUID subscriptionId;

    @Column(name = "old_battery_id", nullable = false, updatable = false, length = 50)
    private String oldBatteryId;

    @Column(name = "new_battery_id", nullable = false, updatable = false, length = 50)
    private String newBatteryId;

    @Column(name = "old_battery_charge", nullable = false, updatable = false)
    private int oldChargeLevel;

    @Column(name = "new_battery_charge", nullable = false, updatable = false)
    private int newChargeLevel;

    @Column(name = "swap_time", nullable = false, updatable = false)
    private Instant swapTime;

    @Column(name = "is_subscription_swap", nullable = false, updatable = false)
    private boolean subscriptionSwap;

    @Column(name = "charge_amount", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal chargeAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SwapStatus status;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "idempotency_key", updatable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static SwapEventEntity fromDomain(SwapEvent swap, String idempotencyKey) {
        return new SwapEventEntity(
            swap.getId(),
            swap.getDriverId(),
            swap.getStationId(),
            swap.getSubscriptionId(),
            swap.getOldBatteryId(),
            swap.getNewBatteryId(),
            swap.getOldChargeLevel(),
            swap.getNewChargeLevel(),
            swap.getSwapTime(),
            swap.isSubscriptionSwap(),
            swap.getChargeAmount(),
            swap.getStatus(),
            swap.getFailureReason(),
            idempotencyKey,
            swap.getCreatedAt(),
            swap.getUpdatedAt()
        );
    }

    public SwapEvent toDomain() {
        return new SwapEvent(
            id,
            driverId,
            stationId,
            subscriptionId,
            oldBatteryId,
            newBatteryId,
            oldChargeLevel,
            newChargeLevel,
            swapTime,
            subscriptionSwap,
            chargeAmount,
            status,
            failureReason,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(SwapEvent swap) {
        this.status = swap.getStatus();
        this.failureReason = swap.getFailureReason();
        this.updatedAt = swap.getUpdatedAt();
    }
}
