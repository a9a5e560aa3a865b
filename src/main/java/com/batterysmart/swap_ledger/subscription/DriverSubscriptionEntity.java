package com.batterysmart.swap_ledger.subscription;

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

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA mapping of driver_subscriptions.
 *
 * No setters: state only changes through {@link #updateFromDomain}, after
 * the domain object has validated the transition.
 */
@Entity
@Table(name = "driver_subscriptions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DriverSubscriptionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "driver_id", nullable = false, updatable = false)
    private UUID driverId;

    @Column(name = "plan_id", nullable = false, updatable = false)
    private UUID planId;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false, updatable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubscriptionStatus status;

    @Column(name = "swaps_used", nullable = false)
    private int swapsUsed;

    @Column(name = "auto_renew", nullable = false)
    private boolean autoRenew;

    @Column(name = "battery_id", length = 50)
    private String batteryId;

    @Column(name = "battery_returned", nullable = false)
    private boolean batteryReturned;

    @Column(name = "is_misplaced", nullable = false)
    private boolean misplaced;

    @Column(name = "battery_returned_at")
    private Instant batteryReturnedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static DriverSubscriptionEntity fromDomain(DriverSubscription subscription) {
        return new DriverSubscriptionEntity(
            subscription.getId(),
            subscription.getDriverId(),
            subscription.getPlanId(),
            subscription.getStartDate(),
            subscription.getEndDate(),
            subscription.getStatus(),
            subscription.getSwapsUsed(),
            subscription.isAutoRenew(),
            subscription.getBatteryId(),
            subscription.isBatteryReturned(),
            subscription.isMisplaced(),
            subscription.getBatteryReturnedAt(),
            subscription.getCreatedAt(),
            subscription.getUpdatedAt()
        );
    }

    public DriverSubscription toDomain() {
        return new DriverSubscription(
            id,
            driverId,
            planId,
            startDate,
            endDate,
            status,
            swapsUsed,
            autoRenew,
            batteryId,
            batteryReturned,
            misplaced,
            batteryReturnedAt,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(DriverSubscription subscription) {
        this.status = subscription.getStatus();
        this.swapsUsed = subscription.getSwapsUsed();
        this.batteryId = subscription.getBatteryId();
        this.batteryReturned = subscription.isBatteryReturned();
        this.misplaced = subscription.isMisplaced();
        this.batteryReturnedAt = subscription.getBatteryReturnedAt();
        this.updatedAt = subscription.getUpdatedAt();
    }
}
