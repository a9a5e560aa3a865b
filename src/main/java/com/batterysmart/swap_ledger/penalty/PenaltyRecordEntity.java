package com.batterysmart.swap_ledger.penalty;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of penalty_records. Rows are created by the assessment
 * upsert in {@link PenaltyService}; JPA only reads them and settles them.
 */
@Entity
@Table(name = "penalty_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PenaltyRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "driver_id", nullable = false, updatable = false)
    private UUID driverId;

    @Column(name = "subscription_id", nullable = false, updatable = false)
    private UUID subscriptionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private PenaltyReason reason;

    @Column(name = "days_overdue", nullable = false)
    private int daysOverdue;

    @Column(name = "daily_rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal dailyRate;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PenaltyStatus status;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Column(name = "settled_by", length = 100)
    private String settledBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public PenaltyRecord toDomain() {
        return new PenaltyRecord(
            id,
            driverId,
            subscriptionId,
            reason,
            daysOverdue,
            dailyRate,
            totalAmount,
            status,
            settledAt,
            settledBy,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(PenaltyRecord record) {
        this.status = record.getStatus();
        this.settledAt = record.getSettledAt();
        this.settledBy = record.getSettledBy();
        this.updatedAt = record.getUpdatedAt();
    }
}
