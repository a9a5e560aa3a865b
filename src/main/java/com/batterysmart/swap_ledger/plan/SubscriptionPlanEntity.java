package com.batterysmart.swap_ledger.plan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read mapping of subscription_plans. Writes go through
 * {@link PlanCatalog#upsert} keyed on the plan code.
 */
@Entity
@Table(name = "subscription_plans")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SubscriptionPlanEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, length = 20)
    private String code;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "validity_days", nullable = false)
    private int validityDays;

    @Column(name = "swaps_included", nullable = false)
    private int swapsIncluded;

    @Column(name = "swaps_per_day", nullable = false)
    private int swapsPerDay;

    @Column(name = "extra_swap_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal extraSwapPrice;

    @Column(name = "gst_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal gstPercentage;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public SubscriptionPlan toDomain() {
        return new SubscriptionPlan(
            id,
            code,
            name,
            price,
            validityDays,
            swapsIncluded,
            swapsPerDay,
            extraSwapPrice,
            gstPercentage,
            description,
            active,
            createdAt,
            updatedAt
        );
    }
}
