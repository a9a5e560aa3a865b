package com.batterysmart.swap_ledger.plan;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * A purchasable plan. {@code -1} in swapsIncluded or swapsPerDay means
 * unlimited.
 */
@Value
public class SubscriptionPlan {

    public static final int UNLIMITED = -1;

    UUID id;
    String code;
    String name;
    BigDecimal price;
    int validityDays;
    int swapsIncluded;
    int swapsPerDay;
    BigDecimal extraSwapPrice;
    BigDecimal gstPercentage;
    String description;
    boolean active;
    Instant createdAt;
    Instant updatedAt;

    public boolean isUnlimited() {
        return swapsIncluded == UNLIMITED;
    }

    public boolean hasDailyCap() {
        return swapsPerDay != UNLIMITED;
    }

    /**
     * GST as a fraction, e.g. 18.00% becomes 0.1800.
     */
    public BigDecimal taxRate() {
        return gstPercentage.divide(BigDecimal.valueOf(100), 4, RoundingMode.HALF_UP);
    }

    public BigDecimal gstAmount() {
        return price.multiply(taxRate()).setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal totalPrice() {
        return price.add(gstAmount());
    }

    /**
     * Effective price per included swap, or null for unlimited plans.
     */
    public BigDecimal perSwapCost() {
        if (isUnlimited() || swapsIncluded == 0) {
            return null;
        }
        return price.divide(BigDecimal.valueOf(swapsIncluded), 2, RoundingMode.HALF_UP);
    }
}
