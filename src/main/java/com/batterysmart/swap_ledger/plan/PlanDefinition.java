package com.batterysmart.swap_ledger.plan;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Desired state of a plan, applied by code.
 */
@Value
@Builder
public class PlanDefinition {
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
}
