package com.batterysmart.swap_ledger.subscription;

import com.batterysmart.swap_ledger.plan.SubscriptionPlan;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Result of counting one swap against a subscription. For an overage swap
 * {@link #getChargeAmount()} is the plan's extra swap price and
 * {@link #getTaxRate()} its GST as a fraction.
 */
@Value
public class SwapConsumption {
    UUID subscriptionId;
    String planCode;
    CoverageRule.Outcome outcome;
    int swapsUsedAfter;
    int swapsRemainingAfter;
    BigDecimal chargeAmount;
    BigDecimal taxRate;

    static SwapConsumption of(DriverSubscription updated, SubscriptionPlan plan, CoverageRule.Outcome outcome) {
        BigDecimal charge = outcome.isCovered() ? BigDecimal.ZERO : plan.getExtraSwapPrice();
        return new SwapConsumption(
            updated.getId(),
            plan.getCode(),
            outcome,
            updated.getSwapsUsed(),
            CoverageRule.swapsRemaining(plan, updated.getSwapsUsed()),
            charge,
            plan.taxRate()
        );
    }

    public boolean isCovered() {
        return outcome.isCovered();
    }
}
