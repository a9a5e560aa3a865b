package com.batterysmart.swap_ledger.subscription;

import com.batterysmart.swap_ledger.plan.SubscriptionPlan;

/**
 * Decides whether the next swap under a plan is covered or billed as an
 * extra swap. Pure: the caller supplies the counters read under its lock.
 */
public final class CoverageRule {

    public enum Outcome {
        UNLIMITED,
        WITHIN_QUOTA,
        QUOTA_EXHAUSTED,
        DAILY_CAP_REACHED;

        public boolean isCovered() {
            return this == UNLIMITED || this == WITHIN_QUOTA;
        }
    }

    private CoverageRule() {
    }

    /**
     * @param swapsUsed  swaps counted against the subscription before this one
     * @param usedToday  covered swaps already taken today in the business zone
     */
    public static Outcome decide(SubscriptionPlan plan, int swapsUsed, int usedToday) {
        if (plan.hasDailyCap() && usedToday >= plan.getSwapsPerDay()) {
            return Outcome.DAILY_CAP_REACHED;
        }
        if (plan.isUnlimited()) {
            return Outcome.UNLIMITED;
        }
        return swapsUsed < plan.getSwapsIncluded() ? Outcome.WITHIN_QUOTA : Outcome.QUOTA_EXHAUSTED;
    }

    /**
     * Remaining included swaps, or {@link SubscriptionPlan#UNLIMITED}.
     */
    public static int swapsRemaining(SubscriptionPlan plan, int swapsUsed) {
        if (plan.isUnlimited()) {
            return SubscriptionPlan.UNLIMITED;
        }
        return Math.max(0, plan.getSwapsIncluded() - swapsUsed);
    }
}
