package com.batterysmart.swap_ledger.subscription;

import com.batterysmart.swap_ledger.penalty.PenaltyView;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A driver's current subscription joined with its plan, with every derived
 * figure computed at read time.
 */
@Value
@Builder
public class EntitlementView {

    private static final int EXPIRING_SOON_DAYS = 3;

    UUID subscriptionId;
    UUID driverId;
    SubscriptionStatus status;
    String planCode;
    String planName;
    BigDecimal planPrice;
    int swapsIncluded;
    int swapsUsed;
    int swapsRemaining;
    int swapsPerDay;
    int swapsUsedToday;
    BigDecimal extraSwapPrice;
    LocalDate startDate;
    LocalDate endDate;
    long daysRemaining;
    boolean autoRenew;
    String batteryId;
    boolean batteryReturned;
    boolean batteryMisplaced;
    Instant batteryReturnedAt;
    PenaltyView penalty;

    /** More than one subscription matched as current; this one is the newest. */
    boolean integrityWarning;

    public boolean isUnlimited() {
        return swapsRemaining < 0;
    }

    public boolean isExpiringSoon() {
        return daysRemaining > 0 && daysRemaining <= EXPIRING_SOON_DAYS;
    }
}
