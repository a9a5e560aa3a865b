package com.batterysmart.swap_ledger.penalty;

import com.batterysmart.swap_ledger.config.LedgerProperties;
import com.batterysmart.swap_ledger.observability.LedgerMetrics;
import com.batterysmart.swap_ledger.subscription.DriverSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Overdue-battery penalty arithmetic.
 *
 * Reads only its arguments: the same subscription and date always give the
 * same result. Writing a {@link PenaltyRecord} is a separate step owned by
 * {@link PenaltyService}.
 *
 * <pre>
 * daysOverdue = max(0, (today - endDate) - gracePeriodDays)
 * totalAmount = daysOverdue * dailyRate
 * </pre>
 */
@Component
@Slf4j
public class PenaltyEngine {

    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    public PenaltyEngine(LedgerProperties properties, LedgerMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
    }

    public PenaltyView computePenalty(DriverSubscription subscription, LocalDate today) {
        int grace = properties.getPenalty().getGracePeriodDays();
        BigDecimal rate = properties.getPenalty().getDailyRate().setScale(2, RoundingMode.HALF_UP);

        boolean degraded = !subscription.isCustodyCoherent();
        if (degraded) {
            log.warn("Inconsistent custody on subscription {}: returned={}, returnedAt={}",
                subscription.getId(), subscription.isBatteryReturned(), subscription.getBatteryReturnedAt());
            metrics.recordIntegrityViolation("custody_flags");
        }

        if (subscription.isBatteryReturned()) {
            return PenaltyView.none(rate, grace, degraded);
        }

        int daysOverdue = daysOverdue(subscription.getEndDate(), today, grace);
        if (daysOverdue == 0) {
            return PenaltyView.none(rate, grace, degraded);
        }

        BigDecimal total = rate.multiply(BigDecimal.valueOf(daysOverdue)).setScale(2, RoundingMode.HALF_UP);
        return new PenaltyView(true, daysOverdue, rate, total, grace, degraded);
    }

    static int daysOverdue(LocalDate endDate, LocalDate today, int gracePeriodDays) {
        long daysPastEnd = ChronoUnit.DAYS.between(endDate, today);
        return (int) Math.max(0, daysPastEnd - gracePeriodDays);
    }
}
