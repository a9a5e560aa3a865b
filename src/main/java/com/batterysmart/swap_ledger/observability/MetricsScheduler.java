package com.batterysmart.swap_ledger.observability;

import com.batterysmart.swap_ledger.config.LedgerProperties;
import com.batterysmart.swap_ledger.subscription.EntitlementStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Refreshes gauges that need a database query, so that a Prometheus scrape
 * never touches the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final EntitlementStore entitlementStore;
    private final LedgerProperties properties;
    private final Clock clock;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        refreshOverdueBatteries();
    }

    void refreshOverdueBatteries() {
        try {
            LocalDate cutoff = LocalDate.now(clock).minusDays(properties.getPenalty().getGracePeriodDays());
            ledgerMetrics.updateOverdueBatteries(entitlementStore.findUnreturnedEndedBefore(cutoff).size());
        } catch (Exception e) {
            log.warn("Failed to refresh overdue battery gauge: {}", e.getMessage());
        }
    }
}
