package com.batterysmart.swap_ledger.subscription;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Nightly sweep that expires subscriptions past their end date.
 */
@Component
@ConditionalOnProperty(name = "ledger.subscription.expiry-sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SubscriptionExpiryScheduler {

    private final SubscriptionService subscriptionService;
    private final Clock clock;

    @Scheduled(cron = "${ledger.subscription.expiry-sweep.cron:0 5 0 * * *}",
               zone = "${ledger.business-zone:Asia/Kolkata}")
    public void expireLapsedSubscriptions() {
        try {
            subscriptionService.expireLapsed(LocalDate.now(clock));
        } catch (Exception e) {
            log.error("Subscription expiry sweep failed", e);
        }
    }
}
