package com.batterysmart.swap_ledger.penalty;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Daily materialization of overdue battery penalties.
 */
@Component
@ConditionalOnProperty(name = "ledger.penalty.sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PenaltySweepScheduler {

    private final PenaltyService penaltyService;
    private final Clock clock;

    @Scheduled(cron = "${ledger.penalty.sweep.cron:0 15 0 * * *}",
               zone = "${ledger.business-zone:Asia/Kolkata}")
    public void assessOverduePenalties() {
        try {
            penaltyService.sweep(LocalDate.now(clock));
        } catch (Exception e) {
            log.error("Penalty sweep failed", e);
        }
    }
}
