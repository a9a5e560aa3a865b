package com.batterysmart.swap_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Provides the clock every service reads "now" and "today" from.
 *
 * Tests replace this bean to pin the calendar.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock ledgerClock(LedgerProperties properties) {
        return Clock.system(properties.getBusinessZone());
    }
}
