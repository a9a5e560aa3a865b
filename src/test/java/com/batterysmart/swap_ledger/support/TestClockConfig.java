package com.batterysmart.swap_ledger.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

@TestConfiguration
public class TestClockConfig {

    public static final ZoneId BUSINESS_ZONE = ZoneId.of("Asia/Kolkata");
    public static final LocalDate START_DATE = LocalDate.of(2024, 6, 15);

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock(START_DATE.atTime(LocalTime.of(10, 0)).atZone(BUSINESS_ZONE).toInstant(),
            BUSINESS_ZONE);
    }
}
