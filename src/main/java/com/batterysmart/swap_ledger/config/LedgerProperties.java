package com.batterysmart.swap_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.ZoneId;

/**
 * Business configuration for the swap ledger.
 *
 * All "today" computations (quota windows, penalty clocks, leave months)
 * happen in {@link #getBusinessZone()}, never in the JVM default zone.
 */
@Component
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private ZoneId businessZone = ZoneId.of("Asia/Kolkata");
    private Swap swap = new Swap();
    private Penalty penalty = new Penalty();
    private Subscription subscription = new Subscription();
    private Leave leave = new Leave();

    @Getter
    @Setter
    public static class Swap {
        /** Price charged for a swap when the driver holds no active subscription. */
        private BigDecimal payPerSwapPrice = new BigDecimal("35.00");
        private BigDecimal payPerSwapTaxRate = new BigDecimal("0.18");
        /** How long a writer waits for a subscription or driver row lock. */
        private long lockTimeoutMs = 5000;
    }

    @Getter
    @Setter
    public static class Penalty {
        private int gracePeriodDays = 4;
        private BigDecimal dailyRate = new BigDecimal("80.00");
        private Sweep sweep = new Sweep();
    }

    @Getter
    @Setter
    public static class Subscription {
        private Sweep expirySweep = new Sweep();
    }

    @Getter
    @Setter
    public static class Leave {
        private int monthlyAllowance = 4;
    }

    @Getter
    @Setter
    public static class Sweep {
        private boolean enabled = true;
        private String cron = "0 0 1 * * *";
    }
}
