package com.batterysmart.swap_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SwapLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SwapLedgerApplication.class, args);
    }
}
