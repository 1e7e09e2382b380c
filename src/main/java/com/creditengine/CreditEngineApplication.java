package com.creditengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Credit Engine.
 *
 * Credit Engine keeps per-user credit balances backed by an append-only
 * ledger, and handles purchases, daily bonuses, referrals and administrative
 * adjustments exactly once per logical operation.
 */
@SpringBootApplication
public class CreditEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditEngineApplication.class, args);
    }
}
