package com.hookledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Hook Ledger.
 *
 * Hook Ledger manages the balances and supply of a single fungible asset.
 * Every balance-decreasing and balance-increasing transfer passes a withdraw or
 * deposit hook before it commits, and supply changes are gated by capabilities
 * held by the asset registry.
 */
@SpringBootApplication
public class HookLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HookLedgerApplication.class, args);
    }
}
