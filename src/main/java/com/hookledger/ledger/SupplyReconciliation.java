package com.hookledger.ledger;

import lombok.Value;

/**
 * Comparison of the supply counter with the sum of all store balances.
 */
@Value
public class SupplyReconciliation {
    long totalSupply;
    long sumOfBalances;

    public boolean isBalanced() {
        return totalSupply == sumOfBalances;
    }
}
