package com.hookledger.providers;

/**
 * Host-side view of how many transactions an account has committed.
 *
 * The counter is monotonically non-decreasing per account and is incremented by
 * the host, never by the ledger. Zero means the account has never been active.
 */
public interface AccountActivityOracle {

    /**
     * Get the number of committed host transactions of an account.
     *
     * @param account the account identity
     * @return activity counter, {@code 0} for unknown accounts
     */
    long activityCounter(String account);
}
