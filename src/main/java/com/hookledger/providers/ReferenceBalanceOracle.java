package com.hookledger.providers;

/**
 * Balance of an account in the host's reference currency.
 *
 * In production, this would read the host chain's native coin balance or a
 * custodian's cash position. The ledger only reads it.
 */
public interface ReferenceBalanceOracle {

    /**
     * @param account the account identity
     * @return reference-currency balance, {@code 0} for unknown accounts
     */
    long referenceBalance(String account);
}
