package com.hookledger.common.exception;

/**
 * Distinguishable failure kinds of ledger operations.
 *
 * Callers react to the kind rather than to the message, e.g. "fund your
 * reference-currency balance" versus "account not yet active".
 */
public enum LedgerErrorKind {
    ALREADY_INITIALIZED,
    NOT_INITIALIZED,
    UNAUTHORIZED,

    /**
     * Activity gate: the account has never transacted on the host.
     */
    INACTIVE_ACCOUNT,

    /**
     * Proportional cap gate: the balance does not strictly exceed the cap.
     */
    CAP_EXCEEDED,

    /**
     * Solvency gate: reference-currency balance is at or below the floor.
     */
    MINIMUM_BALANCE_NOT_MET,

    INSUFFICIENT_BALANCE,
    OVERFLOW
}
