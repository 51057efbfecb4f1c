package com.hookledger.common.exception;

/**
 * Base exception for all ledger failures.
 *
 * Every ledger exception is raised before the failing operation mutates
 * state, or inside a transaction that is rolled back because of it.
 */
public class LedgerException extends RuntimeException {

    private final LedgerErrorKind errorKind;

    public LedgerException(LedgerErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public LedgerException(LedgerErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public LedgerErrorKind getErrorKind() {
        return errorKind;
    }
}
