package com.hookledger.common.exception;

/**
 * Thrown when an operation needs the asset before it has been initialized.
 */
public class NotInitializedException extends LedgerException {

    public NotInitializedException() {
        super(LedgerErrorKind.NOT_INITIALIZED, "Asset has not been initialized");
    }
}
