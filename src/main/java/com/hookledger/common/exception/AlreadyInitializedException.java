package com.hookledger.common.exception;

/**
 * Thrown when the asset is initialized a second time.
 */
public class AlreadyInitializedException extends LedgerException {

    public AlreadyInitializedException(String symbol) {
        super(LedgerErrorKind.ALREADY_INITIALIZED, "Asset already initialized: " + symbol);
    }
}
