package com.hookledger.common.exception;

/**
 * Thrown when a withdrawal is too large relative to the source balance.
 */
public class CapExceededException extends GateRejectedException {

    public CapExceededException(String gateName, String account, String reason) {
        super(LedgerErrorKind.CAP_EXCEEDED, gateName, account, reason);
    }
}
