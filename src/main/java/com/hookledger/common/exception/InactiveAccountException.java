package com.hookledger.common.exception;

/**
 * Thrown when an account that never transacted on the host is debited.
 */
public class InactiveAccountException extends GateRejectedException {

    public InactiveAccountException(String gateName, String account, String reason) {
        super(LedgerErrorKind.INACTIVE_ACCOUNT, gateName, account, reason);
    }
}
