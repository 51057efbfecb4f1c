package com.hookledger.common.exception;

/**
 * Thrown when a deposit targets an account that is underfunded in the reference currency.
 */
public class MinimumBalanceNotMetException extends GateRejectedException {

    public MinimumBalanceNotMetException(String gateName, String account, String reason) {
        super(LedgerErrorKind.MINIMUM_BALANCE_NOT_MET, gateName, account, reason);
    }
}
