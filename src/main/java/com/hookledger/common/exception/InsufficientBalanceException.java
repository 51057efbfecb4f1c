package com.hookledger.common.exception;

/**
 * Thrown when a store is debited for more than it holds.
 */
public class InsufficientBalanceException extends LedgerException {

    public InsufficientBalanceException(String owner, long required, long available) {
        super(LedgerErrorKind.INSUFFICIENT_BALANCE,
            String.format("Insufficient balance for %s. Required: %d, Available: %d",
                owner, required, available));
    }
}
