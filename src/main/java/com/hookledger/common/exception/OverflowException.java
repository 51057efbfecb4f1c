package com.hookledger.common.exception;

/**
 * Thrown when supply or balance arithmetic would exceed the representable range.
 */
public class OverflowException extends LedgerException {

    public OverflowException(String what, long current, long delta) {
        super(LedgerErrorKind.OVERFLOW,
            String.format("Overflow adding %d to %s %d", delta, what, current));
    }
}
