package com.hookledger.common.exception;

/**
 * Thrown when a capability is missing or belongs to another asset,
 * or when the caller does not control the privileged capabilities.
 */
public class UnauthorizedException extends LedgerException {

    public UnauthorizedException(String message) {
        super(LedgerErrorKind.UNAUTHORIZED, message);
    }
}
