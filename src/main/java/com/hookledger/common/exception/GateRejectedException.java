package com.hookledger.common.exception;

/**
 * Thrown when a withdraw or deposit gate declines the request.
 */
public abstract class GateRejectedException extends LedgerException {

    private final String gateName;
    private final String account;

    protected GateRejectedException(LedgerErrorKind errorKind, String gateName,
                                    String account, String reason) {
        super(errorKind, String.format("Gate %s rejected account %s: %s", gateName, account, reason));
        this.gateName = gateName;
        this.account = account;
    }

    /**
     * Build the exception matching the decline kind reported by a gate.
     */
    public static GateRejectedException of(LedgerErrorKind kind, String gateName,
                                           String account, String reason) {
        return switch (kind) {
            case INACTIVE_ACCOUNT -> new InactiveAccountException(gateName, account, reason);
            case CAP_EXCEEDED -> new CapExceededException(gateName, account, reason);
            case MINIMUM_BALANCE_NOT_MET -> new MinimumBalanceNotMetException(gateName, account, reason);
            default -> throw new IllegalArgumentException("Not a gate rejection kind: " + kind);
        };
    }

    public String getGateName() {
        return gateName;
    }

    public String getAccount() {
        return account;
    }
}
