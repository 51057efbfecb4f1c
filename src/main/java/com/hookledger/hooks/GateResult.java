package com.hookledger.hooks;

import com.hookledger.common.exception.LedgerErrorKind;
import lombok.Value;

/**
 * Result of a gate evaluation.
 */
@Value
public class GateResult {
    boolean approved;
    LedgerErrorKind declineKind;
    String reason;
    String gateName;

    public static GateResult approve() {
        return new GateResult(true, null, null, null);
    }

    public static GateResult decline(LedgerErrorKind kind, String reason) {
        return new GateResult(false, kind, reason, null);
    }

    GateResult declinedBy(String gate) {
        return new GateResult(false, declineKind, reason, gate);
    }
}
