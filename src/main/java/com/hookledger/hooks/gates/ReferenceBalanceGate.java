package com.hookledger.hooks.gates;

import com.hookledger.common.exception.LedgerErrorKind;
import com.hookledger.hooks.Gate;
import com.hookledger.hooks.GateResult;
import com.hookledger.hooks.HookRequest;
import com.hookledger.providers.ReferenceBalanceOracle;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Gate that refuses deposits to accounts underfunded in the reference currency.
 */
@Component
public class ReferenceBalanceGate implements Gate {

    private final ReferenceBalanceOracle referenceBalanceOracle;
    private final long floor;

    public ReferenceBalanceGate(ReferenceBalanceOracle referenceBalanceOracle,
                                @Value("${hook-ledger.hooks.reference-balance-floor:1000}") long floor) {
        this.referenceBalanceOracle = referenceBalanceOracle;
        this.floor = floor;
    }

    @Override
    public GateResult evaluate(HookRequest request) {
        long referenceBalance = referenceBalanceOracle.referenceBalance(request.getOwner());

        if (referenceBalance <= floor) {
            return GateResult.decline(LedgerErrorKind.MINIMUM_BALANCE_NOT_MET,
                String.format("Reference balance %d of %s must exceed %d",
                    referenceBalance, request.getOwner(), floor));
        }

        return GateResult.approve();
    }

    @Override
    public String getGateName() {
        return "ReferenceBalance";
    }
}
