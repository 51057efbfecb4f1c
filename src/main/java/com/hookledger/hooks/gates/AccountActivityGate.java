package com.hookledger.hooks.gates;

import com.hookledger.common.exception.LedgerErrorKind;
import com.hookledger.hooks.Gate;
import com.hookledger.hooks.GateResult;
import com.hookledger.hooks.HookRequest;
import com.hookledger.providers.AccountActivityOracle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Gate that refuses accounts which have never transacted on the host.
 *
 * Applies regardless of amount, including zero.
 */
@Component
@RequiredArgsConstructor
public class AccountActivityGate implements Gate {

    private final AccountActivityOracle activityOracle;

    @Override
    public GateResult evaluate(HookRequest request) {
        long counter = activityOracle.activityCounter(request.getOwner());

        if (counter <= 0) {
            return GateResult.decline(LedgerErrorKind.INACTIVE_ACCOUNT,
                String.format("Account %s has no committed transactions", request.getOwner()));
        }

        return GateResult.approve();
    }

    @Override
    public String getGateName() {
        return "AccountActivity";
    }
}
