package com.hookledger.hooks;

/**
 * A validation predicate evaluated before a balance mutation.
 *
 * Gates are pure reads of ledger and host state; they must not mutate balances.
 */
public interface Gate {

    /**
     * Evaluate the gate against a withdraw or deposit request.
     *
     * @param request the request to evaluate
     * @return approval, or a decline naming the error kind
     */
    GateResult evaluate(HookRequest request);

    String getGateName();
}
