package com.hookledger.hooks;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Ordered chain of gates guarding one direction of balance mutation.
 *
 * Gates are evaluated in order, and the first gate that declines decides the
 * result. The chain is fixed at construction.
 */
@Slf4j
public final class HookPredicate {

    private final String name;
    private final List<Gate> gates;

    public HookPredicate(String name, List<Gate> gates) {
        if (gates == null || gates.isEmpty()) {
            throw new IllegalArgumentException("Hook " + name + " needs at least one gate");
        }
        this.name = name;
        this.gates = List.copyOf(gates);
    }

    /**
     * Evaluate all gates against a request.
     *
     * @return the first decline, or approval if every gate approved
     */
    public GateResult evaluate(HookRequest request) {
        log.debug("Evaluating {} gates of hook {} for {}", gates.size(), name, request.getOwner());

        for (Gate gate : gates) {
            GateResult result = gate.evaluate(request);

            if (!result.isApproved()) {
                log.info("Gate {} declined {} of {} for {}: {}",
                    gate.getGateName(), request.getType(), request.getAmount(),
                    request.getOwner(), result.getReason());
                return result.declinedBy(gate.getGateName());
            }

            log.debug("Gate {} approved", gate.getGateName());
        }

        return GateResult.approve();
    }
}
