package com.hookledger.hooks;

import com.hookledger.hooks.gates.AccountActivityGate;
import com.hookledger.hooks.gates.ProportionalCapGate;
import com.hookledger.hooks.gates.ReferenceBalanceGate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Binds the gate chains of the withdraw and deposit hooks.
 */
@Configuration
public class HookConfiguration {

    @Bean
    public HookPredicates hookPredicates(AccountActivityGate activityGate,
                                         ProportionalCapGate capGate,
                                         ReferenceBalanceGate referenceBalanceGate) {
        return new HookPredicates(
            new HookPredicate("withdraw", List.of(activityGate, capGate)),
            new HookPredicate("deposit", List.of(activityGate, referenceBalanceGate)));
    }
}
