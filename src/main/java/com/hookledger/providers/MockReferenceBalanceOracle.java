package com.hookledger.providers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory reference-currency balances.
 */
@Component
@Slf4j
public class MockReferenceBalanceOracle implements ReferenceBalanceOracle {

    private final Map<String, Long> balances = new ConcurrentHashMap<>();

    @Override
    public long referenceBalance(String account) {
        return balances.getOrDefault(account, 0L);
    }

    public void seed(String account, long balance) {
        if (balance < 0) {
            throw new IllegalArgumentException("Reference balance cannot be negative: " + balance);
        }
        balances.put(account, balance);
        log.debug("Reference balance of {} set to {}", account, balance);
    }

    public void reset() {
        balances.clear();
    }
}
