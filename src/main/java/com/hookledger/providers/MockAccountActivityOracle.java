package com.hookledger.providers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory activity oracle.
 *
 * Stands in for the host's transaction counter. Counters can be raised but
 * never lowered.
 */
@Component
@Slf4j
public class MockAccountActivityOracle implements AccountActivityOracle {

    private final Map<String, Long> counters = new ConcurrentHashMap<>();

    @Override
    public long activityCounter(String account) {
        return counters.getOrDefault(account, 0L);
    }

    /**
     * Raise the counter of an account to {@code counter}.
     *
     * @throws IllegalArgumentException if that would lower the counter
     */
    public void seed(String account, long counter) {
        long current = activityCounter(account);
        if (counter < current) {
            throw new IllegalArgumentException(String.format(
                "Activity counter of %s cannot decrease from %d to %d", account, current, counter));
        }
        counters.put(account, counter);
        log.debug("Activity counter of {} set to {}", account, counter);
    }

    public void reset() {
        counters.clear();
    }
}
