package com.hookledger.hooks;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot handed to the gates of a hook.
 */
@Value
@Builder
public class HookRequest {

    HookType type;

    /**
     * Owner of the store being debited or credited.
     */
    String owner;

    long amount;

    /**
     * Balance of the store before the mutation.
     */
    long balance;
}
