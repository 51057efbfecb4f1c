package com.hookledger.hooks;

/**
 * Direction of a balance mutation intercepted by a hook.
 */
public enum HookType {
    /**
     * Balance-decreasing request (burn, source side of a transfer).
     */
    WITHDRAW,

    /**
     * Balance-increasing request (destination side of a transfer).
     */
    DEPOSIT
}
