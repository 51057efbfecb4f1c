package com.hookledger.common;

import com.hookledger.common.exception.OverflowException;

/**
 * Arithmetic and argument checks for unsigned ledger quantities.
 *
 * Quantities are unsigned in the ledger model and are carried as {@code long}
 * restricted to {@code 0..Long.MAX_VALUE}.
 */
public final class Amounts {

    private Amounts() {
    }

    public static long requireNonNegative(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount);
        }
        return amount;
    }

    public static String requireAccount(String account) {
        if (account == null || account.trim().isEmpty()) {
            throw new IllegalArgumentException("Account cannot be blank");
        }
        return account;
    }

    /**
     * Add two quantities, failing instead of wrapping.
     *
     * @param what name of the quantity being increased, used in the error message
     */
    public static long add(String what, long current, long delta) {
        try {
            return Math.addExact(current, delta);
        } catch (ArithmeticException e) {
            throw new OverflowException(what, current, delta);
        }
    }
}
