package com.hookledger.hooks;

import com.hookledger.common.exception.LedgerErrorKind;
import com.hookledger.hooks.gates.ProportionalCapGate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boundary tests for the proportional withdrawal cap.
 */
class ProportionalCapGateTest {

    private final ProportionalCapGate gate = new ProportionalCapGate(200, 100);

    private HookRequest withdraw(long amount, long balance) {
        return HookRequest.builder()
            .type(HookType.WITHDRAW)
            .owner("alice")
            .amount(amount)
            .balance(balance)
            .build();
    }

    @Test
    void testBalanceEqualToCapIsDeclined() {
        GateResult result = gate.evaluate(withdraw(10, 20));

        assertFalse(result.isApproved());
        assertEquals(LedgerErrorKind.CAP_EXCEEDED, result.getDeclineKind());
    }

    @Test
    void testBalanceAboveCapIsApproved() {
        assertTrue(gate.evaluate(withdraw(10, 21)).isApproved());
    }

    @Test
    void testLargeWithdrawalFromThinBalance() {
        assertFalse(gate.evaluate(withdraw(50_000, 100)).isApproved());
    }

    @Test
    void testIntegerDivisionRoundsCapDown() {
        ProportionalCapGate oneAndAHalf = new ProportionalCapGate(150, 100);

        // cap of 3 * 1.5 is 4
        assertTrue(oneAndAHalf.evaluate(withdraw(3, 5)).isApproved());
        assertFalse(oneAndAHalf.evaluate(withdraw(3, 4)).isApproved());
    }

    @Test
    void testZeroAmountNeedsPositiveBalance() {
        assertFalse(gate.evaluate(withdraw(0, 0)).isApproved());
        assertTrue(gate.evaluate(withdraw(0, 1)).isApproved());
    }

    @Test
    void testHugeAmountDoesNotWrap() {
        assertFalse(gate.evaluate(withdraw(Long.MAX_VALUE, Long.MAX_VALUE)).isApproved());
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new ProportionalCapGate(200, 0));
        assertThrows(IllegalArgumentException.class, () -> new ProportionalCapGate(-1, 100));
    }
}
