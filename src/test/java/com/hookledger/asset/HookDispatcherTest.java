package com.hookledger.asset;

import com.hookledger.common.exception.CapExceededException;
import com.hookledger.common.exception.GateRejectedException;
import com.hookledger.common.exception.InactiveAccountException;
import com.hookledger.common.exception.InsufficientBalanceException;
import com.hookledger.common.exception.MinimumBalanceNotMetException;
import com.hookledger.common.exception.UnauthorizedException;
import com.hookledger.hooks.HookConfiguration;
import com.hookledger.hooks.HookPredicates;
import com.hookledger.hooks.gates.AccountActivityGate;
import com.hookledger.hooks.gates.ProportionalCapGate;
import com.hookledger.hooks.gates.ReferenceBalanceGate;
import com.hookledger.providers.AccountActivityOracle;
import com.hookledger.providers.ReferenceBalanceOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for HookDispatcher.
 *
 * Uses the real gates with mocked host oracles, so every test exercises the
 * same withdraw and deposit chains the application binds.
 */
@ExtendWith(MockitoExtension.class)
class HookDispatcherTest {

    private static final String ASSET_ID = "asset-1";

    @Mock
    private AssetRegistry assetRegistry;

    @Mock
    private AccountActivityOracle activityOracle;

    @Mock
    private ReferenceBalanceOracle referenceBalanceOracle;

    private HookDispatcher dispatcher;
    private CapabilityBundle capabilities;

    @BeforeEach
    void setUp() {
        dispatcher = new HookDispatcher(assetRegistry);
        capabilities = AssetFixtures.capabilities(ASSET_ID);
    }

    private HookPredicates hooks(ProportionalCapGate capGate) {
        AccountActivityGate activityGate = new AccountActivityGate(activityOracle);
        ReferenceBalanceGate referenceBalanceGate = new ReferenceBalanceGate(referenceBalanceOracle, 1000);
        return new HookConfiguration().hookPredicates(activityGate, capGate, referenceBalanceGate);
    }

    private void bindDefaultHooks() {
        when(assetRegistry.hooks()).thenReturn(hooks(new ProportionalCapGate(200, 100)));
    }

    @Test
    void testWithdrawSuccess() {
        bindDefaultHooks();
        when(activityOracle.activityCounter("alice")).thenReturn(1L);
        AccountStore store = AssetFixtures.store("alice", capabilities, 100);

        FungibleAmount withdrawn = dispatcher.withdraw(store, 10, capabilities.getTransfer());

        assertEquals(10, withdrawn.getValue());
        assertEquals(90, store.getBalance());
    }

    @Test
    void testWithdrawFromInactiveAccount() {
        bindDefaultHooks();
        when(activityOracle.activityCounter("alice")).thenReturn(0L);
        AccountStore store = AssetFixtures.store("alice", capabilities, 100);

        InactiveAccountException e = assertThrows(InactiveAccountException.class,
            () -> dispatcher.withdraw(store, 0, capabilities.getTransfer()));

        assertEquals("AccountActivity", e.getGateName());
        assertEquals("alice", e.getAccount());
        assertEquals(100, store.getBalance());
    }

    @Test
    void testWithdrawAboveCap() {
        bindDefaultHooks();
        when(activityOracle.activityCounter("alice")).thenReturn(3L);
        AccountStore store = AssetFixtures.store("alice", capabilities, 20);

        GateRejectedException e = assertThrows(CapExceededException.class,
            () -> dispatcher.withdraw(store, 10, capabilities.getTransfer()));

        assertEquals("ProportionalCap", e.getGateName());
        assertEquals(20, store.getBalance());
    }

    @Test
    void testWithdrawMoreThanBalanceWhenCapAllowsIt() {
        when(assetRegistry.hooks()).thenReturn(hooks(new ProportionalCapGate(0, 100)));
        when(activityOracle.activityCounter("alice")).thenReturn(1L);
        AccountStore store = AssetFixtures.store("alice", capabilities, 5);

        assertThrows(InsufficientBalanceException.class,
            () -> dispatcher.withdraw(store, 6, capabilities.getTransfer()));
        assertEquals(5, store.getBalance());
    }

    @Test
    void testDepositSuccess() {
        bindDefaultHooks();
        when(activityOracle.activityCounter("bob")).thenReturn(1L);
        when(referenceBalanceOracle.referenceBalance("bob")).thenReturn(1001L);
        AccountStore store = AssetFixtures.store("bob", capabilities, 0);
        FungibleAmount amount = AssetFixtures.amount(ASSET_ID, 10);

        dispatcher.deposit(store, amount, capabilities.getTransfer());

        assertEquals(10, store.getBalance());
        assertTrue(amount.isConsumed());
    }

    @Test
    void testDepositBelowReferenceFloor() {
        bindDefaultHooks();
        when(activityOracle.activityCounter("bob")).thenReturn(1L);
        when(referenceBalanceOracle.referenceBalance("bob")).thenReturn(1000L);
        AccountStore store = AssetFixtures.store("bob", capabilities, 0);
        FungibleAmount amount = AssetFixtures.amount(ASSET_ID, 10);

        MinimumBalanceNotMetException e = assertThrows(MinimumBalanceNotMetException.class,
            () -> dispatcher.deposit(store, amount, capabilities.getTransfer()));

        assertEquals("ReferenceBalance", e.getGateName());
        assertEquals(0, store.getBalance());
        assertFalse(amount.isConsumed());
    }

    @Test
    void testDepositToInactiveAccountStopsAtFirstGate() {
        bindDefaultHooks();
        when(activityOracle.activityCounter("bob")).thenReturn(0L);
        AccountStore store = AssetFixtures.store("bob", capabilities, 0);

        assertThrows(InactiveAccountException.class,
            () -> dispatcher.deposit(store, AssetFixtures.amount(ASSET_ID, 10), capabilities.getTransfer()));
        verifyNoInteractions(referenceBalanceOracle);
    }

    @Test
    void testCapabilityIsRequired() {
        AccountStore store = AssetFixtures.store("alice", capabilities, 100);

        assertThrows(UnauthorizedException.class, () -> dispatcher.withdraw(store, 10, null));
        assertThrows(UnauthorizedException.class,
            () -> dispatcher.deposit(store, AssetFixtures.amount(ASSET_ID, 10), null));
        verifyNoInteractions(assetRegistry, activityOracle);
        assertEquals(100, store.getBalance());
    }

    @Test
    void testForeignCapabilityIsRejected() {
        bindDefaultHooks();
        when(activityOracle.activityCounter("alice")).thenReturn(1L);
        AccountStore store = AssetFixtures.store("alice", capabilities, 100);
        CapabilityBundle foreign = AssetFixtures.capabilities("asset-2");

        assertThrows(UnauthorizedException.class,
            () -> dispatcher.withdraw(store, 10, foreign.getTransfer()));
        assertEquals(100, store.getBalance());
    }

    @Test
    void testConsumedAmountCannotBeDeposited() {
        AccountStore store = AssetFixtures.store("bob", capabilities, 0);
        FungibleAmount amount = AssetFixtures.amount(ASSET_ID, 10);
        store.credit(amount, capabilities.getTransfer());

        assertThrows(IllegalStateException.class,
            () -> dispatcher.deposit(store, amount, capabilities.getTransfer()));
        assertEquals(10, store.getBalance());
    }
}
