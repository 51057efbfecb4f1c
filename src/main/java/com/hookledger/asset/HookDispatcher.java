package com.hookledger.asset;

import com.hookledger.common.Amounts;
import com.hookledger.common.exception.GateRejectedException;
import com.hookledger.common.exception.UnauthorizedException;
import com.hookledger.hooks.GateResult;
import com.hookledger.hooks.HookPredicate;
import com.hookledger.hooks.HookRequest;
import com.hookledger.hooks.HookType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes every hooked debit and credit through the asset's predicates.
 *
 * Withdraw flow:
 * 1. Evaluate the withdraw hook (activity, proportional cap)
 * 2. Debit the store
 * 3. Return the detached amount
 *
 * Deposit flow:
 * 1. Evaluate the deposit hook (activity, reference balance)
 * 2. Credit the store, consuming the amount
 *
 * A declining gate aborts the call before the store is touched. The store's
 * debit and credit are package-private, so this class is the only hooked path
 * to them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class HookDispatcher {

    private final AssetRegistry assetRegistry;

    FungibleAmount withdraw(AccountStore store, long amount, TransferCapability capability) {
        requireCapability(capability);
        Amounts.requireNonNegative(amount);

        HookRequest request = HookRequest.builder()
            .type(HookType.WITHDRAW)
            .owner(store.getOwner())
            .amount(amount)
            .balance(store.getBalance())
            .build();
        check(assetRegistry.hooks().getWithdraw(), request);

        FungibleAmount withdrawn = store.debit(amount, capability);
        log.debug("Withdrew {} from {}; balance now {}", amount, store.getOwner(), store.getBalance());
        return withdrawn;
    }

    void deposit(AccountStore store, FungibleAmount amount, TransferCapability capability) {
        requireCapability(capability);
        if (amount.isConsumed()) {
            throw new IllegalStateException("Cannot deposit an amount that was already consumed");
        }

        HookRequest request = HookRequest.builder()
            .type(HookType.DEPOSIT)
            .owner(store.getOwner())
            .amount(amount.getValue())
            .balance(store.getBalance())
            .build();
        check(assetRegistry.hooks().getDeposit(), request);

        store.credit(amount, capability);
        log.debug("Deposited {} to {}; balance now {}", amount.getValue(), store.getOwner(), store.getBalance());
    }

    private void check(HookPredicate hook, HookRequest request) {
        GateResult result = hook.evaluate(request);
        if (!result.isApproved()) {
            throw GateRejectedException.of(result.getDeclineKind(), result.getGateName(),
                request.getOwner(), result.getReason());
        }
    }

    private void requireCapability(TransferCapability capability) {
        if (capability == null) {
            throw new UnauthorizedException("TransferCapability is required");
        }
    }
}
