package com.hookledger.ledger;

import com.hookledger.asset.AccountStore;
import com.hookledger.asset.AccountStoreResolver;
import com.hookledger.asset.AssetDescriptor;
import com.hookledger.asset.AssetRegistry;
import com.hookledger.asset.AssetVault;
import com.hookledger.common.Amounts;
import com.hookledger.common.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * User-facing ledger operations.
 *
 * Each operation is one transaction: it either commits every balance, supply
 * and event change, or it is rejected by the first failing check and rolled
 * back with no observable effect.
 *
 * Balance and supply changes go through {@link AssetVault}, which holds the
 * capabilities and runs the hooks. Mint is a privileged path and credits without
 * consulting the deposit hook. Burn and transfer debit through the withdraw
 * hook, and transfer credits through the deposit hook.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final AssetRegistry assetRegistry;
    private final AccountStoreResolver storeResolver;
    private final AssetVault assetVault;
    private final EventSink eventSink;
    private final LedgerEventRepository eventRepository;

    @Transactional
    public AssetDescriptor initialize(String admin, String name, String symbol, int decimals) {
        return assetRegistry.initialize(admin, name, symbol, decimals);
    }

    /**
     * Create {@code amount} new units in the account of {@code to}.
     *
     * @throws com.hookledger.common.exception.UnauthorizedException if the caller is not the asset admin
     * @throws com.hookledger.common.exception.OverflowException if the supply would overflow
     */
    @Transactional
    public void mint(String caller, String to, long amount) {
        Amounts.requireAccount(to);
        Amounts.requireNonNegative(amount);
        log.info("Processing mint of {} to {} by {}", amount, to, caller);

        try {
            assetVault.mint(caller, to, amount);
            eventSink.append(new LedgerEvent(assetId(), EventKind.MINT, caller, to, amount));
            log.info("Mint of {} to {} COMMITTED", amount, to);
        } catch (LedgerException e) {
            log.info("Mint of {} to {} REJECTED ({}): {}", amount, to, e.getErrorKind(), e.getMessage());
            throw e;
        }
    }

    /**
     * Destroy {@code amount} units held by {@code from}. The debit passes the withdraw hook.
     *
     * @throws com.hookledger.common.exception.UnauthorizedException if the caller is not the asset admin
     * @throws com.hookledger.common.exception.GateRejectedException if a withdraw gate declines
     */
    @Transactional
    public void burn(String caller, String from, long amount) {
        Amounts.requireAccount(from);
        Amounts.requireNonNegative(amount);
        log.info("Processing burn of {} from {} by {}", amount, from, caller);

        try {
            assetVault.burn(caller, from, amount);
            eventSink.append(new LedgerEvent(assetId(), EventKind.BURN, caller, from, amount));
            log.info("Burn of {} from {} COMMITTED", amount, from);
        } catch (LedgerException e) {
            log.info("Burn of {} from {} REJECTED ({}): {}", amount, from, e.getErrorKind(), e.getMessage());
            throw e;
        }
    }

    /**
     * Move {@code amount} units from the caller to {@code to}.
     *
     * The debit passes the withdraw hook and the credit passes the deposit hook.
     * A failed credit leaves no trace.
     */
    @Transactional
    public void transfer(String caller, String to, long amount) {
        Amounts.requireAccount(caller);
        Amounts.requireAccount(to);
        Amounts.requireNonNegative(amount);
        log.info("Processing transfer of {} from {} to {}", amount, caller, to);

        try {
            assetVault.transfer(caller, to, amount);
            log.info("Transfer of {} from {} to {} COMMITTED", amount, caller, to);
        } catch (LedgerException e) {
            log.info("Transfer of {} from {} to {} REJECTED ({}): {}",
                amount, caller, to, e.getErrorKind(), e.getMessage());
            throw e;
        }
    }

    private String assetId() {
        return assetRegistry.descriptor().getAssetId();
    }

    /**
     * Balance of an account; zero if it never held the asset.
     */
    @Transactional(readOnly = true)
    public long balanceOf(String account) {
        Amounts.requireAccount(account);
        String assetId = assetRegistry.descriptor().getAssetId();
        return storeResolver.find(account, assetId)
            .map(AccountStore::getBalance)
            .orElse(0L);
    }

    @Transactional(readOnly = true)
    public long totalSupply() {
        return assetRegistry.descriptor().getTotalSupply();
    }

    @Transactional(readOnly = true)
    public AssetDescriptor assetDescriptor() {
        return assetRegistry.descriptor();
    }

    /**
     * Compare the supply counter with the sum of all balances.
     */
    @Transactional(readOnly = true)
    public SupplyReconciliation reconcile() {
        AssetDescriptor descriptor = assetRegistry.descriptor();
        SupplyReconciliation reconciliation = new SupplyReconciliation(
            descriptor.getTotalSupply(), storeResolver.totalBalance(descriptor.getAssetId()));
        if (!reconciliation.isBalanced()) {
            log.error("Supply of {} out of balance: supply={}, balances={}", descriptor.getSymbol(),
                reconciliation.getTotalSupply(), reconciliation.getSumOfBalances());
        }
        return reconciliation;
    }

    @Transactional(readOnly = true)
    public List<LedgerEvent> events() {
        return eventRepository.findAllByOrderBySequenceAsc();
    }

    @Transactional(readOnly = true)
    public List<LedgerEvent> eventsFor(String account) {
        return eventRepository.findByActorOrCounterpartyOrderBySequenceAsc(account, account);
    }
}
