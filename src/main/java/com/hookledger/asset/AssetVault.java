package com.hookledger.asset;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only public way to move balances or supply.
 *
 * Capabilities are borrowed inside this package and never handed out. Every
 * method locks the asset descriptor first, so concurrent operations on the
 * asset run one after another and each sees the state the previous one
 * committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetVault {

    private final AssetRegistry assetRegistry;
    private final AccountStoreResolver storeResolver;
    private final HookDispatcher hookDispatcher;

    /**
     * Create units in the account of {@code to}. Mint credits directly and
     * does not run the deposit hook.
     *
     * @throws com.hookledger.common.exception.UnauthorizedException if the caller is not the asset admin
     * @throws com.hookledger.common.exception.OverflowException if the supply would overflow
     */
    @Transactional
    public void mint(String caller, String to, long amount) {
        assetRegistry.lockDescriptor();
        assetRegistry.requireAdmin(caller);
        CapabilityBundle capabilities = assetRegistry.borrowCapabilities();

        FungibleAmount minted = assetRegistry.mint(capabilities.getMint(), amount);
        AccountStore store = storeResolver.resolve(to, capabilities.getExtend());
        store.credit(minted, capabilities.getTransfer());
    }

    /**
     * Destroy units held by {@code from}. The debit passes the withdraw hook.
     *
     * @throws com.hookledger.common.exception.UnauthorizedException if the caller is not the asset admin
     * @throws com.hookledger.common.exception.GateRejectedException if a withdraw gate declines
     */
    @Transactional
    public void burn(String caller, String from, long amount) {
        AssetDescriptor descriptor = assetRegistry.lockDescriptor();
        assetRegistry.requireAdmin(caller);
        CapabilityBundle capabilities = assetRegistry.borrowCapabilities();

        // an unknown holder gets an unsaved empty store; zero balance never clears the withdraw hook
        AccountStore store = storeResolver.find(from, descriptor.getAssetId())
            .orElseGet(() -> new AccountStore(from, descriptor.getAssetId()));
        FungibleAmount withdrawn = hookDispatcher.withdraw(store, amount, capabilities.getTransfer());
        assetRegistry.burn(capabilities.getBurn(), withdrawn);
    }

    /**
     * Move units from {@code from} to {@code to} through both hooks.
     *
     * If the deposit fails, the withdrawn units go back to the source before
     * the error propagates and the transaction rolls back.
     */
    @Transactional
    public void transfer(String from, String to, long amount) {
        assetRegistry.lockDescriptor();
        CapabilityBundle capabilities = assetRegistry.borrowCapabilities();
        AccountStore source = storeResolver.resolve(from, capabilities.getExtend());
        AccountStore destination = storeResolver.resolve(to, capabilities.getExtend());

        FungibleAmount withdrawn = hookDispatcher.withdraw(source, amount, capabilities.getTransfer());
        try {
            hookDispatcher.deposit(destination, withdrawn, capabilities.getTransfer());
        } catch (RuntimeException e) {
            if (!withdrawn.isConsumed()) {
                source.credit(withdrawn, capabilities.getTransfer());
                log.debug("Restored {} to {} after failed deposit", amount, from);
            }
            throw e;
        }
    }
}
