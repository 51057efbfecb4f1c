package com.hookledger.asset;

import com.hookledger.common.Amounts;
import com.hookledger.common.exception.AlreadyInitializedException;
import com.hookledger.common.exception.NotInitializedException;
import com.hookledger.common.exception.UnauthorizedException;
import com.hookledger.hooks.HookPredicates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry of the ledger's single asset.
 *
 * Owns the asset descriptor, the supply counter, the capability bundle and the
 * withdraw/deposit hooks. The hooks are bound at construction and there is no
 * way to replace them. The descriptor row is the source of truth: the bundle is
 * issued for the persisted asset id and reissued only when that id changes
 * (a fresh deployment, or a restart of the process).
 *
 * Only the descriptor is public. Capability lending and supply changes are
 * package-private; other packages move balances through {@link AssetVault}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetRegistry {

    private final AssetDescriptorRepository descriptorRepository;
    private final HookPredicates hookPredicates;

    private final AtomicReference<CapabilityBundle> capabilities = new AtomicReference<>();

    /**
     * Register the asset. Callable once per deployment.
     *
     * @param admin account that will control mint and burn authority
     * @throws AlreadyInitializedException if an asset is already registered
     */
    @Transactional
    public AssetDescriptor initialize(String admin, String name, String symbol, int decimals) {
        Amounts.requireAccount(admin);
        AssetDescriptor.validate(name, symbol, decimals);

        descriptorRepository.findFirstByOrderByCreatedAtAsc().ifPresent(existing -> {
            throw new AlreadyInitializedException(existing.getSymbol());
        });

        AssetDescriptor descriptor = descriptorRepository.save(
            new AssetDescriptor(admin, name, symbol, decimals));
        capabilities.set(CapabilityBundle.issue(descriptor.getAssetId()));

        log.info("Initialized asset {} ({}) id={} decimals={} admin={}",
            name, symbol, descriptor.getAssetId(), decimals, admin);
        return descriptor;
    }

    @Transactional(readOnly = true)
    public AssetDescriptor descriptor() {
        return descriptorRepository.findFirstByOrderByCreatedAtAsc()
            .orElseThrow(NotInitializedException::new);
    }

    /**
     * Lock the descriptor row for the rest of the current transaction.
     * Operations that move balances or supply call this before reading any of them.
     */
    AssetDescriptor lockDescriptor() {
        return descriptorRepository.findAllForUpdate().stream()
            .findFirst()
            .orElseThrow(NotInitializedException::new);
    }

    /**
     * Borrow the capability bundle of the registered asset.
     * The bundle never leaves this package.
     */
    CapabilityBundle borrowCapabilities() {
        String assetId = descriptor().getAssetId();
        return capabilities.updateAndGet(current ->
            current != null && current.isFor(assetId) ? current : CapabilityBundle.issue(assetId));
    }

    /**
     * The withdraw and deposit hooks bound to the registered asset.
     */
    HookPredicates hooks() {
        descriptor();
        return hookPredicates;
    }

    /**
     * Fail unless {@code caller} controls the asset's privileged capabilities.
     */
    void requireAdmin(String caller) {
        AssetDescriptor descriptor = descriptor();
        if (!descriptor.getAdmin().equals(caller)) {
            throw new UnauthorizedException(String.format(
                "Account %s does not hold the mint and burn capabilities of %s",
                caller, descriptor.getSymbol()));
        }
    }

    /**
     * Create {@code amount} new units and add them to the supply.
     */
    FungibleAmount mint(MintCapability capability, long amount) {
        AssetDescriptor descriptor = descriptor();
        Capability.require(capability, MintCapability.class, descriptor.getAssetId());
        Amounts.requireNonNegative(amount);

        descriptor.increaseSupply(amount);
        log.debug("Supply of {} increased by {} to {}", descriptor.getSymbol(), amount, descriptor.getTotalSupply());
        return new FungibleAmount(descriptor.getAssetId(), amount);
    }

    /**
     * Destroy a detached amount and remove it from the supply.
     */
    void burn(BurnCapability capability, FungibleAmount amount) {
        AssetDescriptor descriptor = descriptor();
        Capability.require(capability, BurnCapability.class, descriptor.getAssetId());
        if (!amount.getAssetId().equals(descriptor.getAssetId())) {
            throw new IllegalArgumentException("Cannot burn units of asset " + amount.getAssetId());
        }

        descriptor.decreaseSupply(amount.consume());
        log.debug("Supply of {} decreased by {} to {}",
            descriptor.getSymbol(), amount.getValue(), descriptor.getTotalSupply());
    }
}
