package com.hookledger.asset;

import com.hookledger.common.Amounts;
import com.hookledger.common.exception.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Resolves the account store of an owner, creating it on first use.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountStoreResolver {

    private final AccountStoreRepository storeRepository;

    /**
     * Get the owner's store for the capability's asset, creating an empty one if absent.
     * The caller must hold the descriptor lock, so no other transaction creates the same store.
     */
    AccountStore resolve(String owner, ExtendCapability capability) {
        Amounts.requireAccount(owner);
        if (capability == null) {
            throw new UnauthorizedException("ExtendCapability is required to resolve account stores");
        }

        return storeRepository.findByOwnerAndAssetId(owner, capability.getAssetId())
            .orElseGet(() -> {
                AccountStore store = storeRepository.save(new AccountStore(owner, capability.getAssetId()));
                log.info("Created account store {} for owner {} on asset {}",
                    store.getStoreId(), owner, capability.getAssetId());
                return store;
            });
    }

    @Transactional(readOnly = true)
    public Optional<AccountStore> find(String owner, String assetId) {
        return storeRepository.findByOwnerAndAssetId(owner, assetId);
    }

    @Transactional(readOnly = true)
    public long totalBalance(String assetId) {
        return storeRepository.sumBalances(assetId);
    }
}
