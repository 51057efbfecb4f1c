package com.hookledger.asset;

import lombok.Getter;

/**
 * The four authority handles of an asset.
 *
 * Owned by {@link AssetRegistry}; operations borrow the bundle and never keep it.
 */
@Getter
public final class CapabilityBundle {

    private final String assetId;
    private final ExtendCapability extend;
    private final MintCapability mint;
    private final BurnCapability burn;
    private final TransferCapability transfer;

    private CapabilityBundle(String assetId) {
        this.assetId = assetId;
        this.extend = new ExtendCapability(assetId);
        this.mint = new MintCapability(assetId);
        this.burn = new BurnCapability(assetId);
        this.transfer = new TransferCapability(assetId);
    }

    static CapabilityBundle issue(String assetId) {
        return new CapabilityBundle(assetId);
    }

    boolean isFor(String assetId) {
        return this.assetId.equals(assetId);
    }
}
