package com.hookledger.asset;

/**
 * Authority to extend the asset with new account stores.
 */
public final class ExtendCapability extends Capability {

    ExtendCapability(String assetId) {
        super(assetId);
    }
}
