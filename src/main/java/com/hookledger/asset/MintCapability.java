package com.hookledger.asset;

/**
 * Authority to create new units and increase the supply.
 */
public final class MintCapability extends Capability {

    MintCapability(String assetId) {
        super(assetId);
    }
}
