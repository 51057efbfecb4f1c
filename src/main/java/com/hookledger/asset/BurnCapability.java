package com.hookledger.asset;

/**
 * Authority to destroy units and decrease the supply.
 */
public final class BurnCapability extends Capability {

    BurnCapability(String assetId) {
        super(assetId);
    }
}
