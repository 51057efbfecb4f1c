package com.hookledger.asset;

import com.hookledger.common.exception.UnauthorizedException;

/**
 * Unforgeable authority handle bound to one asset.
 *
 * Instances are created only by {@link CapabilityBundle#issue(String)}, which is
 * reachable only from {@link AssetRegistry}. Handles are never serialized and are
 * not returned across the REST surface.
 */
public abstract class Capability {

    private final String assetId;

    Capability(String assetId) {
        this.assetId = assetId;
    }

    public String getAssetId() {
        return assetId;
    }

    /**
     * Fail with {@link UnauthorizedException} unless the capability is present
     * and issued for the given asset.
     */
    static void require(Capability capability, Class<? extends Capability> type, String assetId) {
        if (capability == null) {
            throw new UnauthorizedException(type.getSimpleName() + " is required");
        }
        if (!type.isInstance(capability) || !capability.assetId.equals(assetId)) {
            throw new UnauthorizedException(String.format("%s does not grant access to asset %s",
                capability, assetId));
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + assetId + "]";
    }
}
