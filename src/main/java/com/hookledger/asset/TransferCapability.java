package com.hookledger.asset;

/**
 * Authority to debit and credit account stores directly.
 */
public final class TransferCapability extends Capability {

    TransferCapability(String assetId) {
        super(assetId);
    }
}
