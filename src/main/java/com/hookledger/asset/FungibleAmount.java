package com.hookledger.asset;

/**
 * Units detached from any store and not yet bound to a destination.
 *
 * Created only by a capability-gated debit or mint, and consumable exactly once:
 * by a credit into a store or by a burn.
 */
public final class FungibleAmount {

    private final String assetId;
    private final long value;
    private boolean consumed;

    FungibleAmount(String assetId, long value) {
        this.assetId = assetId;
        this.value = value;
    }

    public String getAssetId() {
        return assetId;
    }

    public long getValue() {
        return value;
    }

    public boolean isConsumed() {
        return consumed;
    }

    long consume() {
        if (consumed) {
            throw new IllegalStateException("Amount of " + value + " has already been consumed");
        }
        consumed = true;
        return value;
    }

    @Override
    public String toString() {
        return "FungibleAmount[" + value + (consumed ? ", consumed]" : "]");
    }
}
