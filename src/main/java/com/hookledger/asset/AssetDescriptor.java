package com.hookledger.asset;

import com.hookledger.common.Amounts;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * The single asset of a ledger deployment.
 *
 * Name, symbol and decimals never change after initialization. The total supply
 * is the authoritative supply counter and moves only through
 * {@link AssetRegistry#mint} and {@link AssetRegistry#burn}.
 */
@Entity
@Table(name = "asset_descriptors")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AssetDescriptor {

    public static final int MAX_NAME_LENGTH = 32;
    public static final int MAX_SYMBOL_LENGTH = 10;
    public static final int MAX_DECIMALS = 32;

    @Id
    private String assetId;

    @Column(nullable = false, updatable = false)
    private String name;

    @Column(nullable = false, updatable = false)
    private String symbol;

    @Column(nullable = false, updatable = false)
    private int decimals;

    /**
     * Account that initialized the asset and controls its mint and burn authority.
     */
    @Column(nullable = false, updatable = false)
    private String admin;

    @Column(name = "total_supply", nullable = false)
    private long totalSupply;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    AssetDescriptor(String admin, String name, String symbol, int decimals) {
        this.assetId = UUID.randomUUID().toString();
        this.admin = admin;
        this.name = name;
        this.symbol = symbol;
        this.decimals = decimals;
        this.totalSupply = 0L;
        this.createdAt = Instant.now();
    }

    static void validate(String name, String symbol, int decimals) {
        if (name == null || name.isBlank() || name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                "Asset name must be 1 to " + MAX_NAME_LENGTH + " characters: " + name);
        }
        if (symbol == null || symbol.isBlank() || symbol.length() > MAX_SYMBOL_LENGTH) {
            throw new IllegalArgumentException(
                "Asset symbol must be 1 to " + MAX_SYMBOL_LENGTH + " characters: " + symbol);
        }
        if (decimals < 0 || decimals > MAX_DECIMALS) {
            throw new IllegalArgumentException("Decimals must be between 0 and " + MAX_DECIMALS + ": " + decimals);
        }
    }

    void increaseSupply(long amount) {
        this.totalSupply = Amounts.add("total supply", totalSupply, amount);
    }

    void decreaseSupply(long amount) {
        if (amount > totalSupply) {
            throw new IllegalStateException(
                String.format("Burn of %d exceeds total supply %d", amount, totalSupply));
        }
        this.totalSupply -= amount;
    }
}
