package com.hookledger.asset;

import com.hookledger.common.Amounts;
import com.hookledger.common.exception.InsufficientBalanceException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Balance cell of one owner for one asset.
 *
 * The balance has no setter. It changes only through {@link #debit} and
 * {@link #credit}, both of which require the asset's {@link TransferCapability}
 * and are reachable only from this package, behind the hooks.
 */
@Entity
@Table(name = "account_stores", uniqueConstraints = {
    @UniqueConstraint(name = "uk_store_owner_asset", columnNames = {"owner", "asset_id"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AccountStore {

    @Id
    private String storeId;

    @Column(nullable = false)
    private String owner;

    @Column(name = "asset_id", nullable = false)
    private String assetId;

    @Column(nullable = false)
    private long balance;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    AccountStore(String owner, String assetId) {
        this.storeId = UUID.randomUUID().toString();
        this.owner = owner;
        this.assetId = assetId;
        this.balance = 0L;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    /**
     * Remove {@code amount} units and return them as a detached amount.
     *
     * @throws com.hookledger.common.exception.UnauthorizedException if the capability is missing or foreign
     * @throws InsufficientBalanceException if the store holds less than {@code amount}
     */
    FungibleAmount debit(long amount, TransferCapability capability) {
        Capability.require(capability, TransferCapability.class, assetId);
        Amounts.requireNonNegative(amount);

        if (amount > balance) {
            throw new InsufficientBalanceException(owner, amount, balance);
        }

        balance -= amount;
        this.updatedAt = Instant.now();
        return new FungibleAmount(assetId, amount);
    }

    /**
     * Add a detached amount to this store, consuming it.
     *
     * @throws com.hookledger.common.exception.UnauthorizedException if the capability is missing or foreign
     * @throws com.hookledger.common.exception.OverflowException if the balance would overflow
     */
    void credit(FungibleAmount amount, TransferCapability capability) {
        Capability.require(capability, TransferCapability.class, assetId);
        if (!amount.getAssetId().equals(assetId)) {
            throw new IllegalArgumentException("Asset mismatch: " + amount.getAssetId() + " into " + assetId);
        }

        long updated = Amounts.add("balance of " + owner, balance, amount.getValue());
        amount.consume();
        balance = updated;
        this.updatedAt = Instant.now();
    }
}
