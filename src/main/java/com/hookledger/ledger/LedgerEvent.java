package com.hookledger.ledger;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable record of a supply-changing operation.
 *
 * Events are never updated or deleted - they are append-only.
 * The sequence reflects emission order.
 */
@Entity
@Table(name = "ledger_events", indexes = {
    @Index(name = "idx_event_actor", columnList = "actor"),
    @Index(name = "idx_event_counterparty", columnList = "counterparty")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "seq_no")
    private Long sequence;

    @Column(name = "asset_id", nullable = false, updatable = false)
    private String assetId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EventKind kind;

    /**
     * Account that performed the operation.
     */
    @Column(nullable = false, updatable = false)
    private String actor;

    /**
     * Account whose balance changed.
     */
    @Column(nullable = false, updatable = false)
    private String counterparty;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerEvent(String assetId, EventKind kind, String actor, String counterparty, long amount) {
        this.assetId = assetId;
        this.kind = kind;
        this.actor = actor;
        this.counterparty = counterparty;
        this.amount = amount;
        this.createdAt = Instant.now();
    }
}
