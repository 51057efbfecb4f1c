package com.hookledger.ledger;

/**
 * Kinds of ledger events.
 */
public enum EventKind {
    /**
     * New units created and credited to the counterparty.
     */
    MINT,

    /**
     * Units debited from the counterparty and destroyed.
     */
    BURN
}
