package com.hookledger.ledger;

/**
 * Append-only, ordered destination for ledger events.
 *
 * The ledger writes to the sink and never reads it back.
 */
public interface EventSink {

    void append(LedgerEvent event);
}
