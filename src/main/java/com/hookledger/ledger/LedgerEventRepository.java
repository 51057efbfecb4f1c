package com.hookledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ledger events.
 */
@Repository
public interface LedgerEventRepository extends JpaRepository<LedgerEvent, Long> {

    List<LedgerEvent> findAllByOrderBySequenceAsc();

    List<LedgerEvent> findByActorOrCounterpartyOrderBySequenceAsc(String actor, String counterparty);
}
