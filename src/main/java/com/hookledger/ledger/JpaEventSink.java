package com.hookledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Event sink backed by the {@code ledger_events} table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaEventSink implements EventSink {

    private final LedgerEventRepository eventRepository;

    @Override
    public void append(LedgerEvent event) {
        eventRepository.save(event);
        log.info("Recorded {}: actor={}, counterparty={}, amount={}",
            event.getKind(), event.getActor(), event.getCounterparty(), event.getAmount());
    }
}
