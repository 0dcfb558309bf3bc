package com.sibol.contract_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every event published about a contract.
 * Amounts travel as minor units plus an ISO currency code.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance; consumers dedupe on it.
     */
    UUID getEventId();

    UUID getContractId();

    Instant getOccurredAt();

    String getEventType();
}
