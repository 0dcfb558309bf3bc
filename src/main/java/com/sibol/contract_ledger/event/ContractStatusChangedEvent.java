package com.sibol.contract_ledger.event;

import com.sibol.contract_ledger.contract.ContractStatus;
import com.sibol.contract_ledger.contract.StatusChange;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ContractStatusChangedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "ContractStatusChanged";

    UUID eventId;
    UUID contractId;
    ContractStatus fromStatus;
    ContractStatus toStatus;
    String reason;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ContractStatusChangedEvent from(StatusChange change) {
        return new ContractStatusChangedEvent(
            UUID.randomUUID(),
            change.getContractId(),
            change.getFrom(),
            change.getTo(),
            change.getReason(),
            change.getAt()
        );
    }
}
