package com.sibol.contract_ledger.event;

import com.sibol.contract_ledger.ledger.LedgerTransaction;
import com.sibol.contract_ledger.ledger.TransactionType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TransactionReversedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "TransactionReversed";

    UUID eventId;
    UUID contractId;
    UUID reversalTransactionId;
    UUID reversedTransactionId;
    TransactionType reversedType;
    long amountMinor;
    long balanceAfterMinor;
    String currency;
    String reason;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionReversedEvent from(LedgerTransaction reversal, TransactionType reversedType) {
        return new TransactionReversedEvent(
            UUID.randomUUID(),
            reversal.getContractId(),
            reversal.getId(),
            reversal.getReversedTransactionId(),
            reversedType,
            reversal.getAmount().getAmountMinor(),
            reversal.getBalanceAfter().getAmountMinor(),
            reversal.getAmount().getCurrency().name(),
            reversal.getReason(),
            reversal.getCreatedAt()
        );
    }
}
