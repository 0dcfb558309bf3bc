package com.sibol.contract_ledger.event;

import com.sibol.contract_ledger.ledger.LedgerTransaction;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentRefundedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "PaymentRefunded";

    UUID eventId;
    UUID contractId;
    UUID refundTransactionId;
    UUID paymentTransactionId;
    long amountMinor;
    long balanceAfterMinor;
    String currency;
    String reason;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentRefundedEvent from(LedgerTransaction refund) {
        return new PaymentRefundedEvent(
            UUID.randomUUID(),
            refund.getContractId(),
            refund.getId(),
            refund.getRelatedTransactionId(),
            refund.getAmount().getAmountMinor(),
            refund.getBalanceAfter().getAmountMinor(),
            refund.getAmount().getCurrency().name(),
            refund.getReason(),
            refund.getCreatedAt()
        );
    }
}
