package com.sibol.contract_ledger.event;

import com.sibol.contract_ledger.ledger.LedgerTransaction;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A payment was accepted and allocated. {@code principalMinor} moved the balance;
 * {@code penaltyMinor} settled penalties and {@code prepaymentCreditMinor} was held as
 * credit.
 */
@Value
public class PaymentAppliedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "PaymentApplied";

    UUID eventId;
    UUID contractId;
    UUID transactionId;
    String externalReference;
    long principalMinor;
    long penaltyMinor;
    long prepaymentCreditMinor;
    long balanceAfterMinor;
    String currency;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentAppliedEvent from(LedgerTransaction payment) {
        return new PaymentAppliedEvent(
            UUID.randomUUID(),
            payment.getContractId(),
            payment.getId(),
            payment.getExternalReference(),
            payment.getAmount().getAmountMinor(),
            payment.penaltyAllocated().getAmountMinor(),
            payment.prepaymentCreditOrZero().getAmountMinor(),
            payment.getBalanceAfter().getAmountMinor(),
            payment.getAmount().getCurrency().name(),
            payment.getCreatedAt()
        );
    }
}
