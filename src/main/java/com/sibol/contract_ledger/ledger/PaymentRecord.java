package com.sibol.contract_ledger.ledger;

import com.sibol.contract_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Money received against a contract, as reported by the caller.
 * {@code externalReference} identifies the payment at its source (bank, gateway) and is what
 * duplicate submissions are recognized by.
 */
@Value
@Builder
public class PaymentRecord {
    UUID contractId;
    Money amount;
    Instant receivedAt;
    String externalReference;
}
