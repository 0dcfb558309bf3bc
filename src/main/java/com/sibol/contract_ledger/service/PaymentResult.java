package com.sibol.contract_ledger.service;

import com.sibol.contract_ledger.ledger.LedgerTransaction;
import lombok.Value;

/**
 * The PAYMENT entry for a request, and whether it was booked by an earlier request with the
 * same external reference.
 */
@Value
public class PaymentResult {
    LedgerTransaction transaction;
    boolean duplicate;
}
