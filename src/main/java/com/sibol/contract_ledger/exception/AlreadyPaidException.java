package com.sibol.contract_ledger.exception;

import java.util.UUID;

public class AlreadyPaidException extends LedgerException {

    public AlreadyPaidException(UUID commissionRecordId, UUID payoutTransactionId) {
        super(String.format("Commission record %s was already paid out by transaction %s",
                commissionRecordId, payoutTransactionId));
    }
}
