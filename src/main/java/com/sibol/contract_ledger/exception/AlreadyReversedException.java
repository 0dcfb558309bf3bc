package com.sibol.contract_ledger.exception;

import java.util.UUID;

public class AlreadyReversedException extends LedgerException {

    public AlreadyReversedException(UUID transactionId) {
        super("Transaction " + transactionId + " has already been reversed");
    }
}
