package com.sibol.contract_ledger.exception;

import java.util.UUID;

public class TransactionNotFoundException extends LedgerException {

    public TransactionNotFoundException(UUID contractId, UUID transactionId) {
        super(String.format("Transaction %s not found on contract %s", transactionId, contractId));
    }
}
