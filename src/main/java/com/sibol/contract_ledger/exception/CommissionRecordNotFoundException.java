package com.sibol.contract_ledger.exception;

import java.util.UUID;

public class CommissionRecordNotFoundException extends LedgerException {

    public CommissionRecordNotFoundException(UUID contractId, UUID commissionRecordId) {
        super(String.format("Commission record %s not found on contract %s", commissionRecordId, contractId));
    }
}
