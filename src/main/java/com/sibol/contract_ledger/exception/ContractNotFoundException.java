package com.sibol.contract_ledger.exception;

import java.util.UUID;

public class ContractNotFoundException extends LedgerException {

    public ContractNotFoundException(UUID contractId) {
        super("Contract not found: " + contractId);
    }
}
