package com.sibol.contract_ledger.exception;

public class DuplicateContractNumberException extends LedgerException {

    public DuplicateContractNumberException(String contractNumber) {
        super("Contract number " + contractNumber + " is already in use");
    }
}
