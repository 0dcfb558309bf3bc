package com.sibol.contract_ledger.exception;

import com.sibol.contract_ledger.contract.ContractStatus;

import java.util.UUID;

/**
 * Raised when money movement is attempted on a contract whose status does not accept it.
 */
public class ContractNotOpenException extends LedgerException {

    public ContractNotOpenException(UUID contractId, ContractStatus status, String operation) {
        super(String.format("Contract %s is %s and does not accept %s", contractId, status, operation));
    }
}
