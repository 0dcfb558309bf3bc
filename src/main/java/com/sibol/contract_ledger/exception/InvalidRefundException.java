package com.sibol.contract_ledger.exception;

public class InvalidRefundException extends LedgerException {

    public InvalidRefundException(String message) {
        super(message);
    }
}
