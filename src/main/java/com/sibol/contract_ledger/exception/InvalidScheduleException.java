package com.sibol.contract_ledger.exception;

/**
 * Raised when a contract's financial terms cannot produce a valid payment schedule.
 */
public class InvalidScheduleException extends LedgerException {

    public InvalidScheduleException(String message) {
        super(message);
    }
}
