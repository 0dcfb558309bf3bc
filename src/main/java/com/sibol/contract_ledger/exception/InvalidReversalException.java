package com.sibol.contract_ledger.exception;

/**
 * Raised when a transaction exists but its type or current effects make it impossible to
 * reverse (reversals themselves, commission payouts, partly refunded payments, paid penalties).
 */
public class InvalidReversalException extends LedgerException {

    public InvalidReversalException(String message) {
        super(message);
    }
}
