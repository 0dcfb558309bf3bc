package com.sibol.contract_ledger.exception;

/**
 * Raised when a rate the engine needs (penalty, commission) is not configured.
 * A missing rate is never treated as zero.
 */
public class LedgerConfigurationException extends LedgerException {

    public LedgerConfigurationException(String message) {
        super(message);
    }
}
