package com.sibol.contract_ledger.exception;

/**
 * Base type for every rejection raised by the ledger engine.
 *
 * All subclasses are terminal for the single operation that raised them: the engine never
 * retries, and the contract aggregate is left exactly as it was before the call.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }
}
