package com.sibol.contract_ledger.exception;

import com.sibol.contract_ledger.money.CurrencyCode;

/**
 * Raised when two money amounts of different currencies meet in one operation.
 */
public class CurrencyMismatchException extends LedgerException {

    public CurrencyMismatchException(CurrencyCode expected, CurrencyCode actual) {
        super(String.format("Currency mismatch: expected %s but got %s", expected, actual));
    }
}
