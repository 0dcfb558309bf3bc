package com.sibol.contract_ledger.exception;

import com.sibol.contract_ledger.money.Money;

import java.util.UUID;

/**
 * Raised when a payment exceeds everything still owed on a contract that does not accept
 * prepayment.
 */
public class OverpaymentException extends LedgerException {

    private final Money excess;

    public OverpaymentException(UUID contractId, Money excess) {
        super(String.format("Payment exceeds the outstanding balance of contract %s by %s",
                contractId, excess));
        this.excess = excess;
    }

    public Money getExcess() {
        return excess;
    }
}
