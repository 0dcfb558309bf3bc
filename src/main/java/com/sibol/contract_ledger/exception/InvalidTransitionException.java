package com.sibol.contract_ledger.exception;

import com.sibol.contract_ledger.contract.ContractStatus;

/**
 * Raised when a contract status change is not allowed from the contract's current status,
 * or when the transition's precondition (schedule, signatures, payments) does not hold.
 */
public class InvalidTransitionException extends LedgerException {

    private final ContractStatus from;
    private final ContractStatus to;

    public InvalidTransitionException(ContractStatus from, ContractStatus to, String reason) {
        super(String.format("Cannot move contract from %s to %s: %s", from, to, reason));
        this.from = from;
        this.to = to;
    }

    public ContractStatus getFrom() {
        return from;
    }

    public ContractStatus getTo() {
        return to;
    }
}
