package com.sibol.contract_ledger.contract;

/**
 * Contract status.
 *
 * Transitions are owned by {@link ContractLifecycle}; nothing else may change a status.
 * DRAFT → PENDING_SIGNATURE → ACTIVE → {COMPLETED, EXPIRED}, and TERMINATED / CANCELLED
 * from any non-terminal status.
 */
public enum ContractStatus {
    /**
     * Terms captured, schedule may still be (re)built.
     */
    DRAFT,

    /**
     * Schedule fixed, waiting for the required parties to sign.
     * Reservation fees and early payments are already accepted here.
     */
    PENDING_SIGNATURE,

    /**
     * Fully signed and being paid down.
     */
    ACTIVE,

    /**
     * Cumulative principal reached the contract total. Terminal.
     */
    COMPLETED,

    /**
     * Ended by administrative action after taking effect. Terminal.
     */
    TERMINATED,

    /**
     * Withdrawn by administrative action. Terminal.
     */
    CANCELLED,

    /**
     * End date passed before the contract was paid in full. Terminal.
     */
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TERMINATED || this == CANCELLED || this == EXPIRED;
    }

    /**
     * Whether money may move against the contract in this status.
     */
    public boolean acceptsPayments() {
        return this == PENDING_SIGNATURE || this == ACTIVE;
    }
}
