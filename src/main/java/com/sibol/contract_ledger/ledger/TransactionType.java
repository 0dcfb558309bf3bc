package com.sibol.contract_ledger.ledger;

/**
 * Type of a ledger entry.
 *
 * The contract balance is cumulative principal paid. PAYMENT raises it, REFUND lowers it,
 * PENALTY and COMMISSION_PAYOUT leave it untouched, and REVERSAL undoes whatever its
 * original did.
 */
public enum TransactionType {
    PAYMENT,
    COMMISSION_PAYOUT,
    REFUND,
    PENALTY,
    REVERSAL;

    /**
     * Balance effect of a non-reversal entry of this type carrying {@code amount}.
     */
    public long signedEffect(long amountMinor) {
        return switch (this) {
            case PAYMENT -> amountMinor;
            case REFUND -> -amountMinor;
            case PENALTY, COMMISSION_PAYOUT -> 0L;
            case REVERSAL -> throw new IllegalArgumentException(
                "A reversal's effect depends on the transaction it reverses");
        };
    }
}
