package com.sibol.contract_ledger.ledger;

import com.sibol.contract_ledger.money.Money;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * An append-only ledger entry.
 *
 * Key invariants:
 * - {@code balanceAfter = balanceBefore + effect}, where the effect follows
 *   {@link TransactionType#signedEffect} and a REVERSAL undoes its original's effect
 * - A REVERSAL points at its original through {@code reversedTransactionId} and carries the
 *   exact negation of the original amount
 * - Entries are never updated or deleted; corrections are new entries
 *
 * {@code relatedTransactionId} links a REFUND to the PAYMENT it refunds and a
 * COMMISSION_PAYOUT to the commission record it settles.
 */
@Value
@Builder
public class LedgerTransaction {
    UUID id;
    UUID contractId;
    TransactionType type;
    Money amount;
    Money balanceBefore;
    Money balanceAfter;
    UUID reversedTransactionId;
    UUID relatedTransactionId;
    String externalReference;
    String reason;
    // Part of a PAYMENT left over after every installment was settled
    Money prepaymentCredit;
    @Singular
    List<Allocation> allocations;
    Instant createdAt;

    public boolean isReversal() {
        return type == TransactionType.REVERSAL;
    }

    /**
     * Net change this entry made to the contract balance.
     */
    public Money balanceEffect() {
        return balanceAfter.subtract(balanceBefore);
    }

    public Money prepaymentCreditOrZero() {
        return prepaymentCredit != null ? prepaymentCredit : Money.zero(amount.getCurrency());
    }

    public Money principalAllocated() {
        return allocations.stream()
            .map(Allocation::getPrincipal)
            .reduce(Money.zero(amount.getCurrency()), Money::add);
    }

    public Money penaltyAllocated() {
        return allocations.stream()
            .map(Allocation::getPenalty)
            .reduce(Money.zero(amount.getCurrency()), Money::add);
    }
}
