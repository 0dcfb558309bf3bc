package com.sibol.contract_ledger.ledger;

import com.sibol.contract_ledger.money.Money;
import lombok.Value;

/**
 * The part of a ledger entry that landed on one installment.
 * Principal and penalty are kept apart so a reversal can unwind each exactly.
 */
@Value
public class Allocation {
    int installmentNumber;
    Money principal;
    Money penalty;

    public static Allocation principal(int installmentNumber, Money principal) {
        return new Allocation(installmentNumber, principal, Money.zero(principal.getCurrency()));
    }

    public static Allocation penalty(int installmentNumber, Money penalty) {
        return new Allocation(installmentNumber, Money.zero(penalty.getCurrency()), penalty);
    }
}
