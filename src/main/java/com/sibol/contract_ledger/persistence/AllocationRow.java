package com.sibol.contract_ledger.persistence;

import com.sibol.contract_ledger.ledger.Allocation;
import com.sibol.contract_ledger.money.CurrencyCode;
import com.sibol.contract_ledger.money.Money;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JSON shape of one allocation inside {@code ledger_transactions.allocations}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
class AllocationRow {
    private int installmentNumber;
    private long principalMinor;
    private long penaltyMinor;

    static AllocationRow fromDomain(Allocation allocation) {
        return new AllocationRow(
            allocation.getInstallmentNumber(),
            allocation.getPrincipal().getAmountMinor(),
            allocation.getPenalty().getAmountMinor()
        );
    }

    Allocation toDomain(CurrencyCode currency) {
        return new Allocation(installmentNumber,
            Money.ofMinor(principalMinor, currency),
            Money.ofMinor(penaltyMinor, currency));
    }
}
