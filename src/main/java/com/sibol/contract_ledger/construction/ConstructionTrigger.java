package com.sibol.contract_ledger.construction;

import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.money.Money;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Evaluates cumulative principal paid against the construction and turnover thresholds.
 * Read-only: nothing here changes a contract.
 */
public class ConstructionTrigger {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    public boolean canStartConstruction(ConstructionThresholds thresholds, Money total, Money paid) {
        return paid.compareTo(total.multiplyByPercent(thresholds.getTriggerPercentage())) >= 0;
    }

    public boolean isTurnoverReady(ConstructionThresholds thresholds, Money total, Money paid) {
        return paid.compareTo(total.multiplyByPercent(thresholds.getTurnoverPercentage())) >= 0;
    }

    /**
     * True when moving the balance from {@code paidBefore} to {@code paidAfter} crossed the
     * construction threshold upwards.
     */
    public boolean crossedConstructionThreshold(ConstructionThresholds thresholds, Money total,
                                                Money paidBefore, Money paidAfter) {
        return !canStartConstruction(thresholds, total, paidBefore)
            && canStartConstruction(thresholds, total, paidAfter);
    }

    public ConstructionReadiness evaluate(Contract contract) {
        ConstructionThresholds thresholds = ConstructionThresholds.of(contract.getTerms());
        Money total = contract.getTotalAmount();
        Money paid = contract.getCumulativePrincipalPaid();
        return ConstructionReadiness.builder()
            .contractId(contract.getId())
            .totalAmount(total)
            .paidAmount(paid)
            .remainingBalance(total.subtract(paid))
            .progressPercentage(progress(total, paid))
            .constructionThreshold(total.multiplyByPercent(thresholds.getTriggerPercentage()))
            .turnoverThreshold(total.multiplyByPercent(thresholds.getTurnoverPercentage()))
            .canStartConstruction(canStartConstruction(thresholds, total, paid))
            .turnoverReady(isTurnoverReady(thresholds, total, paid))
            .build();
    }

    /**
     * Percent of the total paid, two decimals, HALF_UP.
     */
    public BigDecimal progress(Money total, Money paid) {
        if (total.isZero()) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(paid.getAmountMinor())
            .multiply(ONE_HUNDRED)
            .divide(BigDecimal.valueOf(total.getAmountMinor()), 2, RoundingMode.HALF_UP);
    }
}
