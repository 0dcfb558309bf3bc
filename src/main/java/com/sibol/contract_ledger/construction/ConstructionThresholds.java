package com.sibol.contract_ledger.construction;

import com.sibol.contract_ledger.contract.ContractTerms;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Percentages of the contract total that unlock construction and turnover.
 */
@Value
public class ConstructionThresholds {
    BigDecimal triggerPercentage;
    BigDecimal turnoverPercentage;

    public static ConstructionThresholds of(ContractTerms terms) {
        return new ConstructionThresholds(terms.getConstructionTriggerPercentage(),
            terms.getTurnoverReadinessPercentage());
    }
}
