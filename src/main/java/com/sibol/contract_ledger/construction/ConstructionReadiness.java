package com.sibol.contract_ledger.construction;

import com.sibol.contract_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Point-in-time view of how far a contract's payments are from the construction and
 * turnover thresholds. Penalties are not part of any figure here.
 */
@Value
@Builder
public class ConstructionReadiness {
    UUID contractId;
    Money totalAmount;
    Money paidAmount;
    Money remainingBalance;
    BigDecimal progressPercentage;
    Money constructionThreshold;
    Money turnoverThreshold;
    boolean canStartConstruction;
    boolean turnoverReady;
}
