package com.sibol.contract_ledger.commission;

import com.sibol.contract_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Change applied to one commission record by a single recognition, clawback or payout.
 */
@Value
public class CommissionDelta {
    UUID commissionRecordId;
    BeneficiaryRole role;
    BigDecimal ratePercent;
    Money baseDelta;
    Money commissionDelta;
}
