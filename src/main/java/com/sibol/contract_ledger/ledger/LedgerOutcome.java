package com.sibol.contract_ledger.ledger;

import com.sibol.contract_ledger.commission.CommissionDelta;
import com.sibol.contract_ledger.contract.StatusChange;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything one engine call did to a contract: the primary ledger entry, any penalty
 * entries assessed on the way, commission deltas and status transitions.
 */
@Value
@Builder
public class LedgerOutcome {
    LedgerTransaction transaction;
    @Singular
    List<LedgerTransaction> penalties;
    @Singular
    List<CommissionDelta> commissionDeltas;
    @Singular
    List<StatusChange> statusChanges;
}
