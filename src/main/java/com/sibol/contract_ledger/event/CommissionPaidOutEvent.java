package com.sibol.contract_ledger.event;

import com.sibol.contract_ledger.commission.BeneficiaryRole;
import com.sibol.contract_ledger.commission.CommissionRecord;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class CommissionPaidOutEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "CommissionPaidOut";

    UUID eventId;
    UUID contractId;
    UUID commissionRecordId;
    UUID payoutTransactionId;
    BeneficiaryRole beneficiaryRole;
    UUID beneficiaryId;
    BigDecimal ratePercent;
    long amountMinor;
    String currency;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CommissionPaidOutEvent from(CommissionRecord record, UUID beneficiaryId) {
        return new CommissionPaidOutEvent(
            UUID.randomUUID(),
            record.getContractId(),
            record.getId(),
            record.getPayoutTransactionId(),
            record.getBeneficiaryRole(),
            beneficiaryId,
            record.getRatePercent(),
            record.getComputedAmount().getAmountMinor(),
            record.getComputedAmount().getCurrency().name(),
            record.getPaidAt()
        );
    }
}
