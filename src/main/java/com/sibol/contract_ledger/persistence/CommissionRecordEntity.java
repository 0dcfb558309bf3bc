package com.sibol.contract_ledger.persistence;

import com.sibol.contract_ledger.commission.BeneficiaryRole;
import com.sibol.contract_ledger.commission.CommissionRecord;
import com.sibol.contract_ledger.money.CurrencyCode;
import com.sibol.contract_ledger.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "commission_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CommissionRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private UUID contractId;

    @Enumerated(EnumType.STRING)
    @Column(name = "beneficiary_role", nullable = false, updatable = false, length = 16)
    private BeneficiaryRole beneficiaryRole;

    @Column(name = "rate_percent", nullable = false, updatable = false, precision = 7, scale = 4)
    private BigDecimal ratePercent;

    @Column(name = "base_amount_minor", nullable = false)
    private long baseAmountMinor;

    @Column(name = "computed_amount_minor", nullable = false)
    private long computedAmountMinor;

    @Column(name = "payout_transaction_id")
    private UUID payoutTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "paid_at")
    private Instant paidAt;

    static CommissionRecordEntity fromDomain(CommissionRecord record) {
        CommissionRecordEntity entity = new CommissionRecordEntity();
        entity.id = record.getId();
        entity.contractId = record.getContractId();
        entity.beneficiaryRole = record.getBeneficiaryRole();
        entity.ratePercent = record.getRatePercent();
        entity.baseAmountMinor = record.getBaseAmount().getAmountMinor();
        entity.computedAmountMinor = record.getComputedAmount().getAmountMinor();
        entity.payoutTransactionId = record.getPayoutTransactionId();
        entity.createdAt = record.getCreatedAt();
        entity.paidAt = record.getPaidAt();
        return entity;
    }

    CommissionRecord toDomain(CurrencyCode currency) {
        return CommissionRecord.restore()
            .id(id)
            .contractId(contractId)
            .beneficiaryRole(beneficiaryRole)
            .ratePercent(ratePercent)
            .baseAmount(Money.ofMinor(baseAmountMinor, currency))
            .computedAmount(Money.ofMinor(computedAmountMinor, currency))
            .payoutTransactionId(payoutTransactionId)
            .createdAt(createdAt)
            .paidAt(paidAt)
            .build();
    }
}
