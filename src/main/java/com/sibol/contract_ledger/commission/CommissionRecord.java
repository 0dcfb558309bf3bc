package com.sibol.contract_ledger.commission;

import com.sibol.contract_ledger.exception.AlreadyPaidException;
import com.sibol.contract_ledger.money.Money;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Commission owed to one beneficiary on one contract.
 *
 * A record accumulates while it is open. Once a payout transaction is attached it is
 * frozen; recognitions after that go to a fresh record for the same role.
 */
@Getter
@Builder(builderMethodName = "restore")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CommissionRecord {

    private final UUID id;
    private final UUID contractId;
    private final BeneficiaryRole beneficiaryRole;
    private final BigDecimal ratePercent;
    private Money baseAmount;
    private Money computedAmount;
    private UUID payoutTransactionId;
    private final Instant createdAt;
    private Instant paidAt;

    public static CommissionRecord open(UUID contractId, BeneficiaryRole role, BigDecimal ratePercent,
                                        Money zero, Instant createdAt) {
        return new CommissionRecord(
            UUID.randomUUID(),
            Objects.requireNonNull(contractId),
            Objects.requireNonNull(role),
            Objects.requireNonNull(ratePercent),
            zero,
            zero,
            null,
            createdAt,
            null
        );
    }

    public boolean isPaid() {
        return payoutTransactionId != null;
    }

    /**
     * Adds a recognized principal delta (negative for reversals and refunds) and the
     * commission computed on it.
     */
    void accumulate(Money baseDelta, Money commissionDelta) {
        if (isPaid()) {
            throw new IllegalStateException("Commission record " + id + " is paid out and frozen");
        }
        baseAmount = baseAmount.add(baseDelta);
        computedAmount = computedAmount.add(commissionDelta);
    }

    void markPaid(UUID payoutTransactionId, Instant at) {
        if (isPaid()) {
            throw new AlreadyPaidException(id, this.payoutTransactionId);
        }
        this.payoutTransactionId = Objects.requireNonNull(payoutTransactionId);
        this.paidAt = at;
    }
}
