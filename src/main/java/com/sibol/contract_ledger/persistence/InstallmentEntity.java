package com.sibol.contract_ledger.persistence;

import com.sibol.contract_ledger.money.CurrencyCode;
import com.sibol.contract_ledger.money.Money;
import com.sibol.contract_ledger.schedule.PaymentType;
import com.sibol.contract_ledger.schedule.ScheduledInstallment;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One schedule line. Amounts are minor units in the owning contract's currency.
 */
@Entity
@Table(name = "scheduled_installments")
@IdClass(InstallmentEntity.Key.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InstallmentEntity {

    @Id
    @Column(name = "contract_id", nullable = false, updatable = false)
    private UUID contractId;

    @Id
    @Column(name = "installment_number", nullable = false, updatable = false)
    private int installmentNumber;

    @Column(name = "amount_minor", nullable = false, updatable = false)
    private long amountMinor;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, updatable = false, length = 32)
    private PaymentType paymentType;

    @Column(name = "paid_amount_minor", nullable = false)
    private long paidAmountMinor;

    @Column(name = "paid_date")
    private LocalDate paidDate;

    @Column(name = "is_overdue", nullable = false)
    private boolean overdue;

    @Column(name = "penalty_amount_minor", nullable = false)
    private long penaltyAmountMinor;

    @Column(name = "penalty_paid_minor", nullable = false)
    private long penaltyPaidMinor;

    @Column(name = "penalty_months_assessed", nullable = false)
    private int penaltyMonthsAssessed;

    static InstallmentEntity fromDomain(ScheduledInstallment installment) {
        InstallmentEntity entity = new InstallmentEntity();
        entity.contractId = installment.getContractId();
        entity.installmentNumber = installment.getInstallmentNumber();
        entity.amountMinor = installment.getAmount().getAmountMinor();
        entity.dueDate = installment.getDueDate();
        entity.paymentType = installment.getPaymentType();
        entity.paidAmountMinor = installment.getPaidAmount().getAmountMinor();
        entity.paidDate = installment.getPaidDate();
        entity.overdue = installment.isOverdue();
        entity.penaltyAmountMinor = installment.getPenaltyAmount().getAmountMinor();
        entity.penaltyPaidMinor = installment.getPenaltyPaid().getAmountMinor();
        entity.penaltyMonthsAssessed = installment.getPenaltyMonthsAssessed();
        return entity;
    }

    ScheduledInstallment toDomain(CurrencyCode currency) {
        return ScheduledInstallment.restore()
            .contractId(contractId)
            .installmentNumber(installmentNumber)
            .amount(Money.ofMinor(amountMinor, currency))
            .dueDate(dueDate)
            .paymentType(paymentType)
            .paidAmount(Money.ofMinor(paidAmountMinor, currency))
            .paidDate(paidDate)
            .overdue(overdue)
            .penaltyAmount(Money.ofMinor(penaltyAmountMinor, currency))
            .penaltyPaid(Money.ofMinor(penaltyPaidMinor, currency))
            .penaltyMonthsAssessed(penaltyMonthsAssessed)
            .build();
    }

    @EqualsAndHashCode
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private UUID contractId;
        private int installmentNumber;
    }
}
