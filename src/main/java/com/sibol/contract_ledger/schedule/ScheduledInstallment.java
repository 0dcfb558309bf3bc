package com.sibol.contract_ledger.schedule;

import com.sibol.contract_ledger.money.Money;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * One obligation in a contract's payment plan.
 *
 * Principal ({@code amount} / {@code paidAmount}) and penalty ({@code penaltyAmount} /
 * {@code penaltyPaid}) are tracked separately: penalties never count toward the contract
 * balance or commissions.
 *
 * Only the ledger engine mutates installments, and only through the methods below; there
 * are no setters. Every mutator validates its own bounds so an engine bug cannot push an
 * installment past its amount or below zero.
 */
@Getter
@Builder(builderMethodName = "restore")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScheduledInstallment {

    private final UUID contractId;
    private final int installmentNumber;
    private final Money amount;
    private final LocalDate dueDate;
    private final PaymentType paymentType;

    private Money paidAmount;
    private LocalDate paidDate;
    private boolean overdue;
    private Money penaltyAmount;
    private Money penaltyPaid;
    private int penaltyMonthsAssessed;

    /**
     * Creates an unpaid installment.
     */
    public static ScheduledInstallment scheduled(UUID contractId, int installmentNumber, Money amount,
                                                 LocalDate dueDate, PaymentType paymentType) {
        if (!amount.isPositive()) {
            throw new IllegalArgumentException("Installment amount must be positive: " + amount);
        }
        Money zero = Money.zero(amount.getCurrency());
        return new ScheduledInstallment(
            Objects.requireNonNull(contractId),
            installmentNumber,
            amount,
            Objects.requireNonNull(dueDate),
            Objects.requireNonNull(paymentType),
            zero,
            null,
            false,
            zero,
            zero,
            0
        );
    }

    public Money outstandingPrincipal() {
        return amount.subtract(paidAmount);
    }

    public Money outstandingPenalty() {
        return penaltyAmount.subtract(penaltyPaid);
    }

    public boolean isPrincipalSettled() {
        return outstandingPrincipal().isZero();
    }

    /**
     * Principal and every assessed penalty are paid.
     */
    public boolean isSettled() {
        return isPrincipalSettled() && outstandingPenalty().isZero();
    }

    /**
     * Whole days between the due date and {@code asOf}; zero or negative when not yet due.
     */
    public long daysPastDue(LocalDate asOf) {
        return ChronoUnit.DAYS.between(dueDate, asOf);
    }

    public void applyPrincipal(Money portion, LocalDate on) {
        requireNonNegative(portion);
        if (portion.isGreaterThan(outstandingPrincipal())) {
            throw new IllegalStateException(String.format(
                "Installment %d: principal %s exceeds outstanding %s",
                installmentNumber, portion, outstandingPrincipal()));
        }
        paidAmount = paidAmount.add(portion);
        if (isPrincipalSettled()) {
            paidDate = on;
            overdue = false;
        }
    }

    public void unwindPrincipal(Money portion, LocalDate asOf) {
        requireNonNegative(portion);
        if (portion.isGreaterThan(paidAmount)) {
            throw new IllegalStateException(String.format(
                "Installment %d: cannot unwind %s, only %s paid", installmentNumber, portion, paidAmount));
        }
        paidAmount = paidAmount.subtract(portion);
        if (!isPrincipalSettled()) {
            paidDate = null;
            overdue = daysPastDue(asOf) > 0;
        }
    }

    public void applyPenaltyPayment(Money portion) {
        requireNonNegative(portion);
        if (portion.isGreaterThan(outstandingPenalty())) {
            throw new IllegalStateException(String.format(
                "Installment %d: penalty payment %s exceeds outstanding penalty %s",
                installmentNumber, portion, outstandingPenalty()));
        }
        penaltyPaid = penaltyPaid.add(portion);
    }

    public void unwindPenaltyPayment(Money portion) {
        requireNonNegative(portion);
        if (portion.isGreaterThan(penaltyPaid)) {
            throw new IllegalStateException(String.format(
                "Installment %d: cannot unwind penalty %s, only %s paid", installmentNumber, portion, penaltyPaid));
        }
        penaltyPaid = penaltyPaid.subtract(portion);
    }

    /**
     * Adds a newly assessed penalty covering {@code months} additional overdue periods.
     */
    public void assessPenalty(Money penalty, int months) {
        requireNonNegative(penalty);
        if (isSettled()) {
            throw new IllegalStateException("Installment " + installmentNumber + " is settled; penalties are frozen");
        }
        penaltyAmount = penaltyAmount.add(penalty);
        penaltyMonthsAssessed += months;
        overdue = true;
    }

    /**
     * Removes an unpaid penalty. The waived periods stay counted as assessed so they are
     * never charged again.
     */
    public void waivePenalty(Money penalty) {
        requireNonNegative(penalty);
        if (penalty.isGreaterThan(outstandingPenalty())) {
            throw new IllegalStateException(String.format(
                "Installment %d: cannot waive %s, only %s outstanding", installmentNumber, penalty, outstandingPenalty()));
        }
        penaltyAmount = penaltyAmount.subtract(penalty);
    }

    public void markOverdue() {
        if (!isPrincipalSettled()) {
            overdue = true;
        }
    }

    private static void requireNonNegative(Money portion) {
        if (portion.isNegative()) {
            throw new IllegalArgumentException("Amount must not be negative: " + portion);
        }
    }
}
