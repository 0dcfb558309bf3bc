package com.sibol.contract_ledger.ledger;

import com.sibol.contract_ledger.commission.CommissionCalculator;
import com.sibol.contract_ledger.commission.CommissionRecord;
import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.contract.ContractLifecycle;
import com.sibol.contract_ledger.contract.ContractStatus;
import com.sibol.contract_ledger.exception.AlreadyPaidException;
import com.sibol.contract_ledger.exception.AlreadyReversedException;
import com.sibol.contract_ledger.exception.CommissionRecordNotFoundException;
import com.sibol.contract_ledger.exception.ContractNotOpenException;
import com.sibol.contract_ledger.exception.CurrencyMismatchException;
import com.sibol.contract_ledger.exception.InvalidRefundException;
import com.sibol.contract_ledger.exception.InvalidReversalException;
import com.sibol.contract_ledger.exception.OverpaymentException;
import com.sibol.contract_ledger.exception.TransactionNotFoundException;
import com.sibol.contract_ledger.money.Money;
import com.sibol.contract_ledger.schedule.ScheduledInstallment;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Moves money against a contract and keeps the ledger, the schedule and the balance in step.
 *
 * Every operation runs in two phases:
 * 1. Plan: validate the request and work out every change (penalties, allocations,
 *    credit, unwinds) against the current state without touching it.
 * 2. Apply: mutate installments, append ledger entries, book commission, advance the
 *    lifecycle.
 * A rejected request throws during planning, so the contract is left exactly as it was.
 *
 * Operations on the same contract are serialized by a per-contract lock. The engine holds
 * no other state and performs no I/O.
 */
@Slf4j
public class LedgerEngine {

    private final LedgerPolicy policy;
    private final CommissionCalculator commissionCalculator;
    private final ContractLifecycle lifecycle;
    private final Clock clock;
    private final ContractLocks locks = new ContractLocks();

    public LedgerEngine(LedgerPolicy policy, CommissionCalculator commissionCalculator,
                        ContractLifecycle lifecycle, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy").validate();
        this.commissionCalculator = Objects.requireNonNull(commissionCalculator, "commissionCalculator");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ==================== Payments ====================

    /**
     * Applies a received payment.
     *
     * Overdue installments are assessed first, as of the date the money was received. The
     * amount is then allocated oldest installment first, penalty before principal within an
     * installment. Money left after every installment is settled becomes prepayment credit
     * when the contract allows it. That credit stays on the contract until the payment is
     * reversed; it is not spent on installments and is not refundable.
     *
     * @throws ContractNotOpenException  when the contract does not accept payments
     * @throws CurrencyMismatchException when the payment is in another currency
     * @throws OverpaymentException      when the payment exceeds everything owed and the
     *                                   contract does not allow prepayment
     */
    public LedgerOutcome applyPayment(Contract contract, PaymentRecord record) {
        return locks.withLock(contract.getId(), () -> doApplyPayment(contract, record));
    }

    private LedgerOutcome doApplyPayment(Contract contract, PaymentRecord record) {
        if (!contract.getStatus().acceptsPayments()) {
            throw new ContractNotOpenException(contract.getId(), contract.getStatus(), "payments");
        }
        if (!contract.getId().equals(record.getContractId())) {
            throw new IllegalArgumentException(
                "Payment for contract " + record.getContractId() + " submitted to contract " + contract.getId());
        }
        Money amount = record.getAmount();
        requireContractCurrency(contract, amount);
        if (!amount.isPositive()) {
            throw new IllegalArgumentException("Payment amount must be positive: " + amount);
        }
        commissionCalculator.resolveRates(contract);

        LocalDate receivedOn = LocalDate.ofInstant(record.getReceivedAt(), policy.getZone());
        Money zero = Money.zero(contract.getCurrency());

        // Plan
        List<PenaltyPlan> penaltyPlans = new ArrayList<>();
        List<Allocation> allocations = new ArrayList<>();
        Money remaining = amount;
        Money principal = zero;
        for (ScheduledInstallment installment : contract.openInstallments()) {
            PenaltyPlan penalty = planPenalty(installment, receivedOn);
            if (penalty != null) {
                penaltyPlans.add(penalty);
            }
            if (!remaining.isPositive()) {
                continue;
            }
            Money penaltyDue = installment.outstandingPenalty().add(penalty != null ? penalty.amount() : zero);
            Money penaltyPart = remaining.min(penaltyDue);
            remaining = remaining.subtract(penaltyPart);
            Money principalPart = remaining.min(installment.outstandingPrincipal());
            remaining = remaining.subtract(principalPart);
            if (penaltyPart.isPositive() || principalPart.isPositive()) {
                allocations.add(new Allocation(installment.getInstallmentNumber(), principalPart, penaltyPart));
                principal = principal.add(principalPart);
            }
        }
        if (remaining.isPositive() && !contract.getTerms().isAllowPrepayment()) {
            throw new OverpaymentException(contract.getId(), remaining);
        }

        // Apply
        Instant now = clock.instant();
        LedgerOutcome.LedgerOutcomeBuilder outcome = LedgerOutcome.builder();
        for (PenaltyPlan plan : penaltyPlans) {
            if (plan.amount().isPositive()) {
                outcome.penalty(assessPenalty(contract, plan, now));
            } else {
                plan.installment().markOverdue();
            }
        }
        for (Allocation allocation : allocations) {
            ScheduledInstallment installment = installment(contract, allocation.getInstallmentNumber());
            installment.applyPenaltyPayment(allocation.getPenalty());
            installment.applyPrincipal(allocation.getPrincipal(), receivedOn);
            log.debug("Contract {}: installment #{} received principal={} penalty={}",
                contract.getId(), allocation.getInstallmentNumber(), allocation.getPrincipal(), allocation.getPenalty());
        }

        Money balanceBefore = contract.getCumulativePrincipalPaid();
        LedgerTransaction payment = LedgerTransaction.builder()
            .id(UUID.randomUUID())
            .contractId(contract.getId())
            .type(TransactionType.PAYMENT)
            .amount(principal)
            .balanceBefore(balanceBefore)
            .balanceAfter(balanceBefore.add(principal))
            .externalReference(record.getExternalReference())
            .prepaymentCredit(remaining.isPositive() ? remaining : null)
            .allocations(allocations)
            .createdAt(now)
            .build();
        contract.appendTransaction(payment);
        if (remaining.isPositive()) {
            contract.addPrepaymentCredit(remaining);
            log.debug("Contract {}: {} held as prepayment credit", contract.getId(), remaining);
        }

        outcome.transaction(payment)
            .commissionDeltas(commissionCalculator.onPaymentRecognized(contract, principal, now));
        lifecycle.checkCompletion(contract, now).ifPresent(outcome::statusChange);
        return outcome.build();
    }

    private PenaltyPlan planPenalty(ScheduledInstallment installment, LocalDate asOf) {
        long daysOverdue = installment.daysPastDue(asOf);
        if (daysOverdue <= 0) {
            return null;
        }
        Money outstanding = installment.outstandingPrincipal();
        int newMonths = policy.penaltyMonthsFor(daysOverdue) - installment.getPenaltyMonthsAssessed();
        if (newMonths <= 0 || !outstanding.isPositive()) {
            return new PenaltyPlan(installment, 0, Money.zero(outstanding.getCurrency()));
        }
        BigDecimal rate = policy.getPenaltyRatePercent().multiply(BigDecimal.valueOf(newMonths));
        return new PenaltyPlan(installment, newMonths, outstanding.multiplyByPercent(rate));
    }

    private LedgerTransaction assessPenalty(Contract contract, PenaltyPlan plan, Instant now) {
        ScheduledInstallment installment = plan.installment();
        installment.assessPenalty(plan.amount(), plan.months());
        Money balance = contract.getCumulativePrincipalPaid();
        LedgerTransaction penalty = LedgerTransaction.builder()
            .id(UUID.randomUUID())
            .contractId(contract.getId())
            .type(TransactionType.PENALTY)
            .amount(plan.amount())
            .balanceBefore(balance)
            .balanceAfter(balance)
            .reason(String.format("Late payment penalty on installment #%d: %d month(s) at %s%%",
                installment.getInstallmentNumber(), plan.months(), policy.getPenaltyRatePercent().toPlainString()))
            .allocation(Allocation.penalty(installment.getInstallmentNumber(), plan.amount()))
            .createdAt(now)
            .build();
        contract.appendTransaction(penalty);
        log.info("Contract {}: assessed penalty {} on installment #{}",
            contract.getId(), plan.amount(), installment.getInstallmentNumber());
        return penalty;
    }

    // ==================== Reversals ====================

    /**
     * Appends a REVERSAL that exactly undoes an earlier PAYMENT, PENALTY or REFUND.
     *
     * @throws TransactionNotFoundException when the transaction is not on this contract
     * @throws InvalidReversalException     when the transaction cannot be reversed
     * @throws AlreadyReversedException     when a reversal of it already exists
     */
    public LedgerOutcome reverseTransaction(Contract contract, UUID transactionId, String reason) {
        return locks.withLock(contract.getId(), () -> doReverse(contract, transactionId, reason));
    }

    private LedgerOutcome doReverse(Contract contract, UUID transactionId, String reason) {
        ContractStatus status = contract.getStatus();
        if (status.isTerminal() || status == ContractStatus.DRAFT) {
            throw new ContractNotOpenException(contract.getId(), status, "reversals");
        }
        LedgerTransaction original = contract.findTransaction(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(contract.getId(), transactionId));
        if (original.getType() == TransactionType.REVERSAL) {
            throw new InvalidReversalException("Transaction " + transactionId + " is itself a reversal");
        }
        if (original.getType() == TransactionType.COMMISSION_PAYOUT) {
            throw new InvalidReversalException("Commission payout " + transactionId + " is final");
        }
        if (contract.isReversed(transactionId)) {
            throw new AlreadyReversedException(transactionId);
        }

        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, policy.getZone());
        return switch (original.getType()) {
            case PAYMENT -> reversePayment(contract, original, reason, now, today);
            case PENALTY -> waivePenalty(contract, original, reason, now);
            case REFUND -> reverseRefund(contract, original, reason, now, today);
            default -> throw new IllegalStateException("Unhandled transaction type " + original.getType());
        };
    }

    private LedgerOutcome reversePayment(Contract contract, LedgerTransaction payment, String reason,
                                         Instant now, LocalDate today) {
        if (!activeRefundsOf(contract, payment.getId()).isEmpty()) {
            throw new InvalidReversalException(
                "Payment " + payment.getId() + " has been partly refunded; reverse the refunds first");
        }
        commissionCalculator.resolveRates(contract);
        for (Allocation allocation : payment.getAllocations()) {
            ScheduledInstallment installment = installment(contract, allocation.getInstallmentNumber());
            if (installment.getPaidAmount().isLessThan(allocation.getPrincipal())
                || installment.getPenaltyPaid().isLessThan(allocation.getPenalty())) {
                throw new InvalidReversalException(String.format(
                    "Installment #%d no longer holds the amounts paid by %s",
                    allocation.getInstallmentNumber(), payment.getId()));
            }
        }
        Money credit = payment.prepaymentCreditOrZero();
        if (credit.isGreaterThan(contract.getPrepaymentCredit())) {
            throw new InvalidReversalException(String.format(
                "Prepayment credit %s from %s has already been used", credit, payment.getId()));
        }

        List<Allocation> unwound = new ArrayList<>();
        for (Allocation allocation : payment.getAllocations()) {
            ScheduledInstallment installment = installment(contract, allocation.getInstallmentNumber());
            installment.unwindPenaltyPayment(allocation.getPenalty());
            installment.unwindPrincipal(allocation.getPrincipal(), today);
            unwound.add(new Allocation(allocation.getInstallmentNumber(),
                allocation.getPrincipal().negate(), allocation.getPenalty().negate()));
        }
        if (credit.isPositive()) {
            contract.releasePrepaymentCredit(credit);
        }

        LedgerTransaction reversal = appendReversal(contract, payment, reason, unwound, now);
        return LedgerOutcome.builder()
            .transaction(reversal)
            .commissionDeltas(commissionCalculator.onPaymentRecognized(contract, payment.getAmount().negate(), now))
            .build();
    }

    private LedgerOutcome waivePenalty(Contract contract, LedgerTransaction penalty, String reason, Instant now) {
        List<Allocation> unwound = new ArrayList<>();
        for (Allocation allocation : penalty.getAllocations()) {
            ScheduledInstallment installment = installment(contract, allocation.getInstallmentNumber());
            if (installment.outstandingPenalty().isLessThan(allocation.getPenalty())) {
                throw new InvalidReversalException(String.format(
                    "Penalty %s on installment #%d has already been paid", penalty.getId(),
                    allocation.getInstallmentNumber()));
            }
        }
        for (Allocation allocation : penalty.getAllocations()) {
            installment(contract, allocation.getInstallmentNumber()).waivePenalty(allocation.getPenalty());
            unwound.add(new Allocation(allocation.getInstallmentNumber(),
                allocation.getPrincipal().negate(), allocation.getPenalty().negate()));
        }
        return LedgerOutcome.builder()
            .transaction(appendReversal(contract, penalty, reason, unwound, now))
            .build();
    }

    private LedgerOutcome reverseRefund(Contract contract, LedgerTransaction refund, String reason,
                                        Instant now, LocalDate today) {
        commissionCalculator.resolveRates(contract);
        for (Allocation allocation : refund.getAllocations()) {
            ScheduledInstallment installment = installment(contract, allocation.getInstallmentNumber());
            if (installment.outstandingPrincipal().isLessThan(allocation.getPrincipal())) {
                throw new InvalidReversalException(String.format(
                    "Installment #%d has since been paid again; refund %s cannot be restored",
                    allocation.getInstallmentNumber(), refund.getId()));
            }
        }

        List<Allocation> restored = new ArrayList<>();
        for (Allocation allocation : refund.getAllocations()) {
            installment(contract, allocation.getInstallmentNumber()).applyPrincipal(allocation.getPrincipal(), today);
            restored.add(new Allocation(allocation.getInstallmentNumber(),
                allocation.getPrincipal().negate(), allocation.getPenalty().negate()));
        }

        LedgerOutcome.LedgerOutcomeBuilder outcome = LedgerOutcome.builder()
            .transaction(appendReversal(contract, refund, reason, restored, now))
            .commissionDeltas(commissionCalculator.onPaymentRecognized(contract, refund.getAmount(), now));
        lifecycle.checkCompletion(contract, now).ifPresent(outcome::statusChange);
        return outcome.build();
    }

    private LedgerTransaction appendReversal(Contract contract, LedgerTransaction original, String reason,
                                             List<Allocation> allocations, Instant now) {
        Money balanceBefore = contract.getCumulativePrincipalPaid();
        LedgerTransaction reversal = LedgerTransaction.builder()
            .id(UUID.randomUUID())
            .contractId(contract.getId())
            .type(TransactionType.REVERSAL)
            .amount(original.getAmount().negate())
            .balanceBefore(balanceBefore)
            .balanceAfter(balanceBefore.subtract(original.balanceEffect()))
            .reversedTransactionId(original.getId())
            .reason(reason)
            .allocations(allocations)
            .createdAt(now)
            .build();
        contract.appendTransaction(reversal);
        log.info("Contract {}: reversed {} {} ({})", contract.getId(), original.getType(), original.getId(),
            original.getAmount());
        return reversal;
    }

    // ==================== Refunds ====================

    /**
     * Returns part or all of a payment's principal to the payer. The refund unwinds the
     * payment's installments latest first and takes back the commission earned on it.
     *
     * @throws InvalidRefundException when the amount is not positive or exceeds what is left
     *                                of the payment, or the transaction is not a live payment
     */
    public LedgerOutcome refundPayment(Contract contract, UUID paymentTransactionId, Money amount, String reason) {
        return locks.withLock(contract.getId(), () -> doRefund(contract, paymentTransactionId, amount, reason));
    }

    private LedgerOutcome doRefund(Contract contract, UUID paymentTransactionId, Money amount, String reason) {
        ContractStatus status = contract.getStatus();
        if (status == ContractStatus.DRAFT || status == ContractStatus.COMPLETED) {
            throw new ContractNotOpenException(contract.getId(), status, "refunds");
        }
        requireContractCurrency(contract, amount);
        if (!amount.isPositive()) {
            throw new InvalidRefundException("Refund amount must be positive: " + amount);
        }
        LedgerTransaction payment = contract.findTransaction(paymentTransactionId)
            .orElseThrow(() -> new TransactionNotFoundException(contract.getId(), paymentTransactionId));
        if (payment.getType() != TransactionType.PAYMENT) {
            throw new InvalidRefundException(
                "Only payments can be refunded; " + paymentTransactionId + " is a " + payment.getType());
        }
        if (contract.isReversed(paymentTransactionId)) {
            throw new InvalidRefundException("Payment " + paymentTransactionId + " has been reversed");
        }
        commissionCalculator.resolveRates(contract);

        Map<Integer, Money> refundable = refundableByInstallment(contract, payment);
        Money totalRefundable = refundable.values().stream()
            .reduce(Money.zero(contract.getCurrency()), Money::add);
        if (amount.isGreaterThan(totalRefundable)) {
            throw new InvalidRefundException(String.format(
                "Refund %s exceeds the %s still refundable on payment %s", amount, totalRefundable, paymentTransactionId));
        }

        // Latest installment first
        List<Allocation> allocations = new ArrayList<>();
        Money remaining = amount;
        List<Allocation> paid = payment.getAllocations();
        for (int i = paid.size() - 1; i >= 0 && remaining.isPositive(); i--) {
            int number = paid.get(i).getInstallmentNumber();
            Money part = remaining.min(refundable.get(number));
            if (part.isPositive()) {
                allocations.add(Allocation.principal(number, part));
                remaining = remaining.subtract(part);
            }
        }

        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, policy.getZone());
        for (Allocation allocation : allocations) {
            installment(contract, allocation.getInstallmentNumber()).unwindPrincipal(allocation.getPrincipal(), today);
        }
        Money balanceBefore = contract.getCumulativePrincipalPaid();
        LedgerTransaction refund = LedgerTransaction.builder()
            .id(UUID.randomUUID())
            .contractId(contract.getId())
            .type(TransactionType.REFUND)
            .amount(amount)
            .balanceBefore(balanceBefore)
            .balanceAfter(balanceBefore.subtract(amount))
            .relatedTransactionId(paymentTransactionId)
            .reason(reason)
            .allocations(allocations)
            .createdAt(now)
            .build();
        contract.appendTransaction(refund);
        log.info("Contract {}: refunded {} of payment {}", contract.getId(), amount, paymentTransactionId);

        return LedgerOutcome.builder()
            .transaction(refund)
            .commissionDeltas(commissionCalculator.onPaymentRecognized(contract, amount.negate(), now))
            .build();
    }

    /**
     * Principal of {@code payment} per installment, less what live refunds already returned.
     */
    private Map<Integer, Money> refundableByInstallment(Contract contract, LedgerTransaction payment) {
        Map<Integer, Money> refundable = new LinkedHashMap<>();
        for (Allocation allocation : payment.getAllocations()) {
            refundable.merge(allocation.getInstallmentNumber(), allocation.getPrincipal(), Money::add);
        }
        for (LedgerTransaction refund : activeRefundsOf(contract, payment.getId())) {
            for (Allocation allocation : refund.getAllocations()) {
                refundable.computeIfPresent(allocation.getInstallmentNumber(),
                    (number, left) -> left.subtract(allocation.getPrincipal()));
            }
        }
        return refundable;
    }

    private List<LedgerTransaction> activeRefundsOf(Contract contract, UUID paymentTransactionId) {
        return contract.getTransactions().stream()
            .filter(tx -> tx.getType() == TransactionType.REFUND)
            .filter(tx -> paymentTransactionId.equals(tx.getRelatedTransactionId()))
            .filter(tx -> !contract.isReversed(tx.getId()))
            .toList();
    }

    // ==================== Commission payouts ====================

    /**
     * Records that a commission record was paid to its beneficiary and freezes the record.
     *
     * @throws CommissionRecordNotFoundException when the record is not on this contract
     * @throws AlreadyPaidException              when it was already paid out
     */
    public LedgerOutcome recordCommissionPayout(Contract contract, UUID commissionRecordId, Instant at) {
        return locks.withLock(contract.getId(), () -> doRecordPayout(contract, commissionRecordId, at));
    }

    private LedgerOutcome doRecordPayout(Contract contract, UUID commissionRecordId, Instant at) {
        CommissionRecord record = contract.findCommission(commissionRecordId)
            .orElseThrow(() -> new CommissionRecordNotFoundException(contract.getId(), commissionRecordId));
        if (record.isPaid()) {
            throw new AlreadyPaidException(commissionRecordId, record.getPayoutTransactionId());
        }
        if (!record.getComputedAmount().isPositive()) {
            throw new IllegalArgumentException(
                "Commission record " + commissionRecordId + " has nothing to pay out: " + record.getComputedAmount());
        }

        Money balance = contract.getCumulativePrincipalPaid();
        LedgerTransaction payout = LedgerTransaction.builder()
            .id(UUID.randomUUID())
            .contractId(contract.getId())
            .type(TransactionType.COMMISSION_PAYOUT)
            .amount(record.getComputedAmount())
            .balanceBefore(balance)
            .balanceAfter(balance)
            .relatedTransactionId(commissionRecordId)
            .reason(record.getBeneficiaryRole() + " commission payout")
            .createdAt(at)
            .build();
        contract.appendTransaction(payout);
        commissionCalculator.markPaid(contract, commissionRecordId, payout.getId(), at);
        log.info("Contract {}: paid out {} commission {} ({})", contract.getId(), record.getBeneficiaryRole(),
            commissionRecordId, record.getComputedAmount());

        return LedgerOutcome.builder()
            .transaction(payout)
            .build();
    }

    // ==================== Helpers ====================

    private static void requireContractCurrency(Contract contract, Money amount) {
        if (amount.getCurrency() != contract.getCurrency()) {
            throw new CurrencyMismatchException(contract.getCurrency(), amount.getCurrency());
        }
    }

    private static ScheduledInstallment installment(Contract contract, int installmentNumber) {
        return contract.findInstallment(installmentNumber)
            .orElseThrow(() -> new IllegalStateException(
                "Contract " + contract.getId() + " has no installment #" + installmentNumber));
    }

    private record PenaltyPlan(ScheduledInstallment installment, int months, Money amount) {}
}
