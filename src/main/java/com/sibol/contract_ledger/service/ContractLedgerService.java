package com.sibol.contract_ledger.service;

import com.sibol.contract_ledger.commission.BeneficiaryRole;
import com.sibol.contract_ledger.commission.CommissionCalculator;
import com.sibol.contract_ledger.commission.CommissionRecord;
import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.event.CommissionPaidOutEvent;
import com.sibol.contract_ledger.event.PaymentAppliedEvent;
import com.sibol.contract_ledger.event.PaymentRefundedEvent;
import com.sibol.contract_ledger.event.TransactionReversedEvent;
import com.sibol.contract_ledger.exception.TransactionNotFoundException;
import com.sibol.contract_ledger.ledger.LedgerEngine;
import com.sibol.contract_ledger.ledger.LedgerOutcome;
import com.sibol.contract_ledger.ledger.LedgerTransaction;
import com.sibol.contract_ledger.ledger.PaymentRecord;
import com.sibol.contract_ledger.ledger.TransactionType;
import com.sibol.contract_ledger.money.Money;
import com.sibol.contract_ledger.observability.LedgerMetrics;
import com.sibol.contract_ledger.outbox.OutboxService;
import com.sibol.contract_ledger.persistence.ContractPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Money movements on a contract: payments, reversals, refunds and commission payouts.
 *
 * Each write runs in one database transaction:
 * 1. Lock the contract row and rebuild the aggregate
 * 2. Let the {@link LedgerEngine} plan and apply the change
 * 3. Persist the aggregate and new ledger entries
 * 4. Write events to the outbox (same transaction)
 *
 * Payments are idempotent per contract and external reference. The Redis cache answers
 * most retries without taking the lock; the row lock and a unique index catch the rest.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractLedgerService {

    private final ContractPersistenceService persistenceService;
    private final LedgerEngine ledgerEngine;
    private final CommissionCalculator commissionCalculator;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final LedgerEventPublisher eventPublisher;
    private final ContractOperations operations;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Applies a payment received from the buyer.
     *
     * A retry with an external reference already booked on the contract returns the original
     * PAYMENT entry and changes nothing.
     */
    @Transactional
    public PaymentResult applyPayment(UUID contractId, Money amount, Instant receivedAt, String externalReference) {
        return operations.execute("apply_payment", contractId, () -> {
            if (externalReference == null || externalReference.isBlank()) {
                throw new IllegalArgumentException("External reference is required");
            }

            Optional<UUID> booked = idempotencyService.findBookedPayment(contractId, externalReference);
            if (booked.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Duplicate payment request: reference={}, transactionId={}", externalReference, booked.get());
                return new PaymentResult(getTransaction(contractId, booked.get()), true);
            }
            metrics.recordIdempotencyMiss();

            Contract contract = persistenceService.loadForUpdate(contractId);

            // A concurrent request may have booked the reference while we waited for the lock
            Optional<LedgerTransaction> raced = findPaymentByReference(contract, externalReference);
            if (raced.isPresent()) {
                metrics.recordIdempotencyHit();
                return new PaymentResult(raced.get(), true);
            }

            PaymentRecord record = PaymentRecord.builder()
                .contractId(contractId)
                .amount(amount)
                .receivedAt(receivedAt != null ? receivedAt : clock.instant())
                .externalReference(externalReference)
                .build();
            LedgerOutcome outcome = ledgerEngine.applyPayment(contract, record);
            Instant now = clock.instant();
            eventPublisher.checkConstructionThreshold(contract, now);
            persistenceService.save(contract);

            LedgerTransaction payment = outcome.getTransaction();
            outboxService.saveEvent(PaymentAppliedEvent.from(payment));
            eventPublisher.statusChanged(outcome.getStatusChanges());
            idempotencyService.remember(contractId, externalReference, payment.getId());

            metrics.recordPaymentApplied(payment.getAmount().getCurrency().name(), payment.getAmount().getAmountMinor());
            metrics.recordPenaltiesAssessed(outcome.getPenalties().size());
            log.info("Payment applied: reference={}, principal={}, penalty={}, credit={}, balance={}",
                externalReference, payment.getAmount(), payment.penaltyAllocated(),
                payment.prepaymentCreditOrZero(), payment.getBalanceAfter());
            return new PaymentResult(payment, false);
        });
    }

    /**
     * Reverses a PAYMENT, PENALTY (a waiver) or REFUND entry.
     */
    @Transactional
    public LedgerTransaction reverseTransaction(UUID contractId, UUID transactionId, String reason) {
        return operations.execute("reverse_transaction", contractId, () -> {
            Contract contract = persistenceService.loadForUpdate(contractId);
            LedgerOutcome outcome = ledgerEngine.reverseTransaction(contract, transactionId, reason);
            persistenceService.save(contract);

            LedgerTransaction reversal = outcome.getTransaction();
            TransactionType reversedType = contract.findTransaction(transactionId)
                .map(LedgerTransaction::getType)
                .orElseThrow(() -> new TransactionNotFoundException(contractId, transactionId));
            outboxService.saveEvent(TransactionReversedEvent.from(reversal, reversedType));
            eventPublisher.statusChanged(outcome.getStatusChanges());

            metrics.recordReversal(reversedType.name());
            log.info("Transaction reversed: original={} ({}), reversal={}, balance={}",
                transactionId, reversedType, reversal.getId(), reversal.getBalanceAfter());
            return reversal;
        });
    }

    /**
     * Refunds part or all of a PAYMENT.
     */
    @Transactional
    public LedgerTransaction refundPayment(UUID contractId, UUID paymentTransactionId, Money amount, String reason) {
        return operations.execute("refund_payment", contractId, () -> {
            Contract contract = persistenceService.loadForUpdate(contractId);
            LedgerOutcome outcome = ledgerEngine.refundPayment(contract, paymentTransactionId, amount, reason);
            persistenceService.save(contract);

            LedgerTransaction refund = outcome.getTransaction();
            outboxService.saveEvent(PaymentRefundedEvent.from(refund));
            eventPublisher.statusChanged(outcome.getStatusChanges());

            metrics.recordRefund();
            log.info("Payment refunded: payment={}, amount={}, balance={}",
                paymentTransactionId, refund.getAmount(), refund.getBalanceAfter());
            return refund;
        });
    }

    /**
     * Pays out an open commission record and freezes it.
     */
    @Transactional
    public LedgerTransaction recordCommissionPayout(UUID contractId, UUID commissionRecordId) {
        return operations.execute("commission_payout", contractId, () -> {
            Contract contract = persistenceService.loadForUpdate(contractId);
            LedgerOutcome outcome = ledgerEngine.recordCommissionPayout(contract, commissionRecordId, clock.instant());
            persistenceService.save(contract);

            CommissionRecord record = contract.findCommission(commissionRecordId)
                .orElseThrow(IllegalStateException::new);
            UUID beneficiaryId = record.getBeneficiaryRole() == BeneficiaryRole.AGENT
                ? contract.getTerms().getAgentId()
                : contract.getTerms().getBrokerId();
            outboxService.saveEvent(CommissionPaidOutEvent.from(record, beneficiaryId));

            metrics.recordCommissionPaidOut(record.getBeneficiaryRole().name());
            log.info("Commission paid out: role={}, amount={}, record={}",
                record.getBeneficiaryRole(), record.getComputedAmount(), commissionRecordId);
            return outcome.getTransaction();
        });
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> getTransactions(UUID contractId) {
        return persistenceService.load(contractId).getTransactions();
    }

    @Transactional(readOnly = true)
    public LedgerTransaction getTransaction(UUID contractId, UUID transactionId) {
        return persistenceService.load(contractId).findTransaction(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(contractId, transactionId));
    }

    @Transactional(readOnly = true)
    public List<CommissionRecord> getCommissions(UUID contractId) {
        return persistenceService.load(contractId).getCommissions();
    }

    @Transactional(readOnly = true)
    public Money getTotalCommission(UUID contractId) {
        return commissionCalculator.totalCommission(persistenceService.load(contractId));
    }

    private static Optional<LedgerTransaction> findPaymentByReference(Contract contract, String externalReference) {
        return contract.getTransactions().stream()
            .filter(tx -> tx.getType() == TransactionType.PAYMENT)
            .filter(tx -> externalReference.equals(tx.getExternalReference()))
            .findFirst();
    }
}
