package com.sibol.contract_ledger.contract;

import com.sibol.contract_ledger.commission.CommissionRecord;
import com.sibol.contract_ledger.exception.InvalidScheduleException;
import com.sibol.contract_ledger.ledger.LedgerTransaction;
import com.sibol.contract_ledger.money.CurrencyCode;
import com.sibol.contract_ledger.money.Money;
import com.sibol.contract_ledger.schedule.ScheduledInstallment;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Contract aggregate: terms, status, signatures, the payment schedule, the ledger and the
 * commission records.
 *
 * The aggregate is a plain object with no persistence annotations. Callers load it, hand it
 * to the engine components and persist whatever came back. The mutating methods are meant
 * for the engine only (schedule builder, ledger engine, commission calculator, lifecycle);
 * each one checks its own precondition so the aggregate cannot be driven into an
 * inconsistent state.
 *
 * Key invariants:
 * - {@code downpayment + equity + loanable == total}, checked when the draft is created
 * - {@code cumulativePrincipalPaid} always equals the {@code balanceAfter} of the last ledger
 *   entry
 * - A transaction id is in {@code reversedTransactionIds} iff a REVERSAL points at it
 */
@Getter
public class Contract {

    private final UUID id;
    private final ContractTerms terms;
    private final Instant createdAt;

    private ContractStatus status;
    private Money cumulativePrincipalPaid;
    private Money prepaymentCredit;
    private String closureReason;
    private Instant closedAt;
    private Instant activatedAt;
    private Instant completedAt;
    private Instant constructionTriggeredAt;
    private final Long version;

    private final Map<SignatoryRole, Signature> signatures = new EnumMap<>(SignatoryRole.class);
    private final List<ScheduledInstallment> installments = new ArrayList<>();
    private final List<LedgerTransaction> transactions = new ArrayList<>();
    private final List<CommissionRecord> commissions = new ArrayList<>();

    // Lookup indexes over the ledger, rebuilt from the entries on load
    private final Map<UUID, LedgerTransaction> transactionsById = new HashMap<>();
    private final Set<UUID> reversedTransactionIds = new HashSet<>();

    private Contract(UUID id, ContractTerms terms, Instant createdAt, ContractStatus status, Long version) {
        this.id = Objects.requireNonNull(id, "id");
        this.terms = Objects.requireNonNull(terms, "terms");
        this.createdAt = createdAt;
        this.status = Objects.requireNonNull(status, "status");
        this.version = version;
        Money zero = Money.zero(terms.getCurrency());
        this.cumulativePrincipalPaid = zero;
        this.prepaymentCredit = zero;
        for (SignatoryRole role : SignatoryRole.values()) {
            signatures.put(role, Signature.unsigned(role));
        }
    }

    /**
     * Creates a new contract in DRAFT after validating its financial terms.
     *
     * @throws InvalidScheduleException if the component amounts do not add up to the total
     */
    public static Contract draft(UUID id, ContractTerms terms, Instant createdAt) {
        validateTerms(terms);
        return new Contract(id, terms, createdAt, ContractStatus.DRAFT, null);
    }

    /**
     * Rebuilds a contract from stored state. No validation beyond consistency of the ledger
     * indexes: stored state was valid when it was written.
     */
    @Builder(builderMethodName = "restore")
    private static Contract restoreFromState(UUID id, ContractTerms terms, Instant createdAt, ContractStatus status,
                                             Long version, Money cumulativePrincipalPaid, Money prepaymentCredit,
                                             String closureReason, Instant closedAt, Instant activatedAt,
                                             Instant completedAt, Instant constructionTriggeredAt,
                                             List<Signature> signatures,
                                             List<ScheduledInstallment> installments,
                                             List<LedgerTransaction> transactions,
                                             List<CommissionRecord> commissions) {
        Contract contract = new Contract(id, terms, createdAt, status, version);
        if (cumulativePrincipalPaid != null) {
            contract.cumulativePrincipalPaid = cumulativePrincipalPaid;
        }
        if (prepaymentCredit != null) {
            contract.prepaymentCredit = prepaymentCredit;
        }
        contract.closureReason = closureReason;
        contract.closedAt = closedAt;
        contract.activatedAt = activatedAt;
        contract.completedAt = completedAt;
        contract.constructionTriggeredAt = constructionTriggeredAt;
        if (signatures != null) {
            signatures.forEach(signature -> contract.signatures.put(signature.getRole(), signature));
        }
        if (installments != null) {
            installments.stream()
                .sorted(Comparator.comparingInt(ScheduledInstallment::getInstallmentNumber))
                .forEach(contract.installments::add);
        }
        if (transactions != null) {
            // Ledger order is the order entries were appended in, not their timestamps
            transactions.forEach(contract::index);
        }
        if (commissions != null) {
            contract.commissions.addAll(commissions);
        }
        return contract;
    }

    private static void validateTerms(ContractTerms terms) {
        Objects.requireNonNull(terms.getContractType(), "contractType");
        Objects.requireNonNull(terms.getClientId(), "clientId");
        Objects.requireNonNull(terms.getDeveloperId(), "developerId");
        Objects.requireNonNull(terms.getTotalAmount(), "totalAmount");
        Objects.requireNonNull(terms.getDownpaymentAmount(), "downpaymentAmount");
        Objects.requireNonNull(terms.getStartDate(), "startDate");

        if (!terms.getTotalAmount().isPositive()) {
            throw new InvalidScheduleException("Total amount must be positive: " + terms.getTotalAmount());
        }
        // add() rejects mixed currencies before the sum is compared
        Money components = terms.getDownpaymentAmount()
            .add(terms.equityOrZero())
            .add(terms.loanableOrZero());
        if (components.compareTo(terms.getTotalAmount()) != 0) {
            throw new InvalidScheduleException(String.format(
                "Downpayment, equity and loanable amounts add up to %s but the total is %s",
                components, terms.getTotalAmount()));
        }
        for (Money part : List.of(terms.getDownpaymentAmount(), terms.equityOrZero(), terms.loanableOrZero(),
            terms.reservationFeeOrZero())) {
            if (part.isNegative()) {
                throw new InvalidScheduleException("Contract amounts must not be negative: " + part);
            }
        }
        if (terms.reservationFeeOrZero().isGreaterThan(terms.getDownpaymentAmount())) {
            throw new InvalidScheduleException(String.format(
                "Reservation fee %s exceeds the downpayment %s it is deducted from",
                terms.reservationFeeOrZero(), terms.getDownpaymentAmount()));
        }
        if (terms.getEndDate() != null && terms.getEndDate().isBefore(terms.getStartDate())) {
            throw new InvalidScheduleException("End date " + terms.getEndDate() + " is before start date "
                + terms.getStartDate());
        }
        for (BigDecimal rate : new BigDecimal[]{terms.getAgentCommissionRate(), terms.getBrokerCommissionRate()}) {
            if (rate != null && rate.signum() < 0) {
                throw new IllegalArgumentException("Commission rates must not be negative: " + rate);
            }
        }
    }

    // ==================== Queries ====================

    public CurrencyCode getCurrency() {
        return terms.getCurrency();
    }

    public Money getTotalAmount() {
        return terms.getTotalAmount();
    }

    public boolean hasSchedule() {
        return !installments.isEmpty();
    }

    public List<ScheduledInstallment> getInstallments() {
        return Collections.unmodifiableList(installments);
    }

    public List<LedgerTransaction> getTransactions() {
        return Collections.unmodifiableList(transactions);
    }

    public List<CommissionRecord> getCommissions() {
        return Collections.unmodifiableList(commissions);
    }

    public Map<SignatoryRole, Signature> getSignatures() {
        return Collections.unmodifiableMap(signatures);
    }

    public Signature getSignature(SignatoryRole role) {
        return signatures.get(role);
    }

    /**
     * Client and landlord always; the agent only when one is assigned.
     */
    public Set<SignatoryRole> requiredSignatories() {
        Set<SignatoryRole> required = EnumSet.of(SignatoryRole.CLIENT, SignatoryRole.LANDLORD);
        if (terms.hasAgent()) {
            required.add(SignatoryRole.AGENT);
        }
        return required;
    }

    public boolean isFullySigned() {
        return requiredSignatories().stream().allMatch(role -> signatures.get(role).isSigned());
    }

    public Optional<LedgerTransaction> findTransaction(UUID transactionId) {
        return Optional.ofNullable(transactionsById.get(transactionId));
    }

    public boolean isReversed(UUID transactionId) {
        return reversedTransactionIds.contains(transactionId);
    }

    public Optional<ScheduledInstallment> findInstallment(int installmentNumber) {
        return installments.stream()
            .filter(installment -> installment.getInstallmentNumber() == installmentNumber)
            .findFirst();
    }

    public Optional<CommissionRecord> findCommission(UUID commissionRecordId) {
        return commissions.stream()
            .filter(record -> record.getId().equals(commissionRecordId))
            .findFirst();
    }

    /**
     * Installments still owing principal or penalty, oldest due date first.
     */
    public List<ScheduledInstallment> openInstallments() {
        return installments.stream()
            .filter(installment -> !installment.isSettled())
            .sorted(Comparator.comparing(ScheduledInstallment::getDueDate)
                .thenComparingInt(ScheduledInstallment::getInstallmentNumber))
            .toList();
    }

    public Money outstandingPrincipal() {
        return getTotalAmount().subtract(cumulativePrincipalPaid);
    }

    public boolean isPaidInFull() {
        return cumulativePrincipalPaid.compareTo(getTotalAmount()) == 0;
    }

    // ==================== Engine mutators ====================

    /**
     * Replaces the payment plan. Only legal while the contract is a DRAFT with no ledger entries.
     */
    public void attachSchedule(List<ScheduledInstallment> schedule) {
        if (status != ContractStatus.DRAFT) {
            throw new IllegalStateException("Schedule can only be attached to a DRAFT contract, not " + status);
        }
        if (!transactions.isEmpty()) {
            throw new IllegalStateException("Contract " + id + " already has ledger entries");
        }
        installments.clear();
        installments.addAll(schedule);
    }

    /**
     * Appends a ledger entry and moves the balance to its {@code balanceAfter}.
     */
    public void appendTransaction(LedgerTransaction transaction) {
        if (!transaction.getContractId().equals(id)) {
            throw new IllegalArgumentException("Transaction " + transaction.getId() + " belongs to another contract");
        }
        if (transaction.getBalanceBefore().compareTo(cumulativePrincipalPaid) != 0) {
            throw new IllegalStateException(String.format(
                "Transaction %s starts from balance %s but the contract balance is %s",
                transaction.getId(), transaction.getBalanceBefore(), cumulativePrincipalPaid));
        }
        index(transaction);
    }

    private void index(LedgerTransaction transaction) {
        transactions.add(transaction);
        transactionsById.put(transaction.getId(), transaction);
        if (transaction.isReversal()) {
            reversedTransactionIds.add(transaction.getReversedTransactionId());
        }
        cumulativePrincipalPaid = transaction.getBalanceAfter();
    }

    /**
     * Holds the part of a payment that exceeded every open installment. The credit is never
     * applied to later installments and a refund does not touch it; only reversing the payment
     * that created it releases it.
     */
    public void addPrepaymentCredit(Money credit) {
        prepaymentCredit = prepaymentCredit.add(credit);
    }

    public void releasePrepaymentCredit(Money credit) {
        if (credit.isGreaterThan(prepaymentCredit)) {
            throw new IllegalStateException(String.format(
                "Cannot release %s of prepayment credit, only %s held", credit, prepaymentCredit));
        }
        prepaymentCredit = prepaymentCredit.subtract(credit);
    }

    /**
     * Records the first time the balance reached the construction threshold. Later calls
     * keep the original timestamp.
     */
    public boolean markConstructionTriggered(Instant at) {
        if (constructionTriggeredAt != null) {
            return false;
        }
        constructionTriggeredAt = at;
        return true;
    }

    public void addCommissionRecord(CommissionRecord record) {
        commissions.add(record);
    }

    void putSignature(Signature signature) {
        signatures.put(signature.getRole(), signature);
    }

    void moveTo(ContractStatus next, Instant at, String reason) {
        this.status = next;
        switch (next) {
            case ACTIVE -> this.activatedAt = at;
            case COMPLETED -> {
                this.completedAt = at;
                this.closedAt = at;
            }
            case TERMINATED, CANCELLED, EXPIRED -> {
                this.closedAt = at;
                this.closureReason = reason;
            }
            default -> {
                // DRAFT and PENDING_SIGNATURE carry no timestamps
            }
        }
    }
}
