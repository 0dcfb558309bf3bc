package com.sibol.contract_ledger.persistence;

import com.sibol.contract_ledger.ledger.Allocation;
import com.sibol.contract_ledger.ledger.LedgerTransaction;
import com.sibol.contract_ledger.ledger.TransactionType;
import com.sibol.contract_ledger.money.CurrencyCode;
import com.sibol.contract_ledger.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only ledger row. Hibernate never issues an UPDATE for it.
 *
 * {@code sequenceNumber} is the entry's position in the contract's ledger; allocations are
 * stored as a JSON array written by {@link ContractPersistenceService}.
 */
@Entity
@Immutable
@Table(
    name = "ledger_transactions",
    indexes = {
        @Index(name = "idx_ledger_transactions_contract_seq", columnList = "contract_id, sequence_number", unique = true)
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private UUID contractId;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private int sequenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private TransactionType type;

    @Column(name = "amount_minor", nullable = false, updatable = false)
    private long amountMinor;

    @Column(name = "balance_before_minor", nullable = false, updatable = false)
    private long balanceBeforeMinor;

    @Column(name = "balance_after_minor", nullable = false, updatable = false)
    private long balanceAfterMinor;

    @Column(name = "reversed_transaction_id", updatable = false)
    private UUID reversedTransactionId;

    @Column(name = "related_transaction_id", updatable = false)
    private UUID relatedTransactionId;

    @Column(name = "external_reference", updatable = false)
    private String externalReference;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(name = "prepayment_credit_minor", updatable = false)
    private Long prepaymentCreditMinor;

    @Column(name = "allocations", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String allocations;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static LedgerTransactionEntity fromDomain(LedgerTransaction transaction, int sequenceNumber, String allocationsJson) {
        LedgerTransactionEntity entity = new LedgerTransactionEntity();
        entity.id = transaction.getId();
        entity.contractId = transaction.getContractId();
        entity.sequenceNumber = sequenceNumber;
        entity.type = transaction.getType();
        entity.amountMinor = transaction.getAmount().getAmountMinor();
        entity.balanceBeforeMinor = transaction.getBalanceBefore().getAmountMinor();
        entity.balanceAfterMinor = transaction.getBalanceAfter().getAmountMinor();
        entity.reversedTransactionId = transaction.getReversedTransactionId();
        entity.relatedTransactionId = transaction.getRelatedTransactionId();
        entity.externalReference = transaction.getExternalReference();
        entity.reason = transaction.getReason();
        entity.prepaymentCreditMinor = transaction.getPrepaymentCredit() != null
            ? transaction.getPrepaymentCredit().getAmountMinor()
            : null;
        entity.allocations = allocationsJson;
        entity.createdAt = transaction.getCreatedAt();
        return entity;
    }

    LedgerTransaction toDomain(CurrencyCode currency, List<Allocation> allocations) {
        return LedgerTransaction.builder()
            .id(id)
            .contractId(contractId)
            .type(type)
            .amount(Money.ofMinor(amountMinor, currency))
            .balanceBefore(Money.ofMinor(balanceBeforeMinor, currency))
            .balanceAfter(Money.ofMinor(balanceAfterMinor, currency))
            .reversedTransactionId(reversedTransactionId)
            .relatedTransactionId(relatedTransactionId)
            .externalReference(externalReference)
            .reason(reason)
            .prepaymentCredit(prepaymentCreditMinor != null ? Money.ofMinor(prepaymentCreditMinor, currency) : null)
            .allocations(allocations)
            .createdAt(createdAt)
            .build();
    }
}
