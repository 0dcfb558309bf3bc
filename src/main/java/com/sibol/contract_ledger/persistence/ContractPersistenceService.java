package com.sibol.contract_ledger.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.contract.ContractStatus;
import com.sibol.contract_ledger.contract.Signature;
import com.sibol.contract_ledger.exception.ContractNotFoundException;
import com.sibol.contract_ledger.ledger.Allocation;
import com.sibol.contract_ledger.ledger.LedgerTransaction;
import com.sibol.contract_ledger.ledger.TransactionType;
import com.sibol.contract_ledger.money.CurrencyCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores and rebuilds the contract aggregate across its tables.
 *
 * Writes happen inside the caller's transaction (MANDATORY): the caller loads the contract
 * with {@link #loadForUpdate}, runs the engine, then calls {@link #save}. Ledger rows are
 * append-only; only entries beyond what is already stored are inserted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractPersistenceService {

    private static final TypeReference<List<AllocationRow>> ALLOCATION_LIST = new TypeReference<>() {
    };

    private final ContractRepository contractRepository;
    private final SignatureRepository signatureRepository;
    private final InstallmentRepository installmentRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final CommissionRecordRepository commissionRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void create(Contract contract) {
        contractRepository.save(ContractEntity.fromDomain(contract));
        saveChildren(contract, 0);
        log.debug("Created contract {} ({})", contract.getId(), contract.getTerms().getContractNumber());
    }

    /**
     * Loads the aggregate with its contract row locked until the transaction ends.
     *
     * @throws ContractNotFoundException when there is no such contract
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Contract loadForUpdate(UUID contractId) {
        ContractEntity entity = contractRepository.findByIdForUpdate(contractId)
            .orElseThrow(() -> new ContractNotFoundException(contractId));
        return assemble(entity);
    }

    @Transactional(readOnly = true)
    public Contract load(UUID contractId) {
        ContractEntity entity = contractRepository.findById(contractId)
            .orElseThrow(() -> new ContractNotFoundException(contractId));
        return assemble(entity);
    }

    /**
     * Writes back everything the engine may have changed.
     *
     * @throws ObjectOptimisticLockingFailureException when the row changed since the
     *                                                 aggregate was loaded
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void save(Contract contract) {
        ContractEntity entity = contractRepository.findById(contract.getId())
            .orElseThrow(() -> new ContractNotFoundException(contract.getId()));
        if (!Objects.equals(entity.getVersion(), contract.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(ContractEntity.class, contract.getId());
        }
        entity.updateFromDomain(contract);
        contractRepository.save(entity);

        int stored = (int) transactionRepository.countByContractId(contract.getId());
        saveChildren(contract, stored);
    }

    /**
     * The PAYMENT already booked on a contract for an external reference, if any.
     */
    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findPaymentByExternalReference(UUID contractId, String externalReference) {
        return transactionRepository.findByContractIdAndExternalReferenceAndType(
                contractId, externalReference, TransactionType.PAYMENT)
            .map(entity -> toDomain(entity, currencyOf(contractId)));
    }

    @Transactional(readOnly = true)
    public List<UUID> findActiveContractsEndedBefore(LocalDate date) {
        return contractRepository.findIdsByStatusAndEndDateBefore(
            ContractStatus.ACTIVE, date);
    }

    @Transactional(readOnly = true)
    public boolean contractNumberExists(String contractNumber) {
        return contractRepository.existsByContractNumber(contractNumber);
    }

    private void saveChildren(Contract contract, int storedTransactions) {
        UUID contractId = contract.getId();
        for (Signature signature : contract.getSignatures().values()) {
            signatureRepository.save(SignatureEntity.fromDomain(contractId, signature));
        }
        installmentRepository.saveAll(contract.getInstallments().stream()
            .map(InstallmentEntity::fromDomain)
            .toList());

        List<LedgerTransaction> transactions = contract.getTransactions();
        if (storedTransactions > transactions.size()) {
            throw new IllegalStateException(String.format(
                "Contract %s has %d stored ledger entries but only %d in memory",
                contractId, storedTransactions, transactions.size()));
        }
        for (int sequence = storedTransactions; sequence < transactions.size(); sequence++) {
            LedgerTransaction transaction = transactions.get(sequence);
            transactionRepository.save(LedgerTransactionEntity.fromDomain(
                transaction, sequence, writeAllocations(transaction.getAllocations())));
        }

        commissionRepository.saveAll(contract.getCommissions().stream()
            .map(CommissionRecordEntity::fromDomain)
            .toList());
    }

    private Contract assemble(ContractEntity entity) {
        UUID contractId = entity.getId();
        CurrencyCode currency = entity.getCurrency();
        return Contract.restore()
            .id(contractId)
            .terms(entity.toTerms())
            .createdAt(entity.getCreatedAt())
            .status(entity.getStatus())
            .version(entity.getVersion())
            .cumulativePrincipalPaid(entity.money(entity.getCumulativePrincipalPaidMinor()))
            .prepaymentCredit(entity.money(entity.getPrepaymentCreditMinor()))
            .closureReason(entity.getClosureReason())
            .closedAt(entity.getClosedAt())
            .activatedAt(entity.getActivatedAt())
            .completedAt(entity.getCompletedAt())
            .constructionTriggeredAt(entity.getConstructionTriggeredAt())
            .signatures(signatureRepository.findByContractId(contractId).stream()
                .map(SignatureEntity::toDomain)
                .toList())
            .installments(installmentRepository.findByContractIdOrderByInstallmentNumberAsc(contractId).stream()
                .map(installment -> installment.toDomain(currency))
                .toList())
            .transactions(transactionRepository.findByContractIdOrderBySequenceNumberAsc(contractId).stream()
                .map(transaction -> toDomain(transaction, currency))
                .toList())
            .commissions(commissionRepository.findByContractIdOrderByCreatedAtAscIdAsc(contractId).stream()
                .map(record -> record.toDomain(currency))
                .toList())
            .build();
    }

    private CurrencyCode currencyOf(UUID contractId) {
        return contractRepository.findById(contractId)
            .map(ContractEntity::getCurrency)
            .orElseThrow(() -> new ContractNotFoundException(contractId));
    }

    private LedgerTransaction toDomain(LedgerTransactionEntity entity, CurrencyCode currency) {
        return entity.toDomain(currency, readAllocations(entity.getAllocations(), currency));
    }

    private String writeAllocations(List<Allocation> allocations) {
        try {
            return objectMapper.writeValueAsString(allocations.stream().map(AllocationRow::fromDomain).toList());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize allocations", e);
        }
    }

    private List<Allocation> readAllocations(String json, CurrencyCode currency) {
        try {
            return objectMapper.readValue(json, ALLOCATION_LIST).stream()
                .map(row -> row.toDomain(currency))
                .toList();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored allocations are not readable: " + json, e);
        }
    }
}
