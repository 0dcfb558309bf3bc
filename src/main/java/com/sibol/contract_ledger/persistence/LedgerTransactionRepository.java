package com.sibol.contract_ledger.persistence;

import com.sibol.contract_ledger.ledger.TransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransactionEntity, UUID> {

    List<LedgerTransactionEntity> findByContractIdOrderBySequenceNumberAsc(UUID contractId);

    long countByContractId(UUID contractId);

    /**
     * The PAYMENT booked for an external reference on a contract. Backed by a partial unique
     * index, so there is at most one.
     */
    Optional<LedgerTransactionEntity> findByContractIdAndExternalReferenceAndType(
        UUID contractId, String externalReference, TransactionType type);
}
