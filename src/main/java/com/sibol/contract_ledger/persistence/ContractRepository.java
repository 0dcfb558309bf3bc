package com.sibol.contract_ledger.persistence;

import com.sibol.contract_ledger.contract.ContractStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContractRepository extends JpaRepository<ContractEntity, UUID> {

    /**
     * Loads the row with {@code SELECT ... FOR UPDATE}. Every write path goes through this, so
     * writers of the same contract queue on the row even across service instances.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ContractEntity c WHERE c.id = :id")
    Optional<ContractEntity> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByContractNumber(String contractNumber);

    @Query("""
        SELECT c.id FROM ContractEntity c
        WHERE c.status = :status AND c.endDate IS NOT NULL AND c.endDate < :date
        ORDER BY c.endDate ASC
        """)
    List<UUID> findIdsByStatusAndEndDateBefore(@Param("status") ContractStatus status,
                                              @Param("date") LocalDate date);
}
