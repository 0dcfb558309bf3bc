package com.sibol.contract_ledger.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CommissionRecordRepository extends JpaRepository<CommissionRecordEntity, UUID> {

    List<CommissionRecordEntity> findByContractIdOrderByCreatedAtAscIdAsc(UUID contractId);
}
