package com.sibol.contract_ledger.service;

import com.sibol.contract_ledger.construction.ConstructionReadiness;
import com.sibol.contract_ledger.construction.ConstructionTrigger;
import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.contract.ContractLifecycle;
import com.sibol.contract_ledger.contract.ContractTerms;
import com.sibol.contract_ledger.contract.SignatoryRole;
import com.sibol.contract_ledger.contract.StatusChange;
import com.sibol.contract_ledger.exception.DuplicateContractNumberException;
import com.sibol.contract_ledger.ledger.LedgerPolicy;
import com.sibol.contract_ledger.persistence.ContractPersistenceService;
import com.sibol.contract_ledger.schedule.PaymentScheduleBuilder;
import com.sibol.contract_ledger.schedule.ScheduledInstallment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Contract creation, scheduling and lifecycle operations.
 *
 * Every write follows the same shape: lock the contract row, rebuild the aggregate, let the
 * engine change it, persist it and write the resulting events to the outbox, all in one
 * transaction. A rejected operation rolls back and leaves nothing behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractService {

    private final ContractPersistenceService persistenceService;
    private final PaymentScheduleBuilder scheduleBuilder;
    private final ContractLifecycle lifecycle;
    private final ConstructionTrigger constructionTrigger;
    private final LedgerEventPublisher eventPublisher;
    private final ContractOperations operations;
    private final LedgerPolicy policy;
    private final Clock clock;

    /**
     * Creates a DRAFT contract.
     *
     * @throws DuplicateContractNumberException when the contract number is taken
     */
    @Transactional
    public Contract createContract(ContractTerms terms) {
        UUID contractId = UUID.randomUUID();
        return operations.execute("create_contract", contractId, () -> {
            if (terms.getContractNumber() == null || terms.getContractNumber().isBlank()) {
                throw new IllegalArgumentException("Contract number is required");
            }
            if (persistenceService.contractNumberExists(terms.getContractNumber())) {
                throw new DuplicateContractNumberException(terms.getContractNumber());
            }
            Contract contract = Contract.draft(contractId, terms, clock.instant());
            persistenceService.create(contract);
            log.info("Contract created: number={}, type={}, total={}",
                terms.getContractNumber(), terms.getContractType(), terms.getTotalAmount());
            return contract;
        });
    }

    /**
     * Builds the payment schedule from the contract's terms and attaches it. Only legal while
     * the contract is a DRAFT; building again yields the same schedule.
     */
    @Transactional
    public List<ScheduledInstallment> attachSchedule(UUID contractId) {
        return operations.execute("attach_schedule", contractId, () -> {
            Contract contract = persistenceService.loadForUpdate(contractId);
            List<ScheduledInstallment> schedule = scheduleBuilder.build(contract);
            contract.attachSchedule(schedule);
            persistenceService.save(contract);
            log.info("Schedule attached: {} installments", schedule.size());
            return contract.getInstallments();
        });
    }

    @Transactional
    public Contract submitForSignature(UUID contractId) {
        return operations.execute("submit_contract", contractId, () -> {
            Contract contract = persistenceService.loadForUpdate(contractId);
            StatusChange change = lifecycle.submitForSignature(contract, clock.instant());
            persistenceService.save(contract);
            eventPublisher.statusChanged(change);
            return contract;
        });
    }

    /**
     * Records a signature; the last required one activates the contract.
     */
    @Transactional
    public Contract sign(UUID contractId, SignatoryRole role, String payload) {
        return operations.execute("sign_contract", contractId, () -> {
            Contract contract = persistenceService.loadForUpdate(contractId);
            List<StatusChange> changes = lifecycle.sign(contract, role, payload, clock.instant());
            persistenceService.save(contract);
            eventPublisher.statusChanged(changes);
            log.info("Contract signed by {}", role);
            return contract;
        });
    }

    @Transactional
    public Contract cancel(UUID contractId, String reason) {
        return operations.execute("cancel_contract", contractId, () -> {
            Contract contract = persistenceService.loadForUpdate(contractId);
            StatusChange change = lifecycle.cancel(contract, reason, clock.instant());
            persistenceService.save(contract);
            eventPublisher.statusChanged(change);
            return contract;
        });
    }

    @Transactional
    public Contract terminate(UUID contractId, String reason) {
        return operations.execute("terminate_contract", contractId, () -> {
            Contract contract = persistenceService.loadForUpdate(contractId);
            StatusChange change = lifecycle.terminate(contract, reason, clock.instant());
            persistenceService.save(contract);
            eventPublisher.statusChanged(change);
            return contract;
        });
    }

    /**
     * Expires the contract if it is ACTIVE, past its end date and not paid in full. The status
     * is re-read under the row lock, so a payment that completed the contract in the meantime
     * wins.
     *
     * @return whether the contract was expired
     */
    @Transactional
    public boolean expireIfDue(UUID contractId, LocalDate today) {
        return operations.execute("expire_contract", contractId, () -> {
            Contract contract = persistenceService.loadForUpdate(contractId);
            Optional<StatusChange> change = lifecycle.expireIfDue(contract, today, clock.instant());
            if (change.isEmpty()) {
                return false;
            }
            persistenceService.save(contract);
            eventPublisher.statusChanged(change.get());
            return true;
        });
    }

    @Transactional(readOnly = true)
    public List<UUID> findExpiryCandidates(LocalDate today) {
        return persistenceService.findActiveContractsEndedBefore(today);
    }

    @Transactional(readOnly = true)
    public Contract getContract(UUID contractId) {
        return persistenceService.load(contractId);
    }

    @Transactional(readOnly = true)
    public ConstructionReadiness getConstructionReadiness(UUID contractId) {
        return constructionTrigger.evaluate(persistenceService.load(contractId));
    }

    /**
     * Today's date in the ledger's zone.
     */
    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), policy.getZone());
    }

    public Instant now() {
        return clock.instant();
    }
}
