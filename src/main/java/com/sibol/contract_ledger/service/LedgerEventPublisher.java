package com.sibol.contract_ledger.service;

import com.sibol.contract_ledger.construction.ConstructionReadiness;
import com.sibol.contract_ledger.construction.ConstructionTrigger;
import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.contract.StatusChange;
import com.sibol.contract_ledger.event.ConstructionThresholdReachedEvent;
import com.sibol.contract_ledger.event.ContractStatusChangedEvent;
import com.sibol.contract_ledger.observability.LedgerMetrics;
import com.sibol.contract_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Turns the side effects every service operation shares (status transitions, the first
 * crossing of the construction threshold) into outbox events and metrics.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class LedgerEventPublisher {

    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final ConstructionTrigger constructionTrigger;

    void statusChanged(List<StatusChange> changes) {
        for (StatusChange change : changes) {
            outboxService.saveEvent(ContractStatusChangedEvent.from(change));
            metrics.recordStatusChange(change.getTo().name());
            log.info("Contract status changed: {} -> {}{}", change.getFrom(), change.getTo(),
                change.getReason() != null ? " (" + change.getReason() + ")" : "");
        }
    }

    void statusChanged(StatusChange change) {
        statusChanged(List.of(change));
    }

    /**
     * Publishes {@code ConstructionThresholdReached} when the balance reaches the threshold
     * for the first time in the contract's life.
     */
    void checkConstructionThreshold(Contract contract, Instant now) {
        ConstructionReadiness readiness = constructionTrigger.evaluate(contract);
        if (readiness.isCanStartConstruction() && contract.markConstructionTriggered(now)) {
            outboxService.saveEvent(ConstructionThresholdReachedEvent.from(
                readiness, contract.getTerms().getPropertyId(), now));
            log.info("Construction threshold reached: paid={} threshold={} progress={}%",
                readiness.getPaidAmount(), readiness.getConstructionThreshold(), readiness.getProgressPercentage());
        }
    }
}
