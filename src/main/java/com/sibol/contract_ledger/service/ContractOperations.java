package com.sibol.contract_ledger.service;

import com.sibol.contract_ledger.exception.LedgerException;
import com.sibol.contract_ledger.observability.CorrelationContext;
import com.sibol.contract_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Wraps a contract operation with the contract id in the MDC, a duration timer and logging
 * of rejections. Business rejections are logged at WARN, anything else at ERROR; both are
 * rethrown unchanged so the surrounding transaction rolls back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class ContractOperations {

    private final LedgerMetrics metrics;

    <T> T execute(String operation, UUID contractId, Supplier<T> action) {
        CorrelationContext.putContractId(contractId);
        try {
            return metrics.time(operation, action);
        } catch (LedgerException | IllegalArgumentException | IllegalStateException e) {
            metrics.recordRejected(operation, e);
            log.warn("{} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("{} failed: {}", operation, e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.removeContractId();
        }
    }
}
