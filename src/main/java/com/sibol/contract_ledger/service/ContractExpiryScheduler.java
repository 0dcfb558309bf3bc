package com.sibol.contract_ledger.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Moves ACTIVE contracts past their end date to EXPIRED.
 *
 * Each contract is expired in its own transaction, so one failure does not hold back the rest
 * of the sweep.
 */
@Component
@ConditionalOnProperty(name = "ledger.expiry.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ContractExpiryScheduler {

    private final ContractService contractService;

    @Scheduled(cron = "${ledger.expiry.cron:0 15 0 * * *}", zone = "${ledger.policy.zone:Asia/Manila}")
    public void expireOverdueContracts() {
        LocalDate today = contractService.today();
        List<UUID> candidates = contractService.findExpiryCandidates(today);
        if (candidates.isEmpty()) {
            return;
        }
        int expired = 0;
        for (UUID contractId : candidates) {
            try {
                if (contractService.expireIfDue(contractId, today)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to expire contract {}: {}", contractId, e.getMessage());
            }
        }
        log.info("Expiry sweep for {}: {} of {} candidates expired", today, expired, candidates.size());
    }
}
