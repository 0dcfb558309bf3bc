package com.sibol.contract_ledger.service;

import com.sibol.contract_ledger.ledger.LedgerTransaction;
import com.sibol.contract_ledger.persistence.ContractPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Recognizes payments that were already booked, by contract and external reference.
 *
 * Redis is the fast path and may be missing or down; the ledger table is the source of
 * truth, so a Redis failure only costs a database lookup.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "contract-ledger:payment-ref:";

    private final ContractPersistenceService persistenceService;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public IdempotencyService(ContractPersistenceService persistenceService,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${ledger.idempotency.ttl:P7D}") Duration ttl) {
        this.persistenceService = persistenceService;
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    /**
     * Id of the PAYMENT transaction already booked for this reference, if any.
     */
    public Optional<UUID> findBookedPayment(UUID contractId, String externalReference) {
        requireReference(externalReference);
        String key = redisKey(contractId, externalReference);

        if (redisTemplate.isPresent()) {
            try {
                String transactionId = redisTemplate.get().opsForValue().get(key);
                if (transactionId != null) {
                    log.debug("External reference {} found in Redis", externalReference);
                    return Optional.of(UUID.fromString(transactionId));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for external reference {}, falling back to database: {}",
                    externalReference, e.getMessage());
            }
        }

        Optional<UUID> booked = persistenceService.findPaymentByExternalReference(contractId, externalReference)
            .map(LedgerTransaction::getId);
        booked.ifPresent(transactionId -> {
            log.debug("External reference {} found in database", externalReference);
            cache(key, transactionId);
        });
        return booked;
    }

    /**
     * Caches a freshly booked reference once the surrounding transaction commits. The ledger
     * row written in that transaction is what makes the reference stick.
     */
    public void remember(UUID contractId, String externalReference, UUID transactionId) {
        requireReference(externalReference);
        String key = redisKey(contractId, externalReference);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(key, transactionId);
                }
            });
        } else {
            cache(key, transactionId);
        }
    }

    private void cache(String key, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(key, transactionId.toString(), ttl);
        } catch (RuntimeException e) {
            log.warn("Failed to cache {} in Redis: {}", key, e.getMessage());
        }
    }

    private static String redisKey(UUID contractId, String externalReference) {
        return REDIS_KEY_PREFIX + contractId + ":" + externalReference;
    }

    private static void requireReference(String externalReference) {
        if (externalReference == null || externalReference.isBlank()) {
            throw new IllegalArgumentException("External reference cannot be null or blank");
        }
    }
}
