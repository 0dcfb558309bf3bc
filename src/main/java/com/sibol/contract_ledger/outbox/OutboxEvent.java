package com.sibol.contract_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox table to be published.
 *
 * Written in the same database transaction as the contract change it describes, so an
 * event exists if and only if the change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Contract"
    UUID aggregateId;          // contract id, also the Kafka key
    String eventType;          // e.g. "PaymentApplied"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                                     String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
