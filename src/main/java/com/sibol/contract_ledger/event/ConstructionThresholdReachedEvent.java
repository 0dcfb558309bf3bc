package com.sibol.contract_ledger.event;

import com.sibol.contract_ledger.construction.ConstructionReadiness;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Cumulative principal paid reached the construction threshold for the first time.
 * Published at most once per contract, even if a reversal later drops the balance back
 * below the threshold.
 */
@Value
public class ConstructionThresholdReachedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "ConstructionThresholdReached";

    UUID eventId;
    UUID contractId;
    UUID propertyId;
    long paidMinor;
    long thresholdMinor;
    BigDecimal progressPercentage;
    String currency;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ConstructionThresholdReachedEvent from(ConstructionReadiness readiness, UUID propertyId,
                                                         Instant occurredAt) {
        return new ConstructionThresholdReachedEvent(
            UUID.randomUUID(),
            readiness.getContractId(),
            propertyId,
            readiness.getPaidAmount().getAmountMinor(),
            readiness.getConstructionThreshold().getAmountMinor(),
            readiness.getProgressPercentage(),
            readiness.getTotalAmount().getCurrency().name(),
            occurredAt
        );
    }
}
