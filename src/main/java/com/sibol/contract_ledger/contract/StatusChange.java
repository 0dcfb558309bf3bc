package com.sibol.contract_ledger.contract;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A status transition that was applied to a contract.
 */
@Value
public class StatusChange {
    UUID contractId;
    ContractStatus from;
    ContractStatus to;
    Instant at;
    String reason;
}
