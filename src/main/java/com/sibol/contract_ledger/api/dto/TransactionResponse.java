package com.sibol.contract_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sibol.contract_ledger.ledger.Allocation;
import com.sibol.contract_ledger.ledger.LedgerTransaction;
import com.sibol.contract_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Response DTO for a ledger entry.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("contract_id")
    UUID contractId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    MoneyDto amount;

    @JsonProperty("balance_before")
    MoneyDto balanceBefore;

    @JsonProperty("balance_after")
    MoneyDto balanceAfter;

    @JsonProperty("prepayment_credit")
    MoneyDto prepaymentCredit;

    @JsonProperty("reversed_transaction_id")
    UUID reversedTransactionId;

    @JsonProperty("related_transaction_id")
    UUID relatedTransactionId;

    @JsonProperty("external_reference")
    String externalReference;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("allocations")
    List<AllocationView> allocations;

    @JsonProperty("created_at")
    Instant createdAt;

    @Value
    public static class AllocationView {
        @JsonProperty("installment_number")
        int installmentNumber;
        @JsonProperty("principal")
        MoneyDto principal;
        @JsonProperty("penalty")
        MoneyDto penalty;
    }

    public static TransactionResponse from(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .contractId(transaction.getContractId())
            .type(transaction.getType())
            .amount(MoneyDto.from(transaction.getAmount()))
            .balanceBefore(MoneyDto.from(transaction.getBalanceBefore()))
            .balanceAfter(MoneyDto.from(transaction.getBalanceAfter()))
            .prepaymentCredit(MoneyDto.from(transaction.getPrepaymentCredit()))
            .reversedTransactionId(transaction.getReversedTransactionId())
            .relatedTransactionId(transaction.getRelatedTransactionId())
            .externalReference(transaction.getExternalReference())
            .reason(transaction.getReason())
            .allocations(transaction.getAllocations().stream()
                .map(TransactionResponse::view)
                .collect(Collectors.toList()))
            .createdAt(transaction.getCreatedAt())
            .build();
    }

    private static AllocationView view(Allocation allocation) {
        return new AllocationView(allocation.getInstallmentNumber(),
            MoneyDto.from(allocation.getPrincipal()), MoneyDto.from(allocation.getPenalty()));
    }
}
