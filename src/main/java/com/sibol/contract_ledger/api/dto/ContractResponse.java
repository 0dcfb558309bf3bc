package com.sibol.contract_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.contract.ContractStatus;
import com.sibol.contract_ledger.contract.ContractTerms;
import com.sibol.contract_ledger.contract.ContractType;
import com.sibol.contract_ledger.contract.Signature;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Response DTO for a contract: its terms, status and running balance.
 */
@Value
@Builder
public class ContractResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("contract_number")
    String contractNumber;

    @JsonProperty("contract_type")
    ContractType contractType;

    @JsonProperty("status")
    ContractStatus status;

    @JsonProperty("property_id")
    UUID propertyId;

    @JsonProperty("client_id")
    UUID clientId;

    @JsonProperty("developer_id")
    UUID developerId;

    @JsonProperty("agent_id")
    UUID agentId;

    @JsonProperty("broker_id")
    UUID brokerId;

    @JsonProperty("total_amount")
    MoneyDto totalAmount;

    @JsonProperty("reservation_fee")
    MoneyDto reservationFee;

    @JsonProperty("downpayment_amount")
    MoneyDto downpaymentAmount;

    @JsonProperty("equity_amount")
    MoneyDto equityAmount;

    @JsonProperty("loanable_amount")
    MoneyDto loanableAmount;

    @JsonProperty("term_months")
    int termMonths;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("allow_prepayment")
    boolean allowPrepayment;

    @JsonProperty("paid_amount")
    MoneyDto paidAmount;

    @JsonProperty("remaining_balance")
    MoneyDto remainingBalance;

    @JsonProperty("prepayment_credit")
    MoneyDto prepaymentCredit;

    @JsonProperty("payment_progress")
    BigDecimal paymentProgress;

    @JsonProperty("is_fully_signed")
    boolean fullySigned;

    @JsonProperty("signatures")
    List<SignatureView> signatures;

    @JsonProperty("closure_reason")
    String closureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("activated_at")
    Instant activatedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("closed_at")
    Instant closedAt;

    @JsonProperty("version")
    Long version;

    @Value
    public static class SignatureView {
        @JsonProperty("role")
        String role;
        @JsonProperty("signed")
        boolean signed;
        @JsonProperty("signed_at")
        Instant signedAt;
    }

    public static ContractResponse from(Contract contract, BigDecimal paymentProgress) {
        ContractTerms terms = contract.getTerms();
        return ContractResponse.builder()
            .id(contract.getId())
            .contractNumber(terms.getContractNumber())
            .contractType(terms.getContractType())
            .status(contract.getStatus())
            .propertyId(terms.getPropertyId())
            .clientId(terms.getClientId())
            .developerId(terms.getDeveloperId())
            .agentId(terms.getAgentId())
            .brokerId(terms.getBrokerId())
            .totalAmount(MoneyDto.from(terms.getTotalAmount()))
            .reservationFee(MoneyDto.from(terms.getReservationFee()))
            .downpaymentAmount(MoneyDto.from(terms.getDownpaymentAmount()))
            .equityAmount(MoneyDto.from(terms.getEquityAmount()))
            .loanableAmount(MoneyDto.from(terms.getLoanableAmount()))
            .termMonths(terms.getTermMonths())
            .startDate(terms.getStartDate())
            .endDate(terms.getEndDate())
            .allowPrepayment(terms.isAllowPrepayment())
            .paidAmount(MoneyDto.from(contract.getCumulativePrincipalPaid()))
            .remainingBalance(MoneyDto.from(contract.outstandingPrincipal()))
            .prepaymentCredit(MoneyDto.from(contract.getPrepaymentCredit()))
            .paymentProgress(paymentProgress)
            .fullySigned(contract.isFullySigned())
            .signatures(contract.requiredSignatories().stream()
                .map(contract::getSignature)
                .map(ContractResponse::view)
                .collect(Collectors.toList()))
            .closureReason(contract.getClosureReason())
            .createdAt(contract.getCreatedAt())
            .activatedAt(contract.getActivatedAt())
            .completedAt(contract.getCompletedAt())
            .closedAt(contract.getClosedAt())
            .version(contract.getVersion())
            .build();
    }

    private static SignatureView view(Signature signature) {
        return new SignatureView(signature.getRole().name(), signature.isSigned(), signature.getSignedAt());
    }
}
