package com.sibol.contract_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sibol.contract_ledger.construction.ConstructionReadiness;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ConstructionResponse {

    @JsonProperty("contract_id")
    UUID contractId;

    @JsonProperty("total_amount")
    MoneyDto totalAmount;

    @JsonProperty("paid_amount")
    MoneyDto paidAmount;

    @JsonProperty("remaining_balance")
    MoneyDto remainingBalance;

    @JsonProperty("progress_percentage")
    BigDecimal progressPercentage;

    @JsonProperty("construction_threshold")
    MoneyDto constructionThreshold;

    @JsonProperty("turnover_threshold")
    MoneyDto turnoverThreshold;

    @JsonProperty("can_start_construction")
    boolean canStartConstruction;

    @JsonProperty("is_turnover_ready")
    boolean turnoverReady;

    public static ConstructionResponse from(ConstructionReadiness readiness) {
        return ConstructionResponse.builder()
            .contractId(readiness.getContractId())
            .totalAmount(MoneyDto.from(readiness.getTotalAmount()))
            .paidAmount(MoneyDto.from(readiness.getPaidAmount()))
            .remainingBalance(MoneyDto.from(readiness.getRemainingBalance()))
            .progressPercentage(readiness.getProgressPercentage())
            .constructionThreshold(MoneyDto.from(readiness.getConstructionThreshold()))
            .turnoverThreshold(MoneyDto.from(readiness.getTurnoverThreshold()))
            .canStartConstruction(readiness.isCanStartConstruction())
            .turnoverReady(readiness.isTurnoverReady())
            .build();
    }
}
