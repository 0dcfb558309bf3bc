package com.sibol.contract_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sibol.contract_ledger.contract.ContractTerms;
import com.sibol.contract_ledger.contract.ContractType;
import com.sibol.contract_ledger.ledger.LedgerPolicy;
import com.sibol.contract_ledger.money.CurrencyCode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Request DTO for creating a contract. Amounts are decimals in {@code currency}.
 */
@Value
public class CreateContractRequest {

    @NotBlank(message = "Contract number is required")
    @JsonProperty("contract_number")
    String contractNumber;

    @NotNull(message = "Contract type is required")
    @JsonProperty("contract_type")
    ContractType contractType;

    @NotNull(message = "Property ID is required")
    @JsonProperty("property_id")
    UUID propertyId;

    @NotNull(message = "Client ID is required")
    @JsonProperty("client_id")
    UUID clientId;

    @NotNull(message = "Developer ID is required")
    @JsonProperty("developer_id")
    UUID developerId;

    @JsonProperty("agent_id")
    UUID agentId;

    @JsonProperty("broker_id")
    UUID brokerId;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotNull(message = "Total amount is required")
    @DecimalMin(value = "0.01", message = "Total amount must be greater than 0")
    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @DecimalMin(value = "0.00", message = "Reservation fee must not be negative")
    @JsonProperty("reservation_fee")
    BigDecimal reservationFee;

    @NotNull(message = "Downpayment amount is required")
    @DecimalMin(value = "0.00", message = "Downpayment must not be negative")
    @JsonProperty("downpayment_amount")
    BigDecimal downpaymentAmount;

    @DecimalMin(value = "0.00", message = "Equity must not be negative")
    @JsonProperty("equity_amount")
    BigDecimal equityAmount;

    @DecimalMin(value = "0.00", message = "Loanable amount must not be negative")
    @JsonProperty("loanable_amount")
    BigDecimal loanableAmount;

    @JsonProperty("monthly_payment")
    BigDecimal monthlyPayment;

    @Min(value = 1, message = "Downpayment months must be at least 1")
    @JsonProperty("downpayment_months")
    Integer downpaymentMonths;

    @Min(value = 1, message = "Equity months must be at least 1")
    @JsonProperty("equity_months")
    Integer equityMonths;

    @NotNull(message = "Term months is required")
    @Min(value = 1, message = "Term months must be at least 1")
    @JsonProperty("term_months")
    Integer termMonths;

    @NotNull(message = "Start date is required")
    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("agent_commission_rate")
    BigDecimal agentCommissionRate;

    @JsonProperty("broker_commission_rate")
    BigDecimal brokerCommissionRate;

    @JsonProperty("allow_prepayment")
    Boolean allowPrepayment;

    @JsonProperty("construction_trigger_percentage")
    BigDecimal constructionTriggerPercentage;

    @JsonProperty("turnover_readiness_percentage")
    BigDecimal turnoverReadinessPercentage;

    /**
     * Builds the contract terms, filling absent thresholds from the policy defaults.
     */
    public ContractTerms toTerms(LedgerPolicy policy) {
        CurrencyCode code = MoneyDto.currencyCode(currency);
        ContractTerms.ContractTermsBuilder builder = ContractTerms.builder()
            .contractNumber(contractNumber)
            .contractType(contractType)
            .propertyId(propertyId)
            .clientId(clientId)
            .developerId(developerId)
            .agentId(agentId)
            .brokerId(brokerId)
            .totalAmount(MoneyDto.toMoney(totalAmount, code.name()))
            .reservationFee(MoneyDto.toMoney(reservationFee, code.name()))
            .downpaymentAmount(MoneyDto.toMoney(downpaymentAmount, code.name()))
            .equityAmount(MoneyDto.toMoney(equityAmount, code.name()))
            .loanableAmount(MoneyDto.toMoney(loanableAmount, code.name()))
            .monthlyPayment(MoneyDto.toMoney(monthlyPayment, code.name()))
            .termMonths(termMonths)
            .startDate(startDate)
            .endDate(endDate)
            .agentCommissionRate(agentCommissionRate)
            .brokerCommissionRate(brokerCommissionRate)
            .allowPrepayment(Boolean.TRUE.equals(allowPrepayment))
            .constructionTriggerPercentage(constructionTriggerPercentage != null
                ? constructionTriggerPercentage : policy.getDefaultConstructionTriggerPercentage())
            .turnoverReadinessPercentage(turnoverReadinessPercentage != null
                ? turnoverReadinessPercentage : policy.getDefaultTurnoverReadinessPercentage());
        if (downpaymentMonths != null) {
            builder.downpaymentMonths(downpaymentMonths);
        }
        if (equityMonths != null) {
            builder.equityMonths(equityMonths);
        }
        return builder.build();
    }
}
