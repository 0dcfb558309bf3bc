package com.sibol.contract_ledger.contract;

import com.sibol.contract_ledger.money.CurrencyCode;
import com.sibol.contract_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * The negotiated, immutable financial and party terms of a contract.
 *
 * The reservation fee is part of the downpayment: the schedule deducts it from the
 * downpayment installments, so {@code downpayment + equity + loanable == total} holds with
 * or without a reservation fee.
 */
@Value
@Builder(toBuilder = true)
public class ContractTerms {
    String contractNumber;
    ContractType contractType;
    UUID propertyId;
    UUID clientId;
    UUID developerId;
    UUID agentId;
    UUID brokerId;

    Money totalAmount;
    Money reservationFee;
    Money downpaymentAmount;
    Money equityAmount;
    Money loanableAmount;
    /**
     * Informational only. Stored and returned as negotiated; the schedule derives its
     * installment amounts from the downpayment, equity and terms and never reads this.
     */
    Money monthlyPayment;

    @Builder.Default
    int downpaymentMonths = 12;
    @Builder.Default
    int equityMonths = 1;
    int termMonths;

    LocalDate startDate;
    LocalDate endDate;

    // Percentages, null means "use the policy default"
    BigDecimal agentCommissionRate;
    BigDecimal brokerCommissionRate;

    boolean allowPrepayment;

    @Builder.Default
    BigDecimal constructionTriggerPercentage = new BigDecimal("50.00");
    @Builder.Default
    BigDecimal turnoverReadinessPercentage = new BigDecimal("85.00");

    public CurrencyCode getCurrency() {
        return totalAmount.getCurrency();
    }

    public boolean hasAgent() {
        return agentId != null;
    }

    public boolean hasBroker() {
        return brokerId != null;
    }

    /**
     * Reservation fee, or zero when the contract has none.
     */
    public Money reservationFeeOrZero() {
        return reservationFee != null ? reservationFee : Money.zero(getCurrency());
    }

    public Money equityOrZero() {
        return equityAmount != null ? equityAmount : Money.zero(getCurrency());
    }

    public Money loanableOrZero() {
        return loanableAmount != null ? loanableAmount : Money.zero(getCurrency());
    }
}
