package com.sibol.contract_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sibol.contract_ledger.schedule.PaymentType;
import com.sibol.contract_ledger.schedule.ScheduledInstallment;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class InstallmentResponse {

    @JsonProperty("installment_number")
    int installmentNumber;

    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("amount")
    MoneyDto amount;

    @JsonProperty("paid_amount")
    MoneyDto paidAmount;

    @JsonProperty("paid_date")
    LocalDate paidDate;

    @JsonProperty("is_overdue")
    boolean overdue;

    @JsonProperty("penalty_amount")
    MoneyDto penaltyAmount;

    @JsonProperty("penalty_paid")
    MoneyDto penaltyPaid;

    @JsonProperty("is_settled")
    boolean settled;

    public static InstallmentResponse from(ScheduledInstallment installment) {
        return InstallmentResponse.builder()
            .installmentNumber(installment.getInstallmentNumber())
            .paymentType(installment.getPaymentType())
            .dueDate(installment.getDueDate())
            .amount(MoneyDto.from(installment.getAmount()))
            .paidAmount(MoneyDto.from(installment.getPaidAmount()))
            .paidDate(installment.getPaidDate())
            .overdue(installment.isOverdue())
            .penaltyAmount(MoneyDto.from(installment.getPenaltyAmount()))
            .penaltyPaid(MoneyDto.from(installment.getPenaltyPaid()))
            .settled(installment.isSettled())
            .build();
    }
}
