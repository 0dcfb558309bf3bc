package com.sibol.contract_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sibol.contract_ledger.commission.BeneficiaryRole;
import com.sibol.contract_ledger.commission.CommissionRecord;
import com.sibol.contract_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Commission records of a contract and their total.
 */
@Value
public class CommissionResponse {

    @JsonProperty("records")
    List<Record> records;

    @JsonProperty("total_commission")
    MoneyDto totalCommission;

    @Value
    @Builder
    public static class Record {
        @JsonProperty("id")
        UUID id;
        @JsonProperty("beneficiary_role")
        BeneficiaryRole beneficiaryRole;
        @JsonProperty("rate_percent")
        BigDecimal ratePercent;
        @JsonProperty("base_amount")
        MoneyDto baseAmount;
        @JsonProperty("computed_amount")
        MoneyDto computedAmount;
        @JsonProperty("is_paid")
        boolean paid;
        @JsonProperty("payout_transaction_id")
        UUID payoutTransactionId;
        @JsonProperty("created_at")
        Instant createdAt;
        @JsonProperty("paid_at")
        Instant paidAt;

        public static Record from(CommissionRecord record) {
            return Record.builder()
                .id(record.getId())
                .beneficiaryRole(record.getBeneficiaryRole())
                .ratePercent(record.getRatePercent())
                .baseAmount(MoneyDto.from(record.getBaseAmount()))
                .computedAmount(MoneyDto.from(record.getComputedAmount()))
                .paid(record.isPaid())
                .payoutTransactionId(record.getPayoutTransactionId())
                .createdAt(record.getCreatedAt())
                .paidAt(record.getPaidAt())
                .build();
        }
    }

    public static CommissionResponse from(List<CommissionRecord> records, Money total) {
        return new CommissionResponse(
            records.stream().map(Record::from).collect(Collectors.toList()),
            MoneyDto.from(total));
    }
}
