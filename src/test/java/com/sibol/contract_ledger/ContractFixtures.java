package com.sibol.contract_ledger;

import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.contract.ContractLifecycle;
import com.sibol.contract_ledger.contract.ContractTerms;
import com.sibol.contract_ledger.contract.ContractType;
import com.sibol.contract_ledger.contract.SignatoryRole;
import com.sibol.contract_ledger.ledger.LedgerPolicy;
import com.sibol.contract_ledger.money.CurrencyCode;
import com.sibol.contract_ledger.money.Money;
import com.sibol.contract_ledger.schedule.PaymentScheduleBuilder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Contracts in the states the ledger tests start from.
 */
public final class ContractFixtures {

    public static final Instant CREATED_AT = Instant.parse("2024-01-01T00:00:00Z");
    public static final LocalDate START = LocalDate.of(2024, 1, 1);

    private ContractFixtures() {
    }

    public static Money php(String amount) {
        return Money.of(amount, CurrencyCode.PHP);
    }

    public static LedgerPolicy policy() {
        return LedgerPolicy.builder()
            .penaltyRatePercent(new BigDecimal("1.00"))
            .build();
    }

    /**
     * Received at noon Manila time on {@code date}.
     */
    public static Instant manilaNoon(LocalDate date) {
        return date.atTime(12, 0).toInstant(ZoneOffset.ofHours(8));
    }

    /**
     * 80,000.00 PHP paid as two 40,000.00 downpayment installments due 2024-02-01 and
     * 2024-03-01. No agent or broker.
     */
    public static ContractTerms.ContractTermsBuilder twoInstallmentTerms() {
        return ContractTerms.builder()
            .contractNumber("CN-" + UUID.randomUUID().toString().substring(0, 8))
            .contractType(ContractType.PURCHASE_AGREEMENT)
            .propertyId(UUID.randomUUID())
            .clientId(UUID.randomUUID())
            .developerId(UUID.randomUUID())
            .totalAmount(php("80000.00"))
            .downpaymentAmount(php("80000.00"))
            .downpaymentMonths(2)
            .termMonths(1)
            .startDate(START);
    }

    /**
     * Scenario A: 1,000,000.00 PHP, 20% downpayment over 12 months, 20% equity, 60% loanable
     * over 24 months.
     */
    public static ContractTerms.ContractTermsBuilder millionPesoTerms() {
        return ContractTerms.builder()
            .contractNumber("CN-" + UUID.randomUUID().toString().substring(0, 8))
            .contractType(ContractType.PURCHASE_AGREEMENT)
            .propertyId(UUID.randomUUID())
            .clientId(UUID.randomUUID())
            .developerId(UUID.randomUUID())
            .totalAmount(php("1000000.00"))
            .downpaymentAmount(php("200000.00"))
            .equityAmount(php("200000.00"))
            .loanableAmount(php("600000.00"))
            .downpaymentMonths(12)
            .equityMonths(1)
            .termMonths(24)
            .startDate(START)
            .endDate(START.plusMonths(37));
    }

    public static Contract draft(ContractTerms terms) {
        return Contract.draft(UUID.randomUUID(), terms, CREATED_AT);
    }

    public static Contract scheduled(ContractTerms terms) {
        Contract contract = draft(terms);
        contract.attachSchedule(new PaymentScheduleBuilder().build(contract));
        return contract;
    }

    public static Contract pendingSignature(ContractTerms terms) {
        Contract contract = scheduled(terms);
        new ContractLifecycle().submitForSignature(contract, CREATED_AT);
        return contract;
    }

    public static Contract active(ContractTerms terms) {
        Contract contract = pendingSignature(terms);
        ContractLifecycle lifecycle = new ContractLifecycle();
        for (SignatoryRole role : contract.requiredSignatories()) {
            lifecycle.sign(contract, role, "signed-by-" + role, CREATED_AT);
        }
        return contract;
    }
}
