package com.sibol.contract_ledger.commission;

import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.contract.ContractTerms;
import com.sibol.contract_ledger.exception.CommissionRecordNotFoundException;
import com.sibol.contract_ledger.exception.LedgerConfigurationException;
import com.sibol.contract_ledger.ledger.LedgerPolicy;
import com.sibol.contract_ledger.money.Money;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Computes agent and broker commission from recognized principal.
 *
 * Commission is earned on principal only; penalty portions of a payment never reach this
 * class. Each recognition adds {@code principal × rate / 100} (HALF_UP) to the open record of
 * the role. A reversal or refund passes the negated principal, which takes back exactly the
 * amount the same principal earned.
 */
public class CommissionCalculator {

    private final LedgerPolicy policy;

    public CommissionCalculator(LedgerPolicy policy) {
        this.policy = policy;
    }

    /**
     * Rate per beneficiary present on the contract: the contract's own rate, else the policy
     * default.
     *
     * @throws LedgerConfigurationException when a beneficiary has neither
     */
    public Map<BeneficiaryRole, BigDecimal> resolveRates(Contract contract) {
        ContractTerms terms = contract.getTerms();
        Map<BeneficiaryRole, BigDecimal> rates = new EnumMap<>(BeneficiaryRole.class);
        if (terms.hasAgent()) {
            rates.put(BeneficiaryRole.AGENT, rateFor(contract.getId(), BeneficiaryRole.AGENT,
                terms.getAgentCommissionRate(), policy.getDefaultAgentCommissionRate()));
        }
        if (terms.hasBroker()) {
            rates.put(BeneficiaryRole.BROKER, rateFor(contract.getId(), BeneficiaryRole.BROKER,
                terms.getBrokerCommissionRate(), policy.getDefaultBrokerCommissionRate()));
        }
        return rates;
    }

    private BigDecimal rateFor(UUID contractId, BeneficiaryRole role, BigDecimal contractRate, BigDecimal defaultRate) {
        if (contractRate != null) {
            return contractRate;
        }
        if (defaultRate != null) {
            return defaultRate;
        }
        throw new LedgerConfigurationException(String.format(
            "No %s commission rate on contract %s and no default configured", role, contractId));
    }

    /**
     * Books commission on {@code principal}, negative for clawbacks. Beneficiaries with a zero
     * rate get nothing and no record.
     */
    public List<CommissionDelta> onPaymentRecognized(Contract contract, Money principal, Instant at) {
        if (principal.isZero()) {
            return Collections.emptyList();
        }
        List<CommissionDelta> deltas = new ArrayList<>();
        for (Map.Entry<BeneficiaryRole, BigDecimal> entry : resolveRates(contract).entrySet()) {
            BigDecimal rate = entry.getValue();
            if (rate.signum() == 0) {
                continue;
            }
            Money commission = principal.multiplyByPercent(rate);
            CommissionRecord record = openRecord(contract, entry.getKey(), rate, at);
            record.accumulate(principal, commission);
            deltas.add(new CommissionDelta(record.getId(), entry.getKey(), rate, principal, commission));
        }
        return deltas;
    }

    /**
     * Freezes a record against the payout transaction that settled it.
     *
     * @throws CommissionRecordNotFoundException when the record is not on this contract
     * @throws com.sibol.contract_ledger.exception.AlreadyPaidException when it was already paid
     */
    public CommissionRecord markPaid(Contract contract, UUID commissionRecordId, UUID payoutTransactionId, Instant at) {
        CommissionRecord record = contract.findCommission(commissionRecordId)
            .orElseThrow(() -> new CommissionRecordNotFoundException(contract.getId(), commissionRecordId));
        record.markPaid(payoutTransactionId, at);
        return record;
    }

    public Money totalCommission(Contract contract) {
        return contract.getCommissions().stream()
            .map(CommissionRecord::getComputedAmount)
            .reduce(Money.zero(contract.getCurrency()), Money::add);
    }

    public Money totalCommission(Contract contract, BeneficiaryRole role) {
        return contract.getCommissions().stream()
            .filter(record -> record.getBeneficiaryRole() == role)
            .map(CommissionRecord::getComputedAmount)
            .reduce(Money.zero(contract.getCurrency()), Money::add);
    }

    private CommissionRecord openRecord(Contract contract, BeneficiaryRole role, BigDecimal rate, Instant at) {
        return contract.getCommissions().stream()
            .filter(record -> record.getBeneficiaryRole() == role)
            .filter(record -> !record.isPaid())
            .filter(record -> record.getRatePercent().compareTo(rate) == 0)
            .findFirst()
            .orElseGet(() -> {
                CommissionRecord created = CommissionRecord.open(
                    contract.getId(), role, rate, Money.zero(contract.getCurrency()), at);
                contract.addCommissionRecord(created);
                return created;
            });
    }
}
