package com.sibol.contract_ledger.commission;

import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.exception.AlreadyPaidException;
import com.sibol.contract_ledger.exception.LedgerConfigurationException;
import com.sibol.contract_ledger.ledger.LedgerPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.sibol.contract_ledger.ContractFixtures.draft;
import static com.sibol.contract_ledger.ContractFixtures.php;
import static com.sibol.contract_ledger.ContractFixtures.policy;
import static com.sibol.contract_ledger.ContractFixtures.twoInstallmentTerms;
import static org.junit.jupiter.api.Assertions.*;

class CommissionCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-02-01T04:00:00Z");

    private static Contract agentAndBrokerContract() {
        return draft(twoInstallmentTerms()
            .agentId(UUID.randomUUID())
            .brokerId(UUID.randomUUID())
            .agentCommissionRate(new BigDecimal("5.00"))
            .brokerCommissionRate(new BigDecimal("2.00"))
            .build());
    }

    @Test
    @DisplayName("5% agent and 2% broker on 100,000.00 principal")
    void testAgentAndBrokerCommission() {
        CommissionCalculator calculator = new CommissionCalculator(policy());
        Contract contract = agentAndBrokerContract();

        List<CommissionDelta> deltas = calculator.onPaymentRecognized(contract, php("100000.00"), NOW);

        assertEquals(2, deltas.size());
        assertEquals(php("5000.00"), calculator.totalCommission(contract, BeneficiaryRole.AGENT));
        assertEquals(php("2000.00"), calculator.totalCommission(contract, BeneficiaryRole.BROKER));
        assertEquals(php("7000.00"), calculator.totalCommission(contract));
    }

    @Test
    @DisplayName("Recognitions accumulate on the open record; clawbacks reduce it")
    void testAccumulateAndClawBack() {
        CommissionCalculator calculator = new CommissionCalculator(policy());
        Contract contract = agentAndBrokerContract();

        calculator.onPaymentRecognized(contract, php("40000.00"), NOW);
        calculator.onPaymentRecognized(contract, php("10000.00"), NOW);
        calculator.onPaymentRecognized(contract, php("-5000.00"), NOW);

        assertEquals(2, contract.getCommissions().size());
        CommissionRecord agent = contract.getCommissions().stream()
            .filter(record -> record.getBeneficiaryRole() == BeneficiaryRole.AGENT)
            .findFirst()
            .orElseThrow();
        assertEquals(php("45000.00"), agent.getBaseAmount());
        assertEquals(php("2250.00"), agent.getComputedAmount());
    }

    @Test
    @DisplayName("Zero principal books nothing")
    void testZeroPrincipal() {
        CommissionCalculator calculator = new CommissionCalculator(policy());
        Contract contract = agentAndBrokerContract();

        assertTrue(calculator.onPaymentRecognized(contract, php("0.00"), NOW).isEmpty());
        assertTrue(contract.getCommissions().isEmpty());
    }

    @Test
    @DisplayName("Policy defaults apply when the contract carries no rate")
    void testPolicyDefaults() {
        LedgerPolicy policy = policy().toBuilder()
            .defaultAgentCommissionRate(new BigDecimal("3.00"))
            .build();
        CommissionCalculator calculator = new CommissionCalculator(policy);
        Contract contract = draft(twoInstallmentTerms().agentId(UUID.randomUUID()).build());

        Map<BeneficiaryRole, BigDecimal> rates = calculator.resolveRates(contract);

        assertEquals(1, rates.size());
        assertEquals(new BigDecimal("3.00"), rates.get(BeneficiaryRole.AGENT));
    }

    @Test
    @DisplayName("A missing rate is a configuration error, never zero")
    void testMissingRate() {
        CommissionCalculator calculator = new CommissionCalculator(policy());
        Contract contract = draft(twoInstallmentTerms().brokerId(UUID.randomUUID()).build());

        assertThrows(LedgerConfigurationException.class, () -> calculator.resolveRates(contract));
    }

    @Test
    @DisplayName("A zero rate is honoured and creates no record")
    void testZeroRate() {
        CommissionCalculator calculator = new CommissionCalculator(policy());
        Contract contract = draft(twoInstallmentTerms()
            .agentId(UUID.randomUUID())
            .agentCommissionRate(BigDecimal.ZERO)
            .build());

        assertTrue(calculator.onPaymentRecognized(contract, php("1000.00"), NOW).isEmpty());
        assertTrue(contract.getCommissions().isEmpty());
    }

    @Test
    @DisplayName("markPaid freezes a record once")
    void testMarkPaid() {
        CommissionCalculator calculator = new CommissionCalculator(policy());
        Contract contract = agentAndBrokerContract();
        CommissionDelta delta = calculator.onPaymentRecognized(contract, php("1000.00"), NOW).get(0);

        CommissionRecord record = calculator.markPaid(contract, delta.getCommissionRecordId(), UUID.randomUUID(), NOW);

        assertTrue(record.isPaid());
        assertEquals(NOW, record.getPaidAt());
        assertThrows(AlreadyPaidException.class,
            () -> calculator.markPaid(contract, delta.getCommissionRecordId(), UUID.randomUUID(), NOW));
    }
}
