package com.sibol.contract_ledger.service;

import com.sibol.contract_ledger.commission.BeneficiaryRole;
import com.sibol.contract_ledger.commission.CommissionRecord;
import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.contract.ContractStatus;
import com.sibol.contract_ledger.contract.ContractTerms;
import com.sibol.contract_ledger.contract.ContractType;
import com.sibol.contract_ledger.contract.SignatoryRole;
import com.sibol.contract_ledger.event.CommissionPaidOutEvent;
import com.sibol.contract_ledger.event.ConstructionThresholdReachedEvent;
import com.sibol.contract_ledger.event.ContractStatusChangedEvent;
import com.sibol.contract_ledger.event.PaymentAppliedEvent;
import com.sibol.contract_ledger.event.TransactionReversedEvent;
import com.sibol.contract_ledger.exception.ContractNotFoundException;
import com.sibol.contract_ledger.exception.DuplicateContractNumberException;
import com.sibol.contract_ledger.exception.InvalidTransitionException;
import com.sibol.contract_ledger.ledger.LedgerTransaction;
import com.sibol.contract_ledger.ledger.TransactionType;
import com.sibol.contract_ledger.money.CurrencyCode;
import com.sibol.contract_ledger.money.Money;
import com.sibol.contract_ledger.outbox.OutboxEvent;
import com.sibol.contract_ledger.outbox.OutboxEventRepository;
import com.sibol.contract_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Contract ledger against a real PostgreSQL.
 *
 * Verifies that:
 * - Payments move the persisted balance and write their events to the outbox
 * - A repeated external reference returns the original entry and books nothing
 * - Redis being down only costs a database lookup
 * - Reversals, commission payouts and lifecycle transitions survive a reload
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class ContractLedgerServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("contract_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No broker in these tests; the publisher stays off
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private ContractService contractService;

    @Autowired
    private ContractLedgerService ledgerService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxRepository;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    @BeforeEach
    void setUp() {
        outboxRepository.deleteAll();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    private static Money php(String amount) {
        return Money.of(amount, CurrencyCode.PHP);
    }

    /**
     * 80,000.00 PHP in two 40,000.00 installments starting today, so nothing is overdue.
     * The agent earns 5%.
     */
    private ContractTerms.ContractTermsBuilder terms() {
        return ContractTerms.builder()
                .contractNumber("CN-" + UUID.randomUUID().toString().substring(0, 8))
                .contractType(ContractType.PURCHASE_AGREEMENT)
                .propertyId(UUID.randomUUID())
                .clientId(UUID.randomUUID())
                .developerId(UUID.randomUUID())
                .agentId(UUID.randomUUID())
                .agentCommissionRate(new BigDecimal("5.00"))
                .totalAmount(php("80000.00"))
                .downpaymentAmount(php("80000.00"))
                .downpaymentMonths(2)
                .termMonths(1)
                .startDate(LocalDate.now(ZoneId.of("Asia/Manila")));
    }

    private UUID createActiveContract() {
        Contract contract = contractService.createContract(terms().build());
        UUID contractId = contract.getId();
        contractService.attachSchedule(contractId);
        contractService.submitForSignature(contractId);
        for (SignatoryRole role : List.of(SignatoryRole.CLIENT, SignatoryRole.LANDLORD, SignatoryRole.AGENT)) {
            contractService.sign(contractId, role, "signed-by-" + role);
        }
        return contractId;
    }

    private List<String> eventTypes(UUID contractId) {
        return outboxService.getEventsForContract(contractId).stream()
                .map(OutboxEvent::getEventType)
                .toList();
    }

    private static String reference() {
        return "BANK-" + UUID.randomUUID();
    }

    // ========================================================================
    // PAYMENTS
    // ========================================================================

    @Nested
    @DisplayName("Payments")
    class PaymentTests {

        @Test
        @DisplayName("Payment moves the stored balance and lands in the outbox")
        void testPaymentPersistedWithEvents() {
            printTestHeader("Payment persisted with events");
            UUID contractId = createActiveContract();

            PaymentResult result = ledgerService.applyPayment(contractId, php("40000.00"), null, reference());

            assertFalse(result.isDuplicate());
            assertEquals(TransactionType.PAYMENT, result.getTransaction().getType());
            assertEquals(php("40000.00"), result.getTransaction().getBalanceAfter());

            Contract reloaded = contractService.getContract(contractId);
            assertEquals(php("40000.00"), reloaded.getCumulativePrincipalPaid());
            assertTrue(reloaded.getInstallments().get(0).isPrincipalSettled());
            assertEquals(1, ledgerService.getTransactions(contractId).size());

            List<String> events = eventTypes(contractId);
            assertTrue(events.contains(PaymentAppliedEvent.EVENT_TYPE));
            assertTrue(events.contains(ConstructionThresholdReachedEvent.EVENT_TYPE));
            assertTrue(events.contains(ContractStatusChangedEvent.EVENT_TYPE));
            printSuccess("Balance " + reloaded.getCumulativePrincipalPaid() + ", events " + events);
        }

        @Test
        @DisplayName("Repeated external reference returns the original entry")
        void testDuplicateReference() {
            printTestHeader("Duplicate external reference");
            UUID contractId = createActiveContract();
            String reference = reference();

            PaymentResult first = ledgerService.applyPayment(contractId, php("10000.00"), null, reference);
            PaymentResult second = ledgerService.applyPayment(contractId, php("10000.00"), null, reference);

            assertFalse(first.isDuplicate());
            assertTrue(second.isDuplicate());
            assertEquals(first.getTransaction().getId(), second.getTransaction().getId());
            assertEquals(php("10000.00"), contractService.getContract(contractId).getCumulativePrincipalPaid());
            assertEquals(1, eventTypes(contractId).stream()
                    .filter(PaymentAppliedEvent.EVENT_TYPE::equals)
                    .count());
            printSuccess("Second request returned transaction " + second.getTransaction().getId());
        }

        @Test
        @DisplayName("Redis hit answers the retry without booking")
        void testRedisHit() {
            printTestHeader("Redis fast path");
            UUID contractId = createActiveContract();
            String reference = reference();
            PaymentResult first = ledgerService.applyPayment(contractId, php("5000.00"), null, reference);

            when(valueOperations.get(anyString())).thenReturn(first.getTransaction().getId().toString());
            PaymentResult second = ledgerService.applyPayment(contractId, php("5000.00"), null, reference);

            assertTrue(second.isDuplicate());
            assertEquals(first.getTransaction().getId(), second.getTransaction().getId());
            assertEquals(1, ledgerService.getTransactions(contractId).size());
            printSuccess("Served from Redis");
        }

        @Test
        @DisplayName("Redis outage falls back to the database")
        void testRedisDown() {
            printTestHeader("Redis unavailable");
            UUID contractId = createActiveContract();
            String reference = reference();
            when(valueOperations.get(anyString()))
                    .thenThrow(new RedisConnectionFailureException("Connection refused"));

            PaymentResult first = ledgerService.applyPayment(contractId, php("5000.00"), null, reference);
            PaymentResult second = ledgerService.applyPayment(contractId, php("5000.00"), null, reference);

            assertFalse(first.isDuplicate());
            assertTrue(second.isDuplicate());
            assertEquals(php("5000.00"), contractService.getContract(contractId).getCumulativePrincipalPaid());
            printSuccess("Database caught the duplicate");
        }

        @Test
        @DisplayName("Payment to an unknown contract fails")
        void testUnknownContract() {
            assertThrows(ContractNotFoundException.class,
                    () -> ledgerService.applyPayment(UUID.randomUUID(), php("100.00"), null, reference()));
        }
    }

    // ========================================================================
    // CORRECTIONS AND COMMISSION
    // ========================================================================

    @Nested
    @DisplayName("Corrections and commission")
    class CorrectionTests {

        @Test
        @DisplayName("Reversal restores the balance and claws back the commission")
        void testReversal() {
            printTestHeader("Reversal");
            UUID contractId = createActiveContract();
            LedgerTransaction payment = ledgerService
                    .applyPayment(contractId, php("40000.00"), null, reference()).getTransaction();
            assertEquals(php("2000.00"), ledgerService.getTotalCommission(contractId));

            LedgerTransaction reversal = ledgerService.reverseTransaction(contractId, payment.getId(), "Bounced cheque");

            assertEquals(payment.getId(), reversal.getReversedTransactionId());
            Contract reloaded = contractService.getContract(contractId);
            assertEquals(php("0.00"), reloaded.getCumulativePrincipalPaid());
            assertFalse(reloaded.getInstallments().get(0).isPrincipalSettled());
            assertEquals(php("0.00"), ledgerService.getTotalCommission(contractId));
            assertTrue(eventTypes(contractId).contains(TransactionReversedEvent.EVENT_TYPE));
            printSuccess("Balance back to zero");
        }

        @Test
        @DisplayName("Commission payout freezes the record")
        void testCommissionPayout() {
            printTestHeader("Commission payout");
            UUID contractId = createActiveContract();
            ledgerService.applyPayment(contractId, php("20000.00"), null, reference());
            CommissionRecord record = ledgerService.getCommissions(contractId).get(0);
            assertEquals(BeneficiaryRole.AGENT, record.getBeneficiaryRole());
            assertEquals(php("1000.00"), record.getComputedAmount());

            LedgerTransaction payout = ledgerService.recordCommissionPayout(contractId, record.getId());

            assertEquals(TransactionType.COMMISSION_PAYOUT, payout.getType());
            assertEquals(php("1000.00"), payout.getAmount());
            assertEquals(php("20000.00"), payout.getBalanceAfter());
            CommissionRecord reloaded = ledgerService.getCommissions(contractId).get(0);
            assertTrue(reloaded.isPaid());
            assertEquals(payout.getId(), reloaded.getPayoutTransactionId());
            assertTrue(eventTypes(contractId).contains(CommissionPaidOutEvent.EVENT_TYPE));
            printSuccess("Record " + record.getId() + " paid by " + payout.getId());
        }
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Contract numbers are unique")
        void testDuplicateContractNumber() {
            ContractTerms terms = terms().build();
            contractService.createContract(terms);

            assertThrows(DuplicateContractNumberException.class, () -> contractService.createContract(terms));
        }

        @Test
        @DisplayName("Full payment completes the contract")
        void testCompletion() {
            printTestHeader("Completion");
            UUID contractId = createActiveContract();

            ledgerService.applyPayment(contractId, php("80000.00"), null, reference());

            Contract reloaded = contractService.getContract(contractId);
            assertEquals(ContractStatus.COMPLETED, reloaded.getStatus());
            assertNotNull(reloaded.getCompletedAt());
            printSuccess("Contract completed");
        }

        @Test
        @DisplayName("Cancelled contracts reject further transitions")
        void testCancel() {
            UUID contractId = createActiveContract();

            contractService.cancel(contractId, "Buyer withdrew");

            assertEquals(ContractStatus.CANCELLED, contractService.getContract(contractId).getStatus());
            assertThrows(InvalidTransitionException.class,
                    () -> contractService.terminate(contractId, "Too late"));
        }

        @Test
        @DisplayName("Contracts past their end date expire")
        void testExpiry() {
            Contract contract = contractService.createContract(terms()
                    .endDate(LocalDate.now(ZoneId.of("Asia/Manila")).plusMonths(3))
                    .build());
            UUID contractId = contract.getId();
            contractService.attachSchedule(contractId);
            contractService.submitForSignature(contractId);
            for (SignatoryRole role : List.of(SignatoryRole.CLIENT, SignatoryRole.LANDLORD, SignatoryRole.AGENT)) {
                contractService.sign(contractId, role, "sig");
            }
            LocalDate afterEnd = LocalDate.now(ZoneId.of("Asia/Manila")).plusMonths(4);

            assertTrue(contractService.findExpiryCandidates(afterEnd).contains(contractId));
            assertTrue(contractService.expireIfDue(contractId, afterEnd));
            assertFalse(contractService.expireIfDue(contractId, afterEnd));
            assertEquals(ContractStatus.EXPIRED, contractService.getContract(contractId).getStatus());
        }
    }
}
