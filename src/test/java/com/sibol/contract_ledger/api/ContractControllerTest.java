package com.sibol.contract_ledger.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST surface of the contract ledger.
 *
 * These tests verify:
 * - A contract can be created, scheduled, signed and paid over HTTP
 * - A repeated external reference answers 200 with the original transaction
 * - Domain errors map to 400, 404 and 409 with the error body
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class ContractControllerTest {

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
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Map<String, Object> contractRequest() {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("contract_number", "CN-" + UUID.randomUUID().toString().substring(0, 8));
        request.put("contract_type", "PURCHASE_AGREEMENT");
        request.put("property_id", UUID.randomUUID());
        request.put("client_id", UUID.randomUUID());
        request.put("developer_id", UUID.randomUUID());
        request.put("currency", "PHP");
        request.put("total_amount", "80000.00");
        request.put("downpayment_amount", "80000.00");
        request.put("downpayment_months", 2);
        request.put("term_months", 1);
        request.put("start_date", LocalDate.now(ZoneId.of("Asia/Manila")).toString());
        return request;
    }

    private ResultActions postJson(String path, Object body) throws Exception {
        return mockMvc.perform(post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private JsonNode json(ResultActions result) throws Exception {
        return objectMapper.readTree(result.andReturn().getResponse().getContentAsString());
    }

    private String createActiveContract() throws Exception {
        String id = json(postJson("/api/contracts", contractRequest())
                .andExpect(status().isCreated()))
                .get("id").asText();
        mockMvc.perform(post("/api/contracts/{id}/schedule", id)).andExpect(status().isOk());
        mockMvc.perform(post("/api/contracts/{id}/submit", id)).andExpect(status().isOk());
        postJson("/api/contracts/" + id + "/signatures", Map.of("role", "CLIENT", "payload", "client-sig"))
                .andExpect(status().isOk());
        postJson("/api/contracts/" + id + "/signatures", Map.of("role", "LANDLORD", "payload", "landlord-sig"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.is_fully_signed").value(true));
        return id;
    }

    private Map<String, Object> payment(String amount, String reference) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("amount", amount);
        request.put("currency", "PHP");
        request.put("external_reference", reference);
        return request;
    }

    @Test
    @DisplayName("Contract walks from DRAFT to ACTIVE and shows its schedule")
    void testContractLifecycle() throws Exception {
        printTestHeader("Contract lifecycle over HTTP");

        String id = createActiveContract();

        mockMvc.perform(get("/api/contracts/{id}/installments", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].installment_number").value(1))
                .andExpect(jsonPath("$[0].amount.amount_minor").value(4000000));
        mockMvc.perform(get("/api/contracts/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_amount.currency").value("PHP"))
                .andExpect(jsonPath("$.paid_amount.amount_minor").value(0));
        printSuccess("Contract " + id + " is ACTIVE");
    }

    @Test
    @DisplayName("Payment returns 201, its retry returns 200 with the same transaction")
    void testPaymentIdempotency() throws Exception {
        printTestHeader("Payment idempotency over HTTP");
        String id = createActiveContract();
        String reference = "BANK-" + UUID.randomUUID();

        JsonNode first = json(postJson("/api/contracts/" + id + "/payments", payment("40000.00", reference))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.type").value("PAYMENT"))
                .andExpect(jsonPath("$.balance_after.amount_minor").value(4000000)));
        JsonNode second = json(postJson("/api/contracts/" + id + "/payments", payment("40000.00", reference))
                .andExpect(status().isOk()));

        printOutput("First", first.get("id").asText());
        printOutput("Second", second.get("id").asText());
        assertEquals(first.get("id").asText(), second.get("id").asText());

        mockMvc.perform(get("/api/contracts/{id}/transactions", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
        mockMvc.perform(get("/api/contracts/{id}/construction", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.can_start_construction").value(true))
                .andExpect(jsonPath("$.is_turnover_ready").value(false));
        printSuccess("Duplicate answered with the original transaction");
    }

    @Test
    @DisplayName("Reversal over HTTP, and a second reversal conflicts")
    void testReversal() throws Exception {
        String id = createActiveContract();
        String paymentId = json(postJson("/api/contracts/" + id + "/payments",
                payment("1000.00", "BANK-" + UUID.randomUUID()))
                .andExpect(status().isCreated()))
                .get("id").asText();
        String path = "/api/contracts/" + id + "/transactions/" + paymentId + "/reversal";

        postJson(path, Map.of("reason", "Bounced cheque"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.type").value("REVERSAL"))
                .andExpect(jsonPath("$.reversed_transaction_id").value(paymentId))
                .andExpect(jsonPath("$.balance_after.amount_minor").value(0));
        postJson(path, Map.of("reason", "Again"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Conflict"));
    }

    @Test
    @DisplayName("Unknown contract answers 404")
    void testNotFound() throws Exception {
        mockMvc.perform(get("/api/contracts/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    @DisplayName("Payment to a DRAFT contract conflicts")
    void testPaymentOnDraft() throws Exception {
        String id = json(postJson("/api/contracts", contractRequest())
                .andExpect(status().isCreated()))
                .get("id").asText();

        postJson("/api/contracts/" + id + "/payments", payment("1000.00", "BANK-" + UUID.randomUUID()))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Missing fields and bad values answer 400")
    void testValidation() throws Exception {
        Map<String, Object> missingNumber = contractRequest();
        missingNumber.remove("contract_number");
        postJson("/api/contracts", missingNumber)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.details.contractNumber").exists());

        String id = createActiveContract();
        postJson("/api/contracts/" + id + "/payments", payment("1000.00", ""))
                .andExpect(status().isBadRequest());

        Map<String, Object> wrongCurrency = payment("1000.00", "BANK-" + UUID.randomUUID());
        wrongCurrency.put("currency", "USD");
        postJson("/api/contracts/" + id + "/payments", wrongCurrency)
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Duplicate contract number conflicts")
    void testDuplicateNumber() throws Exception {
        Map<String, Object> request = contractRequest();
        postJson("/api/contracts", request).andExpect(status().isCreated());

        postJson("/api/contracts", request)
                .andExpect(status().isConflict());
    }
}
