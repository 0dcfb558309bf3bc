package com.sibol.contract_ledger.contract;

import com.sibol.contract_ledger.exception.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.sibol.contract_ledger.ContractFixtures.active;
import static com.sibol.contract_ledger.ContractFixtures.draft;
import static com.sibol.contract_ledger.ContractFixtures.pendingSignature;
import static com.sibol.contract_ledger.ContractFixtures.scheduled;
import static com.sibol.contract_ledger.ContractFixtures.twoInstallmentTerms;
import static org.junit.jupiter.api.Assertions.*;

class ContractLifecycleTest {

    private static final Instant NOW = Instant.parse("2024-01-05T00:00:00Z");

    private final ContractLifecycle lifecycle = new ContractLifecycle();

    @Test
    @DisplayName("Submitting requires a schedule")
    void testSubmitRequiresSchedule() {
        Contract contract = draft(twoInstallmentTerms().build());

        assertThrows(InvalidTransitionException.class, () -> lifecycle.submitForSignature(contract, NOW));
        assertEquals(ContractStatus.DRAFT, contract.getStatus());
    }

    @Test
    @DisplayName("The last required signature activates the contract")
    void testSigningActivates() {
        Contract contract = pendingSignature(twoInstallmentTerms().agentId(UUID.randomUUID()).build());

        assertTrue(lifecycle.sign(contract, SignatoryRole.CLIENT, "client-sig", NOW).isEmpty());
        assertTrue(lifecycle.sign(contract, SignatoryRole.AGENT, "agent-sig", NOW).isEmpty());
        assertFalse(contract.isFullySigned());

        List<StatusChange> changes = lifecycle.sign(contract, SignatoryRole.LANDLORD, "landlord-sig", NOW);

        assertEquals(1, changes.size());
        assertEquals(ContractStatus.ACTIVE, changes.get(0).getTo());
        assertEquals(ContractStatus.ACTIVE, contract.getStatus());
        assertEquals(NOW, contract.getActivatedAt());
        assertTrue(contract.isFullySigned());
        assertEquals("landlord-sig", contract.getSignature(SignatoryRole.LANDLORD).getPayload());
    }

    @Test
    @DisplayName("Signing twice or for an absent party is rejected")
    void testInvalidSignatures() {
        Contract contract = pendingSignature(twoInstallmentTerms().build());
        lifecycle.sign(contract, SignatoryRole.CLIENT, "sig", NOW);

        assertThrows(InvalidTransitionException.class,
            () -> lifecycle.sign(contract, SignatoryRole.CLIENT, "sig", NOW));
        assertThrows(IllegalArgumentException.class,
            () -> lifecycle.sign(contract, SignatoryRole.AGENT, "sig", NOW));
    }

    @Test
    @DisplayName("Signatures are only collected while PENDING_SIGNATURE")
    void testSignOutsidePending() {
        Contract contract = scheduled(twoInstallmentTerms().build());

        assertThrows(InvalidTransitionException.class,
            () -> lifecycle.sign(contract, SignatoryRole.CLIENT, "sig", NOW));
    }

    @Test
    @DisplayName("Cancel and terminate need a reason and close the contract")
    void testCancelAndTerminate() {
        Contract cancelled = pendingSignature(twoInstallmentTerms().build());
        assertThrows(InvalidTransitionException.class, () -> lifecycle.cancel(cancelled, " ", NOW));

        lifecycle.cancel(cancelled, "Buyer withdrew", NOW);
        assertEquals(ContractStatus.CANCELLED, cancelled.getStatus());
        assertEquals("Buyer withdrew", cancelled.getClosureReason());
        assertEquals(NOW, cancelled.getClosedAt());

        Contract terminated = active(twoInstallmentTerms().build());
        lifecycle.terminate(terminated, "Breach of contract", NOW);
        assertEquals(ContractStatus.TERMINATED, terminated.getStatus());
    }

    @Test
    @DisplayName("Terminal states allow no further transitions")
    void testTerminalStates() {
        Contract contract = active(twoInstallmentTerms().build());
        lifecycle.terminate(contract, "Breach", NOW);

        assertThrows(InvalidTransitionException.class, () -> lifecycle.cancel(contract, "Again", NOW));
        for (ContractStatus target : ContractStatus.values()) {
            assertFalse(lifecycle.canTransition(ContractStatus.TERMINATED, target));
            assertFalse(lifecycle.canTransition(ContractStatus.COMPLETED, target));
        }
        assertFalse(lifecycle.canTransition(ContractStatus.DRAFT, ContractStatus.ACTIVE));
        assertFalse(lifecycle.canTransition(ContractStatus.ACTIVE, ContractStatus.DRAFT));
    }

    @Test
    @DisplayName("An ACTIVE contract past its end date expires; one without an end date never does")
    void testExpiry() {
        Contract withEnd = active(twoInstallmentTerms().endDate(LocalDate.of(2024, 6, 30)).build());
        Contract withoutEnd = active(twoInstallmentTerms().build());

        assertTrue(lifecycle.expireIfDue(withEnd, LocalDate.of(2024, 6, 30), NOW).isEmpty());
        Optional<StatusChange> expired = lifecycle.expireIfDue(withEnd, LocalDate.of(2024, 7, 1), NOW);
        assertTrue(expired.isPresent());
        assertEquals(ContractStatus.EXPIRED, withEnd.getStatus());

        assertTrue(lifecycle.expireIfDue(withoutEnd, LocalDate.of(2099, 1, 1), NOW).isEmpty());
        assertEquals(ContractStatus.ACTIVE, withoutEnd.getStatus());
    }

    @Test
    @DisplayName("Schedule cannot change once the contract left DRAFT")
    void testScheduleFrozenAfterSubmit() {
        Contract contract = pendingSignature(twoInstallmentTerms().build());

        assertThrows(IllegalStateException.class, () -> contract.attachSchedule(List.of()));
    }
}
