package com.sibol.contract_ledger.contract;

import com.sibol.contract_ledger.exception.InvalidTransitionException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Contract state machine.
 *
 * <pre>
 *   DRAFT ──submit──► PENDING_SIGNATURE ──last signature──► ACTIVE ──paid in full──► COMPLETED
 *                                                             └──── past end date ──► EXPIRED
 *   any non-terminal ──cancel──► CANCELLED
 *   any non-terminal ──terminate──► TERMINATED
 * </pre>
 *
 * Every method validates the move against the transition table and the move's own
 * precondition before touching the contract, and returns the transitions it applied so the
 * caller can publish them. Stateless and thread-safe; callers serialize access per contract.
 */
public class ContractLifecycle {

    private static final Map<ContractStatus, Set<ContractStatus>> ALLOWED = new EnumMap<>(ContractStatus.class);

    static {
        ALLOWED.put(ContractStatus.DRAFT, EnumSet.of(
            ContractStatus.PENDING_SIGNATURE, ContractStatus.CANCELLED, ContractStatus.TERMINATED));
        ALLOWED.put(ContractStatus.PENDING_SIGNATURE, EnumSet.of(
            ContractStatus.ACTIVE, ContractStatus.CANCELLED, ContractStatus.TERMINATED));
        ALLOWED.put(ContractStatus.ACTIVE, EnumSet.of(
            ContractStatus.COMPLETED, ContractStatus.EXPIRED, ContractStatus.CANCELLED, ContractStatus.TERMINATED));
        for (ContractStatus status : ContractStatus.values()) {
            ALLOWED.putIfAbsent(status, EnumSet.noneOf(ContractStatus.class));
        }
    }

    public boolean canTransition(ContractStatus from, ContractStatus to) {
        return ALLOWED.get(from).contains(to);
    }

    /**
     * Freezes the schedule and opens the contract for signatures and early payments.
     */
    public StatusChange submitForSignature(Contract contract, Instant at) {
        requireAllowed(contract, ContractStatus.PENDING_SIGNATURE);
        if (!contract.hasSchedule()) {
            throw new InvalidTransitionException(contract.getStatus(), ContractStatus.PENDING_SIGNATURE,
                "no payment schedule attached");
        }
        return apply(contract, ContractStatus.PENDING_SIGNATURE, at, null);
    }

    /**
     * Records one party's signature. The last required signature activates the contract, and
     * a contract that was already paid in full during signing completes right away.
     */
    public List<StatusChange> sign(Contract contract, SignatoryRole role, String payload, Instant at) {
        if (contract.getStatus() != ContractStatus.PENDING_SIGNATURE) {
            throw new InvalidTransitionException(contract.getStatus(), ContractStatus.ACTIVE,
                "signatures are only collected while PENDING_SIGNATURE");
        }
        if (!contract.requiredSignatories().contains(role)) {
            throw new IllegalArgumentException(
                "Contract " + contract.getId() + " has no " + role + " to sign it");
        }
        if (contract.getSignature(role).isSigned()) {
            throw new InvalidTransitionException(contract.getStatus(), ContractStatus.ACTIVE,
                role + " has already signed");
        }

        contract.putSignature(Signature.signed(role, at, payload));

        List<StatusChange> changes = new ArrayList<>();
        if (contract.isFullySigned()) {
            changes.add(apply(contract, ContractStatus.ACTIVE, at, null));
            checkCompletion(contract, at).ifPresent(changes::add);
        }
        return changes;
    }

    /**
     * Completes an ACTIVE contract whose cumulative principal reached the total.
     */
    public Optional<StatusChange> checkCompletion(Contract contract, Instant at) {
        if (contract.getStatus() == ContractStatus.ACTIVE && contract.isPaidInFull()) {
            return Optional.of(apply(contract, ContractStatus.COMPLETED, at, null));
        }
        return Optional.empty();
    }

    /**
     * Expires an ACTIVE contract whose end date is before {@code today} and which is not paid
     * in full. Contracts without an end date never expire.
     */
    public Optional<StatusChange> expireIfDue(Contract contract, LocalDate today, Instant at) {
        LocalDate endDate = contract.getTerms().getEndDate();
        if (contract.getStatus() == ContractStatus.ACTIVE
            && endDate != null
            && today.isAfter(endDate)
            && !contract.isPaidInFull()) {
            return Optional.of(apply(contract, ContractStatus.EXPIRED, at, "End date " + endDate + " passed"));
        }
        return Optional.empty();
    }

    public StatusChange cancel(Contract contract, String reason, Instant at) {
        return close(contract, ContractStatus.CANCELLED, reason, at);
    }

    public StatusChange terminate(Contract contract, String reason, Instant at) {
        return close(contract, ContractStatus.TERMINATED, reason, at);
    }

    private StatusChange close(Contract contract, ContractStatus target, String reason, Instant at) {
        requireAllowed(contract, target);
        if (reason == null || reason.isBlank()) {
            throw new InvalidTransitionException(contract.getStatus(), target, "a reason is required");
        }
        return apply(contract, target, at, reason);
    }

    private void requireAllowed(Contract contract, ContractStatus target) {
        ContractStatus current = contract.getStatus();
        if (!canTransition(current, target)) {
            throw new InvalidTransitionException(current, target,
                current.isTerminal() ? current + " is terminal" : "transition not allowed");
        }
    }

    private StatusChange apply(Contract contract, ContractStatus target, Instant at, String reason) {
        requireAllowed(contract, target);
        ContractStatus from = contract.getStatus();
        contract.moveTo(target, at, reason);
        return new StatusChange(contract.getId(), from, target, at, reason);
    }
}
