package com.sibol.contract_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Micrometer meters for ledger operations.
 *
 * <ul>
 *   <li>{@code ledger.payment.applied}: payments accepted, by currency</li>
 *   <li>{@code ledger.payment.amount}: principal accepted, in minor units, by currency</li>
 *   <li>{@code ledger.penalty.assessed}: penalty entries written</li>
 *   <li>{@code ledger.transaction.reversed}: reversals, by type of the reversed entry</li>
 *   <li>{@code ledger.payment.refunded}: refunds</li>
 *   <li>{@code ledger.commission.paid_out}: commission payouts, by beneficiary role</li>
 *   <li>{@code ledger.contract.status}: status transitions, by target status</li>
 *   <li>{@code ledger.operation.rejected}: engine rejections, by exception type</li>
 *   <li>{@code ledger.operation.duration}: time per service operation</li>
 *   <li>{@code idempotency.cache}: external reference lookups, hit or miss</li>
 * </ul>
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter penaltiesAssessed;
    private final Counter refunds;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.penaltiesAssessed = Counter.builder("ledger.penalty.assessed")
                .description("Number of penalty entries written")
                .register(registry);
        this.refunds = Counter.builder("ledger.payment.refunded")
                .description("Number of payment refunds")
                .register(registry);
    }

    public void recordPaymentApplied(String currency, long principalMinor) {
        registry.counter("ledger.payment.applied", "currency", sanitizeTag(currency)).increment();
        registry.counter("ledger.payment.amount", "currency", sanitizeTag(currency)).increment(principalMinor);
    }

    public void recordPenaltiesAssessed(int count) {
        penaltiesAssessed.increment(count);
    }

    public void recordReversal(String reversedType) {
        registry.counter("ledger.transaction.reversed", "type", sanitizeTag(reversedType)).increment();
    }

    public void recordRefund() {
        refunds.increment();
    }

    public void recordCommissionPaidOut(String role) {
        registry.counter("ledger.commission.paid_out", "role", sanitizeTag(role)).increment();
    }

    public void recordStatusChange(String toStatus) {
        registry.counter("ledger.contract.status", "to", sanitizeTag(toStatus)).increment();
    }

    public void recordRejected(String operation, Throwable error) {
        registry.counter("ledger.operation.rejected",
                "operation", sanitizeTag(operation),
                "reason", sanitizeTag(error.getClass().getSimpleName())
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Times {@code operation} under {@code ledger.operation.duration{operation=name}}.
     */
    public <T> T time(String name, Supplier<T> operation) {
        return Timer.builder("ledger.operation.duration")
                .description("Time taken by a ledger service operation")
                .tag("operation", sanitizeTag(name))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(operation);
    }

    /**
     * Keeps tag values to a bounded alphabet and length.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
