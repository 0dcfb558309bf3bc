package com.sibol.contract_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys the log pattern prints.
 *
 * The id comes from the {@code X-Correlation-ID} request header or is generated; every log
 * line of the request carries it, and operations on a contract add {@code contractId}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CONTRACT_ID_MDC_KEY = "contractId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current correlation id, generated on first use for threads that did not come through
     * the HTTP filter (schedulers).
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void putContractId(UUID contractId) {
        MDC.put(CONTRACT_ID_MDC_KEY, String.valueOf(contractId));
    }

    public static void removeContractId() {
        MDC.remove(CONTRACT_ID_MDC_KEY);
    }
}
