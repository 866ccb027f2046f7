package com.flagship.transaction_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id and MDC keys shared by the HTTP layer, the orchestrator and the ledger.
 *
 * The correlation id comes from the {@value #CORRELATION_ID_HEADER} request header, or is
 * generated, and is echoed back on the response.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String USER_ID_MDC_KEY = "userId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

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
     * Short form, readable in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Tags the current thread's log lines with the transaction being worked on.
     */
    public static void putTransaction(UUID transactionId, String userId) {
        if (transactionId != null) {
            MDC.put(TRANSACTION_ID_MDC_KEY, transactionId.toString());
        }
        if (userId != null) {
            MDC.put(USER_ID_MDC_KEY, userId);
        }
    }

    public static void clearTransaction() {
        MDC.remove(TRANSACTION_ID_MDC_KEY);
        MDC.remove(USER_ID_MDC_KEY);
    }
}
