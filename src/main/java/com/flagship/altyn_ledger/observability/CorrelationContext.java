package com.flagship.altyn_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Per-thread request context and the MDC keys printed by the log pattern.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";

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
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId.get());
    }

    public static void setUserId(String userId) {
        if (userId != null) {
            MDC.put(USER_ID_MDC_KEY, userId);
        }
    }

    public static void setTransactionId(Object transactionId) {
        if (transactionId != null) {
            MDC.put(TRANSACTION_ID_MDC_KEY, transactionId.toString());
        }
    }

    /**
     * Clears the thread-local and every MDC key owned by this class.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(USER_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
    }

    // Short form keeps log lines readable.
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
