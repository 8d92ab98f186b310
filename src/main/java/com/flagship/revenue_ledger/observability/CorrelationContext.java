package com.flagship.revenue_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the ledger.
 *
 * The correlation id is opened by whatever starts a unit of work (Kafka listener,
 * scheduled job) and appears in every log line through the logging pattern.
 * It is copied into outbound Kafka messages as a header.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String ACCOUNT_MDC_KEY = "accountRef";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation id, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Starts a correlation scope on the current thread. Blank ids are replaced
     * with a generated one. Close the returned scope to clear both the thread-local
     * and the MDC.
     */
    public static Scope open(String id) {
        String effective = id != null && !id.isBlank() ? id : generateCorrelationId();
        correlationId.set(effective);
        MDC.put(CORRELATION_ID_MDC_KEY, effective);
        return new Scope();
    }

    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
        MDC.remove(ACCOUNT_MDC_KEY);
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    public static final class Scope implements AutoCloseable {

        private Scope() {
        }

        @Override
        public void close() {
            clear();
        }
    }
}
