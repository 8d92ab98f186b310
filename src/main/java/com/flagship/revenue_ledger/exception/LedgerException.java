package com.flagship.revenue_ledger.exception;

/**
 * Base class for every failure raised by the ledger core.
 *
 * Each subclass carries an {@link ErrorSeverity} so that callers (Kafka consumers,
 * schedulers, admin tooling) can decide between retrying, surfacing and escalating
 * without inspecting concrete types.
 *
 * {@link #getMessage()} always holds the full server-side detail.
 * {@link #getUserMessage()} is what may be shown outside the service.
 */
public abstract class LedgerException extends RuntimeException {

    public static final String GENERIC_FAILURE_MESSAGE = "Operation failed, contact administrator";

    private final ErrorSeverity severity;

    protected LedgerException(String message, ErrorSeverity severity) {
        super(message);
        this.severity = severity;
    }

    protected LedgerException(String message, ErrorSeverity severity, Throwable cause) {
        super(message, cause);
        this.severity = severity;
    }

    public ErrorSeverity getSeverity() {
        return severity;
    }

    public boolean isCritical() {
        return severity == ErrorSeverity.CRITICAL;
    }

    public boolean isRetryable() {
        return severity == ErrorSeverity.RECOVERABLE;
    }

    /**
     * Message safe to return to a caller. Critical failures never leak internal detail.
     */
    public String getUserMessage() {
        return isCritical() ? GENERIC_FAILURE_MESSAGE : getMessage();
    }
}
