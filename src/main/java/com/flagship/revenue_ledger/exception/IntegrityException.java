package com.flagship.revenue_ledger.exception;

/**
 * Post-write verification failed. The surrounding transaction is rolled back,
 * so no caller ever observes the partial state.
 */
public class IntegrityException extends LedgerException {

    public IntegrityException(String message) {
        super(message, ErrorSeverity.CRITICAL);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, ErrorSeverity.CRITICAL, cause);
    }
}
