package com.flagship.revenue_ledger.exception;

/**
 * Malformed or out-of-range input, rejected before any mutation.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message, ErrorSeverity.RECOVERABLE);
    }
}
