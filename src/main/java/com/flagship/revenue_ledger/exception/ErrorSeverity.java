package com.flagship.revenue_ledger.exception;

/**
 * How a ledger failure must be treated by callers.
 */
public enum ErrorSeverity {
    /** Rejected before any mutation; the caller may retry with corrected input. */
    RECOVERABLE,
    /** Surfaced to the caller; retrying the same request will not help. */
    NON_RETRYABLE,
    /** In-flight transaction rolled back; logged and escalated to operators. */
    CRITICAL
}
