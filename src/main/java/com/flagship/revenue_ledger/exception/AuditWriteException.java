package com.flagship.revenue_ledger.exception;

/**
 * A mandatory audit record could not be written. Operations that require a
 * complete audit trail roll back when this is raised.
 */
public class AuditWriteException extends LedgerException {

    public AuditWriteException(String message, Throwable cause) {
        super(message, ErrorSeverity.CRITICAL, cause);
    }
}
