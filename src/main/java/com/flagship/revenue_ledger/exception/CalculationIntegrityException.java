package com.flagship.revenue_ledger.exception;

/**
 * A computed revenue split does not add back up to the gross amount.
 * Raised before anything is posted.
 */
public class CalculationIntegrityException extends LedgerException {

    public CalculationIntegrityException(String message) {
        super(message, ErrorSeverity.CRITICAL);
    }
}
