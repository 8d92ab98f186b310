package com.flagship.revenue_ledger.exception;

/**
 * Invalid ledger configuration, such as a service-charge rate outside the allowed range.
 */
public class ConfigurationException extends LedgerException {

    public ConfigurationException(String message) {
        super(message, ErrorSeverity.RECOVERABLE);
    }
}
