package com.flagship.revenue_ledger.exception;

/**
 * The ledger account for a payee or balance reference could not be resolved.
 * Distribution for that payee stays suspended until the account is registered.
 */
public class AccountNotFoundException extends LedgerException {

    public AccountNotFoundException(String message) {
        super(message, ErrorSeverity.NON_RETRYABLE);
    }
}
