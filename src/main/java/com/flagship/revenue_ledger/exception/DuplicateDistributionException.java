package com.flagship.revenue_ledger.exception;

/**
 * A payment transaction has already been distributed.
 */
public class DuplicateDistributionException extends LedgerException {

    private final String transactionId;

    public DuplicateDistributionException(String transactionId) {
        super("Revenue for transaction " + transactionId + " has already been distributed",
                ErrorSeverity.NON_RETRYABLE);
        this.transactionId = transactionId;
    }

    public String getTransactionId() {
        return transactionId;
    }
}
