package com.flagship.revenue_ledger.reconciliation;

public enum ReconciliationStatus {
    RECONCILED,
    DISCREPANCY_FOUND
}
