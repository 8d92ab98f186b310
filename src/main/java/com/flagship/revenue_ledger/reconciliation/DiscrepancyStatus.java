package com.flagship.revenue_ledger.reconciliation;

/**
 * OPEN -> RESOLVED is the only transition, and only by explicit admin action.
 */
public enum DiscrepancyStatus {
    OPEN,
    RESOLVED
}
