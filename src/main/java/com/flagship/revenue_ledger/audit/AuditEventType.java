package com.flagship.revenue_ledger.audit;

public enum AuditEventType {
    REVENUE_DISTRIBUTED,
    REVENUE_REFUNDED,
    BALANCE_CORRECTION,
    DISCREPANCY_RESOLVED
}
