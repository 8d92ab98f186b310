package com.flagship.revenue_ledger.notification;

public enum AlertLevel {
    INFO,
    MEDIUM,
    HIGH,
    CRITICAL
}
