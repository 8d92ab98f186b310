package com.flagship.revenue_ledger.notification;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Operator alert raised by the ledger (integrity failures, discrepancies, anomalies).
 */
@Value
public class LedgerAlert {
    String alertType;
    AlertLevel level;
    String message;
    Map<String, Object> details;
    Instant raisedAt;

    public static LedgerAlert of(String alertType, AlertLevel level, String message,
                                 Map<String, Object> details, Instant raisedAt) {
        return new LedgerAlert(alertType, level, message, Map.copyOf(details), raisedAt);
    }
}
