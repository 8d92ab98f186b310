package com.flagship.revenue_ledger.events;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when reconciliation opens a discrepancy alert.
 */
@Value
public class DiscrepancyDetectedEvent implements LedgerEvent {
    UUID eventId;
    UUID alertId;
    LocalDate reconciliationDate;
    String account;
    Money expectedAmount;
    Money actualAmount;
    Money differenceAmount;
    String severity;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DiscrepancyDetected";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return account;
    }

    @Override
    public String getAggregateType() {
        return "AccountBalance";
    }
}
