package com.flagship.revenue_ledger.events;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when (part of) a distributed payment is refunded.
 */
@Value
public class RevenueRefundedEvent implements LedgerEvent {
    UUID eventId;
    String transactionId;
    Money refundAmount;
    Money payeeDebit;
    Money platformDebit;
    Money totalRefunded;
    String actorId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RevenueRefunded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return transactionId;
    }

    @Override
    public String getAggregateType() {
        return "PaymentTransaction";
    }
}
