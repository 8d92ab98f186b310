package com.flagship.revenue_ledger.events;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an admin corrects an account balance.
 */
@Value
public class BalanceCorrectedEvent implements LedgerEvent {
    UUID eventId;
    UUID correctionId;
    String account;
    Money originalBalance;
    Money correctedBalance;
    Money difference;
    String adminActorId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceCorrected";

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
