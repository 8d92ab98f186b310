package com.flagship.revenue_ledger.events;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a completed payment has been split and credited to the payee
 * and platform accounts.
 */
@Value
public class RevenueDistributedEvent implements LedgerEvent {
    UUID eventId;
    String transactionId;
    String payeeAccount;
    String platformAccount;
    Money grossAmount;
    Money serviceCharge;
    Money payeeAmount;
    BigDecimal rate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RevenueDistributed";

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
