package com.flagship.revenue_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the transactional outbox.
 *
 * Written in the same database transaction as the balance change it describes,
 * then published to Kafka by {@link OutboxPublisher}. If the business transaction
 * rolls back, the event never existed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "PaymentTransaction", "AccountBalance"
    String aggregateId;        // transaction id or account key
    String eventType;          // e.g. "RevenueDistributed"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null   // sequence assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
