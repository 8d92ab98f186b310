package com.flagship.revenue_ledger.events;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events published by the ledger.
 *
 * All ledger events share these common properties:
 * - Event ID for deduplication in consumers
 * - Aggregate type and ID, used as the Kafka key for ordering
 * - Timestamp of when the event occurred
 */
public interface LedgerEvent {

    UUID getEventId();

    /**
     * Aggregate the event is about, e.g. a payment transaction id or an account key.
     */
    String getAggregateId();

    @JsonIgnore
    String getAggregateType();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
