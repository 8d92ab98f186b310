package com.flagship.revenue_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of an inbound event having been handled by a consumer group.
 * Lets replays and redeliveries be recognised and skipped.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    String aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED,    // not relevant, or already applied by another path
        FAILED      // rejected permanently; will not be retried
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         String aggregateId, String consumerGroup, Instant at) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup, at,
                ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType,
                                         String aggregateId, String consumerGroup, String reason, Instant at) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup, at,
                ProcessingResult.SKIPPED, reason);
    }

    public static ProcessedEvent failed(UUID eventId, String eventType, String aggregateType,
                                        String aggregateId, String consumerGroup, String errorMessage, Instant at) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup, at,
                ProcessingResult.FAILED, errorMessage);
    }
}
