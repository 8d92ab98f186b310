package com.flagship.revenue_ledger.consumer;

import com.flagship.revenue_ledger.exception.DuplicateDistributionException;
import com.flagship.revenue_ledger.exception.ErrorSeverity;
import com.flagship.revenue_ledger.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Runs each inbound event at most once per consumer group.
 *
 * The handler manages its own transaction (a distribution commits or rolls back
 * on its own), so the processed-event row is written after the handler returns.
 * A crash in between means redelivery, which the distribution's own idempotency
 * key turns into a SKIPPED record.
 *
 * Outcome handling:
 * - handler succeeds: SUCCESS, returns true
 * - already distributed: SKIPPED, returns false
 * - non-critical ledger rejection: FAILED, returns false (no retry helps)
 * - anything else: nothing is recorded, the exception propagates and Kafka redelivers
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, String aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
            record(ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                    clock.instant()));
            log.debug("Successfully processed event {} by consumer group {}", eventId, consumerGroup);
            return true;

        } catch (DuplicateDistributionException e) {
            record(ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                    e.getMessage(), clock.instant()));
            log.info("Event {} refers to an already distributed transaction {}", eventId, e.getTransactionId());
            return false;

        } catch (LedgerException e) {
            if (e.getSeverity() == ErrorSeverity.CRITICAL) {
                log.error("Event {} aborted by a critical ledger failure, leaving for redelivery: {}",
                        eventId, e.getMessage());
                throw e;
            }
            record(ProcessedEvent.failed(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                    e.getMessage(), clock.instant()));
            log.warn("Event {} rejected permanently by consumer group {}: {}", eventId, consumerGroup, e.getMessage());
            return false;
        }
    }

    /**
     * Marks an event as not relevant to this consumer so it is not looked at again.
     */
    public void skipEvent(UUID eventId, String eventType, String aggregateType, String aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        record(ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                reason, clock.instant()));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void record(ProcessedEvent event) {
        repository.save(ProcessedEventEntity.fromDomain(event));
    }
}
