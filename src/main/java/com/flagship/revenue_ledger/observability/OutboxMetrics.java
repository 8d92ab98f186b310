package com.flagship.revenue_ledger.observability;

import com.flagship.revenue_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the ledger event outbox.
 *
 * - ledger.outbox.backlog: events waiting to be published
 * - ledger.outbox.backlog.age.seconds: age of the oldest waiting event
 * - ledger.outbox.dead_lettered: events that exhausted their retries
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler}, so a scrape
 * never hits the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetteredCount = new AtomicLong(0);

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         Clock clock,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxRetries = maxRetries;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("ledger.outbox.backlog", backlogSize, AtomicLong::get)
                .description("Number of unpublished ledger events in the outbox")
                .register(meterRegistry);

        Gauge.builder("ledger.outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished ledger event in seconds")
                .register(meterRegistry);

        Gauge.builder("ledger.outbox.dead_lettered", deadLetteredCount, AtomicLong::get)
                .description("Ledger events that exceeded max publish attempts")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            backlogSize.set(outboxRepository.countUnpublished());

            outboxRepository.findOldestUnpublishedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestEventAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, clock.instant()).getSeconds())),
                            () -> oldestEventAgeSeconds.set(0)
                    );

            deadLetteredCount.set(outboxRepository.countDeadLettered(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLettered={}",
                    backlogSize.get(), oldestEventAgeSeconds.get(), deadLetteredCount.get());

        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("ledger.outbox.published", "event_type", eventType, "status", "success")
                .increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("ledger.outbox.published", "event_type", eventType, "status", "failure")
                .increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("ledger.outbox.dead_letter_transitions", "event_type", eventType)
                .increment();
    }
}
