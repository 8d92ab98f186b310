package com.flagship.revenue_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.postings{entry_type}: ledger entries written
 * - ledger.distributions{status}: distribution outcomes (success, duplicate, rejected, error)
 * - ledger.distribution.latency: end-to-end distribution time
 * - ledger.refunds{status}: refund outcomes
 * - ledger.corrections{status}: manual correction outcomes
 * - ledger.reconciliations{status}: reconciliation runs by outcome
 * - ledger.discrepancies{severity}: discrepancy alerts raised
 * - ledger.integrity.failures{operation}: critical integrity failures
 * - ledger.config.fallbacks: invalid rates replaced by the platform default
 * - ledger.notifications.failed{kind}: notifications that could not be handed off
 * - ledger.health.score: last computed health score (0-100)
 *
 * Tag values are sanitized to keep cardinality bounded.
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer distributionTimer;
    private final AtomicInteger healthScore = new AtomicInteger(100);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.distributionTimer = Timer.builder("ledger.distribution.latency")
                .description("Time taken to distribute revenue for one payment")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder("ledger.health.score", healthScore, AtomicInteger::get)
                .description("Health score from the last ledger health check")
                .register(registry);
    }

    public void recordPosting(String entryType) {
        registry.counter("ledger.postings", "entry_type", sanitizeTag(entryType)).increment();
    }

    public void recordDistribution(String status) {
        registry.counter("ledger.distributions", "status", sanitizeTag(status)).increment();
    }

    public void recordDistributionLatency(Duration duration) {
        distributionTimer.record(duration);
    }

    public void recordRefund(String status) {
        registry.counter("ledger.refunds", "status", sanitizeTag(status)).increment();
    }

    public void recordCorrection(String status) {
        registry.counter("ledger.corrections", "status", sanitizeTag(status)).increment();
    }

    public void recordReconciliation(String status) {
        registry.counter("ledger.reconciliations", "status", sanitizeTag(status)).increment();
    }

    public void recordDiscrepancy(String severity) {
        registry.counter("ledger.discrepancies", "severity", sanitizeTag(severity)).increment();
    }

    public void recordIntegrityFailure(String operation) {
        registry.counter("ledger.integrity.failures", "operation", sanitizeTag(operation)).increment();
    }

    public void recordConfigFallback() {
        registry.counter("ledger.config.fallbacks").increment();
    }

    public void recordNotificationFailure(String kind) {
        registry.counter("ledger.notifications.failed", "kind", sanitizeTag(kind)).increment();
    }

    public void updateHealthScore(int score) {
        healthScore.set(score);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
