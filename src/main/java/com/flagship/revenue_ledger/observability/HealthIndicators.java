package com.flagship.revenue_ledger.observability;

import com.flagship.revenue_ledger.health.HealthMonitor;
import com.flagship.revenue_ledger.health.HealthReport;
import com.flagship.revenue_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Actuator health indicators for the revenue ledger.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many ledger events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(maxRetries);

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Runs the read-only ledger scan. Balance anomalies report WARNING rather than DOWN:
     * the service can still post, but an operator should look.
     */
    @Component("ledgerHealth")
    public static class LedgerHealthIndicator implements HealthIndicator {

        private final HealthMonitor healthMonitor;

        public LedgerHealthIndicator(HealthMonitor healthMonitor) {
            this.healthMonitor = healthMonitor;
        }

        @Override
        public Health health() {
            try {
                HealthReport report = healthMonitor.scan();
                Health.Builder builder = !report.getInvariantViolations().isEmpty()
                        ? Health.down()
                        : report.isHealthy() ? Health.up() : Health.status("WARNING");

                return builder
                        .withDetail("healthScore", report.getHealthScore())
                        .withDetail("accounts", report.getTotalAccounts())
                        .withDetail("negativeBalances", report.getNegativeBalances().size())
                        .withDetail("invariantViolations", report.getInvariantViolations().size())
                        .withDetail("volumeAnomalies", report.getVolumeAnomalies().size())
                        .withDetail("openDiscrepancies", report.getOpenDiscrepancies())
                        .withDetail("lastReconciliation", String.valueOf(report.getLastReconciliationStatus()))
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Redis backs the distribution idempotency fast path only.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Duplicate distributions are still rejected by the database";

        private final Optional<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(Optional<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            if (redisTemplate.isEmpty()) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis not configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            RedisConnectionFactory connectionFactory = redisTemplate.get().getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                        ? Health.up().withDetail("response", result).build()
                        : Health.down().withDetail("response", String.valueOf(result)).build();

            } catch (Exception e) {
                // Redis being down is acceptable (fallback to DB)
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
