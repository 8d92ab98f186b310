package com.flagship.revenue_ledger.scheduling;

import com.flagship.revenue_ledger.config.LedgerProperties;
import com.flagship.revenue_ledger.health.HealthMonitor;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.reconciliation.LedgerIntegrityVerifier;
import com.flagship.revenue_ledger.reconciliation.ReconciliationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Background ledger jobs. Each run gets its own correlation id, and a failing
 * run is logged without stopping later runs.
 */
@Component
@ConditionalOnProperty(name = "ledger.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerJobsScheduler {

    private final ReconciliationEngine reconciliationEngine;
    private final HealthMonitor healthMonitor;
    private final LedgerIntegrityVerifier integrityVerifier;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Reconciles the previous calendar day.
     */
    @Scheduled(cron = "${ledger.scheduler.reconciliation-cron:0 0 2 * * *}", zone = "${ledger.zone:Asia/Dhaka}")
    public void reconcileYesterday() {
        LocalDate yesterday = LocalDate.now(clock.withZone(properties.getZone())).minusDays(1);
        runJob("reconciliation", () -> reconciliationEngine.reconcile(yesterday));
    }

    @Scheduled(cron = "${ledger.scheduler.health-cron:0 0 */4 * * *}", zone = "${ledger.zone:Asia/Dhaka}")
    public void checkHealth() {
        runJob("health-check", healthMonitor::checkHealth);
    }

    @Scheduled(fixedRateString = "${ledger.scheduler.integrity-interval-ms:1800000}",
               initialDelayString = "${ledger.scheduler.integrity-initial-delay-ms:60000}")
    public void verifyIntegrity() {
        runJob("integrity-check", integrityVerifier::verifyRecent);
    }

    private void runJob(String name, Runnable job) {
        try (CorrelationContext.Scope ignored = CorrelationContext.open("job-" + CorrelationContext.generateCorrelationId())) {
            long start = System.currentTimeMillis();
            try {
                job.run();
                log.info("Scheduled job {} finished in {}ms", name, System.currentTimeMillis() - start);
            } catch (RuntimeException e) {
                log.error("Scheduled job {} failed: {}", name, e.getMessage(), e);
            }
        }
    }
}
