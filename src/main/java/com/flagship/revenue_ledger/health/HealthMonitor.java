package com.flagship.revenue_ledger.health;

import com.flagship.revenue_ledger.config.LedgerProperties;
import com.flagship.revenue_ledger.ledger.AccountBalance;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.ledger.OwnerType;
import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.notification.AlertLevel;
import com.flagship.revenue_ledger.notification.LedgerAlert;
import com.flagship.revenue_ledger.notification.NotificationGateway;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import com.flagship.revenue_ledger.reconciliation.DiscrepancyAlert;
import com.flagship.revenue_ledger.reconciliation.DiscrepancySeverity;
import com.flagship.revenue_ledger.reconciliation.ReconciliationRecord;
import com.flagship.revenue_ledger.reconciliation.ReconciliationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only scan of balances, recent volume and reconciliation state.
 *
 * {@link #scan()} has no side effects and backs the actuator indicator.
 * {@link #checkHealth()} additionally raises alerts and updates the health gauge.
 * Neither ever writes to the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthMonitor {

    private final LedgerStore ledgerStore;
    private final ReconciliationRepository reconciliationRepository;
    private final NotificationGateway notificationGateway;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final Clock clock;

    public HealthReport checkHealth() {
        HealthReport report = scan();
        metrics.updateHealthScore(report.getHealthScore());

        if (report.isHealthy()) {
            log.info("Ledger health check passed: accounts={}, score={}", report.getTotalAccounts(), report.getHealthScore());
        } else {
            log.warn("Ledger health issues: score={}, negative={}, excessive={}, invariant={}, volume={}, openDiscrepancies={}",
                    report.getHealthScore(), report.getNegativeBalances().size(), report.getExcessiveBalances().size(),
                    report.getInvariantViolations().size(), report.getVolumeAnomalies().size(),
                    report.getOpenDiscrepancies());
            raiseAlerts(report);
        }
        return report;
    }

    public HealthReport scan() {
        LedgerProperties.Health limits = properties.getHealth();
        Money tolerance = Money.of(properties.getTolerance());
        Money maxBalance = Money.of(limits.getMaxBalance());
        Money lowBalance = Money.of(limits.getLowBalanceThreshold());

        List<AccountBalance> balances = ledgerStore.findAllBalances();
        List<HealthReport.AccountIssue> negative = new ArrayList<>();
        List<HealthReport.AccountIssue> excessive = new ArrayList<>();
        List<HealthReport.AccountIssue> invariant = new ArrayList<>();
        List<HealthReport.AccountIssue> low = new ArrayList<>();

        for (AccountBalance balance : balances) {
            String key = balance.getAccount().key();
            Money current = balance.getCurrentBalance();
            if (current.isNegative()) {
                negative.add(new HealthReport.AccountIssue(key, current, "negative balance"));
            }
            if (current.isGreaterThan(maxBalance)) {
                excessive.add(new HealthReport.AccountIssue(key, current, "above " + maxBalance.format()));
            }
            if (!balance.isConsistent(tolerance)) {
                invariant.add(new HealthReport.AccountIssue(key, current,
                        "credits - debits differs by " + balance.invariantGap()));
            }
            if (balance.getAccount().getOwnerType() == OwnerType.PAYEE
                    && !current.isNegative() && current.isLessThan(lowBalance)) {
                low.add(new HealthReport.AccountIssue(key, current, "below " + lowBalance.format()));
            }
        }

        List<DiscrepancyAlert> open = reconciliationRepository.findOpenAlerts();
        int highOpen = (int) open.stream().filter(a -> a.getSeverity() == DiscrepancySeverity.HIGH).count();
        Optional<ReconciliationRecord> lastReconciliation = reconciliationRepository.findMostRecent();

        int score = balances.isEmpty() ? 100 : 100 - (negative.size() * 100) / balances.size();
        boolean healthy = negative.isEmpty() && excessive.isEmpty() && invariant.isEmpty() && open.isEmpty();
        List<HealthReport.VolumeAnomaly> anomalies = volumeAnomalies(limits);
        healthy = healthy && anomalies.isEmpty();

        return new HealthReport(
            healthy ? HealthReport.HealthStatus.HEALTHY : HealthReport.HealthStatus.ISSUES_DETECTED,
            score,
            balances.size(),
            List.copyOf(negative),
            List.copyOf(excessive),
            List.copyOf(invariant),
            List.copyOf(low),
            anomalies,
            open.size(),
            highOpen,
            lastReconciliation.map(ReconciliationRecord::getDate).orElse(null),
            lastReconciliation.map(ReconciliationRecord::getStatus).orElse(null),
            clock.instant()
        );
    }

    private List<HealthReport.VolumeAnomaly> volumeAnomalies(LedgerProperties.Health limits) {
        LocalDate today = LocalDate.now(clock.withZone(properties.getZone()));
        LocalDate firstDay = today.minusDays(limits.getVolumeLookbackDays() - 1L);
        Instant from = firstDay.atStartOfDay(properties.getZone()).toInstant();
        Instant to = today.plusDays(1).atStartOfDay(properties.getZone()).toInstant();

        Map<LocalDate, long[]> counts = new TreeMap<>();
        Map<LocalDate, Money> volumes = new TreeMap<>();
        for (LedgerEntry entry : ledgerStore.findEntriesBetween(from, to)) {
            LocalDate day = entry.getCreatedAt().atZone(properties.getZone()).toLocalDate();
            counts.computeIfAbsent(day, d -> new long[1])[0]++;
            volumes.merge(day, entry.getAmount(), Money::add);
        }

        Money maxVolume = Money.of(limits.getMaxDailyVolume());
        List<HealthReport.VolumeAnomaly> anomalies = new ArrayList<>();
        counts.forEach((day, count) -> {
            Money volume = volumes.get(day);
            boolean tooMany = count[0] > limits.getMaxDailyTransactionCount();
            boolean tooMuch = volume.isGreaterThan(maxVolume);
            if (tooMany || tooMuch) {
                String detail = tooMany && tooMuch ? "transaction count and volume above limits"
                        : tooMany ? "transaction count above " + limits.getMaxDailyTransactionCount()
                        : "volume above " + maxVolume.format();
                anomalies.add(new HealthReport.VolumeAnomaly(day, count[0], volume, detail));
            }
        });
        return List.copyOf(anomalies);
    }

    private void raiseAlerts(HealthReport report) {
        Instant now = clock.instant();
        if (!report.getInvariantViolations().isEmpty()) {
            notificationGateway.raiseAlert(LedgerAlert.of("BALANCE_INVARIANT_VIOLATION", AlertLevel.CRITICAL,
                    report.getInvariantViolations().size() + " account(s) violate currentBalance == credits - debits",
                    accountDetails(report.getInvariantViolations()), now));
        }
        if (!report.getNegativeBalances().isEmpty()) {
            notificationGateway.raiseAlert(LedgerAlert.of("NEGATIVE_BALANCE", AlertLevel.HIGH,
                    report.getNegativeBalances().size() + " account(s) have a negative balance",
                    accountDetails(report.getNegativeBalances()), now));
        }
        if (!report.getExcessiveBalances().isEmpty()) {
            notificationGateway.raiseAlert(LedgerAlert.of("EXCESSIVE_BALANCE", AlertLevel.MEDIUM,
                    report.getExcessiveBalances().size() + " account(s) exceed the maximum balance",
                    accountDetails(report.getExcessiveBalances()), now));
        }
        for (HealthReport.VolumeAnomaly anomaly : report.getVolumeAnomalies()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("date", anomaly.getDate().toString());
            details.put("transactionCount", anomaly.getTransactionCount());
            details.put("volume", anomaly.getVolume().toBigDecimal());
            notificationGateway.raiseAlert(LedgerAlert.of("VOLUME_ANOMALY", AlertLevel.MEDIUM,
                    "Unusual ledger volume on " + anomaly.getDate() + ": " + anomaly.getDetail(), details, now));
        }
        if (report.getHighSeverityOpenDiscrepancies() > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("openDiscrepancies", report.getOpenDiscrepancies());
            details.put("highSeverity", report.getHighSeverityOpenDiscrepancies());
            notificationGateway.raiseAlert(LedgerAlert.of("OPEN_DISCREPANCIES", AlertLevel.HIGH,
                    report.getHighSeverityOpenDiscrepancies() + " high severity discrepancies are unresolved",
                    details, now));
        }
    }

    private static Map<String, Object> accountDetails(List<HealthReport.AccountIssue> issues) {
        Map<String, Object> details = new LinkedHashMap<>();
        issues.forEach(issue -> details.put(issue.getAccountKey(), issue.getCurrentBalance().toBigDecimal()));
        return details;
    }
}
