package com.flagship.revenue_ledger.reconciliation;

import com.flagship.revenue_ledger.config.LedgerProperties;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.notification.AlertLevel;
import com.flagship.revenue_ledger.notification.LedgerAlert;
import com.flagship.revenue_ledger.notification.NotificationGateway;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Periodic sanity pass over recently written ledger entries.
 *
 * Checks performed:
 * - every entry satisfies balanceAfter == balanceBefore +/- amount
 * - consecutive entries of one account chain: balanceBefore equals the previous balanceAfter
 * - no account received the same external reference twice with the same entry type
 *   within the duplicate window
 *
 * Read-only; any issue is logged and alerted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerIntegrityVerifier {

    private final LedgerStore ledgerStore;
    private final NotificationGateway notificationGateway;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final Clock clock;

    public IntegrityReport verifyRecent() {
        return verifyRecent(Duration.ofMinutes(properties.getIntegrity().getWindowMinutes()));
    }

    public IntegrityReport verifyRecent(Duration window) {
        Instant to = clock.instant();
        return verify(to.minus(window), to);
    }

    public IntegrityReport verify(Instant from, Instant to) {
        Money tolerance = Money.of(properties.getTolerance());
        Duration duplicateWindow = Duration.ofMinutes(properties.getIntegrity().getDuplicateWindowMinutes());

        List<LedgerEntry> entries = ledgerStore.findEntriesBetween(from, to);
        List<IntegrityReport.Issue> issues = new ArrayList<>();
        Map<String, LedgerEntry> previousByAccount = new HashMap<>();
        Map<String, LedgerEntry> lastByPostingKey = new HashMap<>();

        for (LedgerEntry entry : entries) {
            String accountKey = entry.getAccount().key();

            if (!entry.isArithmeticallyValid(tolerance)) {
                issues.add(issue(IntegrityReport.IssueType.ARITHMETIC, entry, String.format(
                    "%s %s %s recorded as %s", entry.getBalanceBefore(), entry.getEntryType(),
                    entry.getAmount(), entry.getBalanceAfter())));
            }

            LedgerEntry previous = previousByAccount.put(accountKey, entry);
            if (previous != null
                    && !Money.equalsWithinTolerance(previous.getBalanceAfter(), entry.getBalanceBefore(), tolerance)) {
                issues.add(issue(IntegrityReport.IssueType.CHAIN_BREAK, entry, String.format(
                    "balanceBefore %s does not follow previous balanceAfter %s (entry %s)",
                    entry.getBalanceBefore(), previous.getBalanceAfter(), previous.getId())));
            }

            if (entry.getExternalTransactionRef() != null) {
                String postingKey = accountKey + "|" + entry.getExternalTransactionRef() + "|" + entry.getEntryType();
                LedgerEntry earlier = lastByPostingKey.put(postingKey, entry);
                if (earlier != null
                        && Duration.between(earlier.getCreatedAt(), entry.getCreatedAt()).compareTo(duplicateWindow) <= 0) {
                    issues.add(issue(IntegrityReport.IssueType.DUPLICATE_POSTING, entry, String.format(
                        "reference %s posted twice as %s (first entry %s)",
                        entry.getExternalTransactionRef(), entry.getEntryType(), earlier.getId())));
                }
            }
        }

        IntegrityReport report = new IntegrityReport(from, to, entries.size(), List.copyOf(issues));
        if (report.isClean()) {
            log.debug("Integrity check clean: {} entries between {} and {}", entries.size(), from, to);
        } else {
            report.getIssues().forEach(i -> log.error("Integrity issue {} on {}: entry={}, {}",
                    i.getType(), i.getAccountKey(), i.getEntryId(), i.getDetail()));
            metrics.recordIntegrityFailure("verify");
            raiseAlert(report);
        }
        return report;
    }

    private void raiseAlert(IntegrityReport report) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("windowStart", report.getWindowStart().toString());
        details.put("windowEnd", report.getWindowEnd().toString());
        details.put("entriesChecked", report.getEntriesChecked());
        details.put("issueCount", report.getIssues().size());
        details.put("issueTypes", report.getIssues().stream().map(i -> i.getType().name()).distinct().toList());
        notificationGateway.raiseAlert(LedgerAlert.of("LEDGER_INTEGRITY_CHECK", AlertLevel.HIGH,
                report.getIssues().size() + " integrity issue(s) in recent ledger entries", details, clock.instant()));
    }

    private static IntegrityReport.Issue issue(IntegrityReport.IssueType type, LedgerEntry entry, String detail) {
        return new IntegrityReport.Issue(type, entry.getAccount().key(), entry.getId().toString(), detail);
    }
}
