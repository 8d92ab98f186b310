package com.flagship.revenue_ledger.reconciliation;

import com.flagship.revenue_ledger.config.LedgerProperties;
import com.flagship.revenue_ledger.ledger.EntryType;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.money.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuditReportGenerator {

    private final LedgerStore ledgerStore;
    private final ReconciliationRepository repository;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Builds the report for {@code [from, to]}. Only the latest revision of each date counts
     * towards the reconciliation figures.
     */
    public AuditReport auditReport(LocalDate from, LocalDate to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new IllegalArgumentException("Invalid report range " + from + " to " + to);
        }
        Instant start = from.atStartOfDay(properties.getZone()).toInstant();
        Instant end = to.plusDays(1).atStartOfDay(properties.getZone()).toInstant();

        Map<EntryType, AuditReport.EntryTypeSummary> byType = new EnumMap<>(EntryType.class);
        for (EntryType type : EntryType.values()) {
            byType.put(type, new AuditReport.EntryTypeSummary(0, Money.ZERO));
        }
        for (LedgerEntry entry : ledgerStore.findEntriesBetween(start, end)) {
            byType.computeIfPresent(entry.getEntryType(), (type, summary) -> summary.plus(entry.getAmount()));
        }

        Map<LocalDate, ReconciliationRecord> latestPerDate = new TreeMap<>();
        for (ReconciliationRecord record : repository.findHistory(from, to)) {
            latestPerDate.merge(record.getDate(), record,
                    (a, b) -> a.getRevision() >= b.getRevision() ? a : b);
        }
        int runs = latestPerDate.size();
        int reconciled = (int) latestPerDate.values().stream().filter(ReconciliationRecord::isReconciled).count();
        BigDecimal rate = runs == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(reconciled * 100L).divide(BigDecimal.valueOf(runs), 2, RoundingMode.HALF_UP);

        List<DiscrepancyAlert> alerts = repository.findAlertsForDates(from, to);
        int resolved = (int) alerts.stream().filter(a -> !a.isOpen()).count();

        AuditReport report = new AuditReport(
            from,
            to,
            Collections.unmodifiableMap(byType),
            runs,
            reconciled,
            rate,
            alerts.size(),
            resolved,
            alerts.size() - resolved,
            clock.instant()
        );
        log.info("Audit report {} to {}: entries={}, reconciliations={}, reconciledRate={}%, outstanding={}",
                from, to, report.totalEntries(), runs, rate, report.getDiscrepanciesOutstanding());
        return report;
    }
}
