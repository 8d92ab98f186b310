package com.flagship.revenue_ledger.reconciliation;

import com.flagship.revenue_ledger.audit.AuditEvent;
import com.flagship.revenue_ledger.audit.AuditEventType;
import com.flagship.revenue_ledger.audit.AuditTrail;
import com.flagship.revenue_ledger.config.LedgerProperties;
import com.flagship.revenue_ledger.events.DiscrepancyDetectedEvent;
import com.flagship.revenue_ledger.events.LedgerEventPublisher;
import com.flagship.revenue_ledger.ledger.AccountRef;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.ledger.TransactionRunner;
import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.notification.AlertLevel;
import com.flagship.revenue_ledger.notification.LedgerAlert;
import com.flagship.revenue_ledger.notification.NotificationGateway;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
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
import java.util.TreeSet;
import java.util.UUID;

/**
 * Verifies stored balances against an independent replay of the ledger, one calendar day at a time.
 *
 * Replay works only from immutable ledger entries, so reconciling the same date twice
 * over the same ledger gives the same result. Discrepancies are persisted and alerted,
 * never thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationEngine {

    private final LedgerStore ledgerStore;
    private final ReconciliationRepository repository;
    private final TransactionRunner transactionRunner;
    private final LedgerEventPublisher eventPublisher;
    private final NotificationGateway notificationGateway;
    private final AuditTrail auditTrail;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Reconciles all accounts touched on {@code date} (in {@code ledger.zone}).
     *
     * @return the stored record; an unchanged earlier record when nothing changed since the last run
     */
    public ReconciliationRecord reconcile(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("Reconciliation date is required");
        }
        long startNanos = System.nanoTime();
        Instant from = date.atStartOfDay(properties.getZone()).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(properties.getZone()).toInstant();

        Map<String, Money> expected = replay(from, to);
        Map<String, Money> actual = new TreeMap<>();
        for (String accountKey : expected.keySet()) {
            actual.put(accountKey, ledgerStore.balanceAt(AccountRef.fromKey(accountKey), to));
        }
        List<Discrepancy> discrepancies = compare(expected, actual);

        Outcome outcome = transactionRunner.inTransaction(() -> persist(date, expected, actual, discrepancies));
        ReconciliationRecord record = outcome.record;

        if (outcome.unchanged) {
            log.info("Reconciliation for {} unchanged since revision {}: status={}, accounts={}",
                    date, record.getRevision(), record.getStatus(), expected.size());
            metrics.recordReconciliation("unchanged");
            return record;
        }

        metrics.recordReconciliation(record.getStatus().name());
        for (DiscrepancyAlert alert : outcome.openedAlerts) {
            metrics.recordDiscrepancy(alert.getSeverity().name());
            raiseDiscrepancyAlert(alert);
        }
        log.info("Reconciled {}: revision={}, status={}, accounts={}, discrepancies={}, newAlerts={}, duration={}ms",
                date, record.getRevision(), record.getStatus(), expected.size(), discrepancies.size(),
                outcome.openedAlerts.size(), (System.nanoTime() - startNanos) / 1_000_000);
        return record;
    }

    private Map<String, Money> replay(Instant from, Instant to) {
        Map<String, Money> expected = new TreeMap<>();
        for (LedgerEntry entry : ledgerStore.findEntriesBetween(from, to)) {
            String accountKey = entry.getAccount().key();
            Money running = expected.computeIfAbsent(accountKey, key -> ledgerStore
                .findLastEntryBefore(entry.getAccount(), from)
                .map(LedgerEntry::getBalanceAfter)
                .orElse(Money.ZERO));
            expected.put(accountKey, running.add(entry.signedAmount()));
        }
        return expected;
    }

    private List<Discrepancy> compare(Map<String, Money> expected, Map<String, Money> actual) {
        Money tolerance = Money.of(properties.getTolerance());
        Money highThreshold = Money.of(properties.getReconciliation().getHighSeverityThreshold());

        TreeSet<String> accounts = new TreeSet<>(expected.keySet());
        accounts.addAll(actual.keySet());

        List<Discrepancy> discrepancies = new ArrayList<>();
        for (String accountKey : accounts) {
            Money expectedAmount = expected.getOrDefault(accountKey, Money.ZERO);
            Money actualAmount = actual.getOrDefault(accountKey, Money.ZERO);
            Money difference = actualAmount.subtract(expectedAmount);
            if (difference.abs().isGreaterThan(tolerance)) {
                discrepancies.add(new Discrepancy(accountKey, expectedAmount, actualAmount, difference,
                        DiscrepancySeverity.classify(difference, highThreshold)));
            }
        }
        return discrepancies;
    }

    private Outcome persist(LocalDate date, Map<String, Money> expected, Map<String, Money> actual,
                            List<Discrepancy> discrepancies) {
        Instant now = clock.instant();
        Optional<ReconciliationRecord> previous = repository.findLatest(date);
        int revision = previous.map(r -> r.getRevision() + 1).orElse(1);
        ReconciliationRecord candidate = ReconciliationRecord.create(date, revision, expected, actual,
                discrepancies, now);

        if (previous.isPresent() && previous.get().hasSameOutcome(candidate)) {
            return new Outcome(previous.get(), List.of(), true);
        }

        repository.saveRecord(candidate);

        List<DiscrepancyAlert> opened = new ArrayList<>();
        for (Discrepancy discrepancy : candidate.getDiscrepancies()) {
            if (repository.hasOpenAlert(date, discrepancy.getAccountKey())) {
                continue;
            }
            DiscrepancyAlert alert = DiscrepancyAlert.open(candidate, discrepancy, now);
            repository.saveAlert(alert);
            eventPublisher.publish(new DiscrepancyDetectedEvent(
                UUID.randomUUID(),
                alert.getId(),
                date,
                alert.getAccountKey(),
                alert.getExpectedAmount(),
                alert.getActualAmount(),
                alert.getDifferenceAmount(),
                alert.getSeverity().name(),
                now
            ));
            opened.add(alert);
        }
        return new Outcome(candidate, opened, false);
    }

    /**
     * Closes an open alert. Resolution is the only transition an alert ever makes.
     *
     * @throws IllegalArgumentException if no alert has this id
     * @throws IllegalStateException if the alert is already resolved
     * @throws com.flagship.revenue_ledger.exception.ValidationException if the actor or notes are blank
     */
    public DiscrepancyAlert resolveDiscrepancy(UUID alertId, String adminActorId, String notes) {
        DiscrepancyAlert resolved = transactionRunner.inTransaction(() -> {
            DiscrepancyAlert alert = repository.findAlert(alertId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown discrepancy alert " + alertId));
            DiscrepancyAlert updated = alert.resolve(adminActorId, notes, clock.instant());
            repository.updateAlert(updated);
            return updated;
        });

        log.info("Discrepancy {} for {} on {} resolved by {}",
                resolved.getId(), resolved.getAccountKey(), resolved.getReconciliationDate(), adminActorId);

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", Map.of("from", DiscrepancyStatus.OPEN.name(), "to", DiscrepancyStatus.RESOLVED.name()));
        changes.put("account", resolved.getAccountKey());
        changes.put("differenceAmount", resolved.getDifferenceAmount().toBigDecimal());
        try {
            auditTrail.record(AuditEvent.of(AuditEventType.DISCREPANCY_RESOLVED, "DiscrepancyAlert",
                    resolved.getId().toString(), adminActorId, changes, resolved.getResolutionNotes(),
                    resolved.getResolvedAt()));
        } catch (RuntimeException e) {
            log.warn("Best-effort audit write failed for discrepancy {}: {}", resolved.getId(), e.getMessage());
        }
        return resolved;
    }

    /**
     * Open alerts, optionally narrowed by severity and account key (null matches any).
     */
    public List<DiscrepancyAlert> outstandingDiscrepancies(DiscrepancySeverity severity, String accountKey) {
        return repository.findOpenAlerts().stream()
            .filter(a -> severity == null || a.getSeverity() == severity)
            .filter(a -> accountKey == null || a.getAccountKey().equals(accountKey))
            .toList();
    }

    public List<ReconciliationRecord> history(LocalDate from, LocalDate to, ReconciliationStatus status) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new IllegalArgumentException("Invalid history range " + from + " to " + to);
        }
        return repository.findHistory(from, to).stream()
            .filter(r -> status == null || r.getStatus() == status)
            .toList();
    }

    public Optional<ReconciliationRecord> latest(LocalDate date) {
        return repository.findLatest(date);
    }

    private void raiseDiscrepancyAlert(DiscrepancyAlert alert) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("alertId", alert.getId().toString());
        details.put("reconciliationDate", alert.getReconciliationDate().toString());
        details.put("account", alert.getAccountKey());
        details.put("expected", alert.getExpectedAmount().toBigDecimal());
        details.put("actual", alert.getActualAmount().toBigDecimal());
        details.put("difference", alert.getDifferenceAmount().toBigDecimal());

        AlertLevel level = alert.getSeverity() == DiscrepancySeverity.HIGH ? AlertLevel.HIGH : AlertLevel.MEDIUM;
        notificationGateway.raiseAlert(LedgerAlert.of("RECONCILIATION_DISCREPANCY", level,
                String.format("Balance discrepancy of %s on %s for %s",
                        alert.getDifferenceAmount().format(), alert.getReconciliationDate(), alert.getAccountKey()),
                details, clock.instant()));
    }

    private static final class Outcome {
        final ReconciliationRecord record;
        final List<DiscrepancyAlert> openedAlerts;
        final boolean unchanged;

        Outcome(ReconciliationRecord record, List<DiscrepancyAlert> openedAlerts, boolean unchanged) {
            this.record = record;
            this.openedAlerts = openedAlerts;
            this.unchanged = unchanged;
        }
    }
}
