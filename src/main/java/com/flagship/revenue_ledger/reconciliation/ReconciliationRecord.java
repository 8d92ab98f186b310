package com.flagship.revenue_ledger.reconciliation;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Outcome of reconciling one calendar day.
 *
 * Records are never mutated. When late entries change the outcome for a date
 * that was already reconciled, a new record with the next revision is stored
 * and the earlier one stays as history.
 */
@Value
public class ReconciliationRecord {
    UUID id;
    LocalDate date;
    int revision;
    Map<String, Money> expectedBalances;
    Map<String, Money> actualBalances;
    List<Discrepancy> discrepancies;
    ReconciliationStatus status;
    Instant createdAt;

    public static ReconciliationRecord create(LocalDate date, int revision,
                                              Map<String, Money> expectedBalances,
                                              Map<String, Money> actualBalances,
                                              List<Discrepancy> discrepancies,
                                              Instant createdAt) {
        return new ReconciliationRecord(
            UUID.randomUUID(),
            date,
            revision,
            Collections.unmodifiableMap(new TreeMap<>(expectedBalances)),
            Collections.unmodifiableMap(new TreeMap<>(actualBalances)),
            List.copyOf(discrepancies),
            discrepancies.isEmpty() ? ReconciliationStatus.RECONCILED : ReconciliationStatus.DISCREPANCY_FOUND,
            createdAt
        );
    }

    /**
     * True when both records carry the same expected, actual and discrepancy sets.
     */
    public boolean hasSameOutcome(ReconciliationRecord other) {
        return expectedBalances.equals(other.expectedBalances)
                && actualBalances.equals(other.actualBalances)
                && discrepancies.equals(other.discrepancies);
    }

    public boolean isReconciled() {
        return status == ReconciliationStatus.RECONCILED;
    }
}
