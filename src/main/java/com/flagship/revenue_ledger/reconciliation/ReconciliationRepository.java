package com.flagship.revenue_ledger.reconciliation;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage port for reconciliation records and discrepancy alerts.
 */
public interface ReconciliationRepository {

    void saveRecord(ReconciliationRecord record);

    /**
     * Highest revision stored for the date.
     */
    Optional<ReconciliationRecord> findLatest(LocalDate date);

    /**
     * Latest revision of the most recently reconciled date.
     */
    Optional<ReconciliationRecord> findMostRecent();

    /**
     * All revisions for dates in [from, to], ordered by date then revision.
     */
    List<ReconciliationRecord> findHistory(LocalDate from, LocalDate to);

    void saveAlert(DiscrepancyAlert alert);

    void updateAlert(DiscrepancyAlert alert);

    Optional<DiscrepancyAlert> findAlert(UUID alertId);

    List<DiscrepancyAlert> findOpenAlerts();

    boolean hasOpenAlert(LocalDate reconciliationDate, String accountKey);

    /**
     * Alerts raised for reconciliation dates in [from, to].
     */
    List<DiscrepancyAlert> findAlertsForDates(LocalDate from, LocalDate to);
}
