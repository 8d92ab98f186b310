package com.flagship.revenue_ledger.reconciliation;

import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Alert raised for one discrepancy. Created OPEN; becomes RESOLVED only through
 * {@link #resolve}, never automatically.
 */
@Value
public class DiscrepancyAlert {
    UUID id;
    UUID reconciliationId;
    LocalDate reconciliationDate;
    String accountKey;
    Money expectedAmount;
    Money actualAmount;
    Money differenceAmount;
    DiscrepancySeverity severity;
    DiscrepancyStatus status;
    String resolvedBy;
    Instant resolvedAt;
    String resolutionNotes;
    Instant createdAt;

    public static DiscrepancyAlert open(ReconciliationRecord record, Discrepancy discrepancy, Instant at) {
        return new DiscrepancyAlert(
            UUID.randomUUID(),
            record.getId(),
            record.getDate(),
            discrepancy.getAccountKey(),
            discrepancy.getExpectedAmount(),
            discrepancy.getActualAmount(),
            discrepancy.getDifferenceAmount(),
            discrepancy.getSeverity(),
            DiscrepancyStatus.OPEN,
            null,
            null,
            null,
            at
        );
    }

    public boolean isOpen() {
        return status == DiscrepancyStatus.OPEN;
    }

    /**
     * @throws ValidationException if the resolver or notes are missing
     * @throws IllegalStateException if the alert is already resolved
     */
    public DiscrepancyAlert resolve(String resolverId, String notes, Instant at) {
        if (resolverId == null || resolverId.isBlank()) {
            throw new ValidationException("Resolver id is required");
        }
        if (notes == null || notes.isBlank()) {
            throw new ValidationException("Resolution notes are required");
        }
        if (!isOpen()) {
            throw new IllegalStateException(String.format(
                "Discrepancy alert %s was already resolved by %s at %s", id, resolvedBy, resolvedAt));
        }
        return new DiscrepancyAlert(id, reconciliationId, reconciliationDate, accountKey, expectedAmount,
                actualAmount, differenceAmount, severity, DiscrepancyStatus.RESOLVED, resolverId, at,
                notes.trim(), createdAt);
    }
}
