package com.flagship.revenue_ledger.reconciliation;

import com.flagship.revenue_ledger.ledger.EntryType;
import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Ledger activity and reconciliation outcomes over a date range (inclusive).
 */
@Value
public class AuditReport {
    LocalDate from;
    LocalDate to;
    Map<EntryType, EntryTypeSummary> entriesByType;
    int reconciliationRuns;
    int reconciledRuns;
    /** Percentage of reconciled dates, two decimals; zero when nothing was reconciled. */
    BigDecimal reconciledRate;
    int discrepanciesRaised;
    int discrepanciesResolved;
    int discrepanciesOutstanding;
    Instant generatedAt;

    public long totalEntries() {
        return entriesByType.values().stream().mapToLong(EntryTypeSummary::getCount).sum();
    }

    @Value
    public static class EntryTypeSummary {
        long count;
        Money totalAmount;

        public EntryTypeSummary plus(Money amount) {
            return new EntryTypeSummary(count + 1, totalAmount.add(amount));
        }
    }
}
