package com.flagship.revenue_ledger.reconciliation;

import com.flagship.revenue_ledger.ledger.EntryType;
import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.support.LedgerFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AuditReportGeneratorTest {

    @Test
    @DisplayName("Report aggregates entries by type, reconciliation rate and discrepancy totals")
    void periodReport() {
        LedgerFixture fixture = new LedgerFixture();

        fixture.clock.set(LedgerFixture.START.minus(Duration.ofDays(1)));
        fixture.distributor.distribute("tx-1", Money.of(1000), LedgerFixture.SCOPE);
        fixture.clock.set(LedgerFixture.START);
        fixture.distributor.distribute("tx-2", Money.of(200), LedgerFixture.SCOPE);
        fixture.distributor.refund("tx-2", Money.of(100), "admin-1");
        fixture.corrections.correct(fixture.payee(), Money.of("1045.00"), Money.of("1050.00"), "rounding", null, "admin-1");

        fixture.reconciliation.reconcile(LedgerFixture.TODAY.minusDays(1));
        fixture.db.overwriteBalance(fixture.platform(), Money.of("100.00"), Money.of("100.00"), Money.ZERO);
        fixture.reconciliation.reconcile(LedgerFixture.TODAY);
        DiscrepancyAlert alert = fixture.reconciliation.outstandingDiscrepancies(null, null).get(0);
        fixture.reconciliation.resolveDiscrepancy(alert.getId(), "admin-1", "manual fix pending");

        AuditReport report = fixture.auditReports.auditReport(LedgerFixture.TODAY.minusDays(1), LedgerFixture.TODAY);

        assertEquals(4, report.getEntriesByType().get(EntryType.CREDIT).getCount());
        assertEquals(Money.of(1200), report.getEntriesByType().get(EntryType.CREDIT).getTotalAmount());
        assertEquals(2, report.getEntriesByType().get(EntryType.DEBIT).getCount());
        assertEquals(Money.of(100), report.getEntriesByType().get(EntryType.DEBIT).getTotalAmount());
        assertEquals(1, report.getEntriesByType().get(EntryType.CREDIT_ADJUSTMENT).getCount());
        assertEquals(0, report.getEntriesByType().get(EntryType.DEBIT_ADJUSTMENT).getCount());
        assertEquals(7, report.totalEntries());

        assertEquals(2, report.getReconciliationRuns());
        assertEquals(1, report.getReconciledRuns());
        assertEquals(new BigDecimal("50.00"), report.getReconciledRate());
        assertEquals(1, report.getDiscrepanciesRaised());
        assertEquals(1, report.getDiscrepanciesResolved());
        assertEquals(0, report.getDiscrepanciesOutstanding());
    }

    @Test
    @DisplayName("An empty period has a zero reconciled rate")
    void emptyPeriod() {
        LedgerFixture fixture = new LedgerFixture();

        AuditReport report = fixture.auditReports.auditReport(LedgerFixture.TODAY, LedgerFixture.TODAY);

        assertEquals(0, report.totalEntries());
        assertEquals(0, report.getReconciliationRuns());
        assertEquals(new BigDecimal("0.00"), report.getReconciledRate());
        assertThrows(IllegalArgumentException.class,
                () -> fixture.auditReports.auditReport(LedgerFixture.TODAY, LedgerFixture.TODAY.minusDays(1)));
    }
}
