package com.flagship.revenue_ledger.health;

import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.reconciliation.ReconciliationStatus;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Snapshot of ledger health produced by {@link HealthMonitor}.
 */
@Value
public class HealthReport {
    HealthStatus status;
    /** 100 - negativeBalanceAccounts * 100 / totalAccounts (integer division); 100 with no accounts. */
    int healthScore;
    int totalAccounts;
    List<AccountIssue> negativeBalances;
    List<AccountIssue> excessiveBalances;
    List<AccountIssue> invariantViolations;
    List<AccountIssue> lowBalances;
    List<VolumeAnomaly> volumeAnomalies;
    int openDiscrepancies;
    int highSeverityOpenDiscrepancies;
    LocalDate lastReconciliationDate;
    ReconciliationStatus lastReconciliationStatus;
    Instant checkedAt;

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    public int issueCount() {
        return negativeBalances.size() + excessiveBalances.size() + invariantViolations.size()
                + volumeAnomalies.size() + openDiscrepancies;
    }

    public enum HealthStatus {
        HEALTHY,
        ISSUES_DETECTED
    }

    @Value
    public static class AccountIssue {
        String accountKey;
        Money currentBalance;
        String detail;
    }

    @Value
    public static class VolumeAnomaly {
        LocalDate date;
        long transactionCount;
        Money volume;
        String detail;
    }
}
