package com.flagship.revenue_ledger.reconciliation;

import com.flagship.revenue_ledger.money.Money;

public enum DiscrepancySeverity {
    MEDIUM,
    HIGH;

    /**
     * HIGH when the absolute difference is strictly above the threshold.
     */
    public static DiscrepancySeverity classify(Money difference, Money highThreshold) {
        return difference.abs().isGreaterThan(highThreshold) ? HIGH : MEDIUM;
    }
}
