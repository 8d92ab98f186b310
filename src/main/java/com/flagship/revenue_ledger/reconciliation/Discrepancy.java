package com.flagship.revenue_ledger.reconciliation;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

/**
 * Mismatch between replayed and stored balance for one account; difference = actual - expected.
 */
@Value
public class Discrepancy {
    String accountKey;
    Money expectedAmount;
    Money actualAmount;
    Money differenceAmount;
    DiscrepancySeverity severity;
}
