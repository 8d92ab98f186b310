package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

/**
 * Outcome of a successful posting: the re-read balance and the entry that produced it.
 */
@Value
public class UpdatedBalance {
    AccountBalance balance;
    LedgerEntry entry;

    /** Signed change applied to the balance by this posting. */
    public Money delta() {
        return entry.getBalanceAfter().subtract(entry.getBalanceBefore());
    }
}
