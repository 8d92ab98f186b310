package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored balance of one account plus its lifetime totals.
 *
 * Invariant: {@code currentBalance == totalCredits - totalDebits} (within tolerance).
 * Rows are created lazily on first posting and never deleted.
 * {@code version} increases by one on every posting and guards concurrent updates.
 */
@Value
public class AccountBalance {
    UUID id;
    AccountRef account;
    Money currentBalance;
    Money totalCredits;
    Money totalDebits;
    Money pendingAmount;
    Instant lastTransactionAt;
    long version;
    Instant createdAt;

    /**
     * A fresh zero balance for an account that has never been posted to.
     */
    public static AccountBalance open(UUID id, AccountRef account, Instant now) {
        return new AccountBalance(id, account, Money.ZERO, Money.ZERO, Money.ZERO, Money.ZERO,
                null, 0L, now);
    }

    /**
     * Returns the balance after applying one entry. Adjustments count towards the
     * credit or debit totals like any other entry, so the invariant is preserved.
     */
    public AccountBalance apply(EntryType type, Money amount, Instant at) {
        Money credits = type.isCredit() ? totalCredits.add(amount) : totalCredits;
        Money debits = type.isCredit() ? totalDebits : totalDebits.add(amount);
        return new AccountBalance(
            id,
            account,
            type.applyTo(currentBalance, amount),
            credits,
            debits,
            pendingAmount,
            at,
            version + 1,
            createdAt
        );
    }

    /**
     * Difference between the stored balance and the balance implied by the totals.
     */
    public Money invariantGap() {
        return currentBalance.subtract(totalCredits.subtract(totalDebits));
    }

    public boolean isConsistent(Money tolerance) {
        return invariantGap().abs().compareTo(tolerance) <= 0;
    }
}
