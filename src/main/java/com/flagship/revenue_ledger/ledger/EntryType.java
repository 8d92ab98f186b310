package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.money.Money;

/**
 * Type of a ledger entry. The amount on an entry is always positive;
 * the direction comes from the entry type.
 *
 * Adjustments are only written by manual balance corrections.
 */
public enum EntryType {
    CREDIT(1, false),
    DEBIT(-1, false),
    CREDIT_ADJUSTMENT(1, true),
    DEBIT_ADJUSTMENT(-1, true);

    private final int sign;
    private final boolean adjustment;

    EntryType(int sign, boolean adjustment) {
        this.sign = sign;
        this.adjustment = adjustment;
    }

    public boolean isCredit() {
        return sign > 0;
    }

    public boolean isAdjustment() {
        return adjustment;
    }

    /**
     * Signed effect of an entry of this type on the balance.
     */
    public Money signed(Money amount) {
        return sign > 0 ? amount : amount.negate();
    }

    public Money applyTo(Money balance, Money amount) {
        return balance.add(signed(amount));
    }

    /**
     * Adjustment type that moves a balance by {@code difference}: credit when positive,
     * debit when negative.
     */
    public static EntryType adjustmentFor(Money difference) {
        return difference.isNegative() ? DEBIT_ADJUSTMENT : CREDIT_ADJUSTMENT;
    }
}
