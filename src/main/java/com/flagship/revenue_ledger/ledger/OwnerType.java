package com.flagship.revenue_ledger.ledger;

/**
 * Who owns a ledger account.
 */
public enum OwnerType {
    /** The marketplace itself; receives service charges. */
    PLATFORM_ADMIN,
    /** A hospital (or other payee) receiving its share of bookings. */
    PAYEE
}
