package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.exception.ValidationException;

import java.util.Locale;

/**
 * Status of a payment as reported by the payment subsystem.
 * Only {@link #COMPLETED} payments are eligible for distribution.
 */
public enum PaymentStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED,
    REFUNDED;

    /**
     * Maps the upstream status text ("completed", "Completed", ...) to a status.
     */
    public static PaymentStatus fromExternal(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Payment status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown payment status: " + value);
        }
    }
}
