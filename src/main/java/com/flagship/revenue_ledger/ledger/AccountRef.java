package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.ValidationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Identity of an account balance: (ownerId, ownerType, optional scopeId).
 *
 * The scope is typically a hospital id. A missing scope is represented as
 * {@code null} here and as an empty string in storage.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountRef {

    private static final String SEPARATOR = ":";

    String ownerId;
    OwnerType ownerType;
    String scopeId;

    public static AccountRef of(String ownerId, OwnerType ownerType, String scopeId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Account owner id is required");
        }
        if (ownerId.contains(SEPARATOR)) {
            throw new ValidationException("Account owner id must not contain '" + SEPARATOR + "': " + ownerId);
        }
        if (ownerType == null) {
            throw new ValidationException("Account owner type is required");
        }
        String scope = scopeId == null || scopeId.isBlank() ? null : scopeId.trim();
        return new AccountRef(ownerId.trim(), ownerType, scope);
    }

    public static AccountRef platform(String ownerId) {
        return of(ownerId, OwnerType.PLATFORM_ADMIN, null);
    }

    public static AccountRef payee(String ownerId, String scopeId) {
        return of(ownerId, OwnerType.PAYEE, scopeId);
    }

    public boolean hasScope() {
        return scopeId != null;
    }

    /** Scope as stored in the database; never null. */
    public String storageScope() {
        return scopeId == null ? "" : scopeId;
    }

    /**
     * Stable textual key, e.g. {@code PAYEE:hospital-owner-7:H1}. Used as the
     * map key in reconciliation records and discrepancy alerts.
     */
    public String key() {
        String key = ownerType.name() + SEPARATOR + ownerId;
        return hasScope() ? key + SEPARATOR + scopeId : key;
    }

    public static AccountRef fromKey(String key) {
        if (key == null) {
            throw new ValidationException("Account key is required");
        }
        String[] parts = key.split(SEPARATOR, 3);
        if (parts.length < 2) {
            throw new ValidationException("Malformed account key: " + key);
        }
        OwnerType type;
        try {
            type = OwnerType.valueOf(parts[0]);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown owner type in account key: " + key);
        }
        return of(parts[1], type, parts.length == 3 ? parts[2] : null);
    }

    @Override
    public String toString() {
        return key();
    }
}
