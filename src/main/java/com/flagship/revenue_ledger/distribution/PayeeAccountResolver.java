package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.ledger.AccountRef;

import java.util.Optional;

/**
 * Maps a payee scope (hospital id) to the ledger account that receives its revenue.
 */
public interface PayeeAccountResolver {

    Optional<AccountRef> resolve(String payeeScopeId);

    /**
     * Registers (or re-activates) the owner of a payee scope.
     */
    AccountRef register(String payeeScopeId, String ownerId);
}
