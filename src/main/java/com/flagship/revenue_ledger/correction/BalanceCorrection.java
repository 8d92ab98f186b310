package com.flagship.revenue_ledger.correction;

import com.flagship.revenue_ledger.ledger.AccountRef;
import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Admin-authorized balance adjustment. Immutable; always paired with exactly one
 * adjustment ledger entry ({@code ledgerEntryId}).
 */
@Value
public class BalanceCorrection {
    UUID id;
    UUID balanceId;
    AccountRef account;
    Money originalBalance;
    Money correctedBalance;
    /** correctedBalance - originalBalance */
    Money difference;
    String reason;
    String evidence;
    String adminActorId;
    UUID ledgerEntryId;
    Instant createdAt;
}
