package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one balance mutation.
 *
 * Key invariant: {@code balanceAfter == balanceBefore ± amount} according to the entry type.
 * The sequence number is assigned by storage and gives a total order across all accounts.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID balanceId;
    AccountRef account;
    String externalTransactionRef;
    EntryType entryType;
    Money amount;
    Money balanceBefore;
    Money balanceAfter;
    String actorId;
    String description;
    Instant createdAt;
    Long sequenceNumber;

    public static LedgerEntry record(AccountBalance before, PostingRequest request, Money balanceAfter,
                                     Instant at) {
        return new LedgerEntry(
            UUID.randomUUID(),
            before.getId(),
            before.getAccount(),
            request.getExternalTransactionRef(),
            request.getEntryType(),
            request.getAmount(),
            before.getCurrentBalance(),
            balanceAfter,
            request.getActorId(),
            request.getDescription(),
            at,
            null  // assigned by storage
        );
    }

    public LedgerEntry withSequenceNumber(long sequenceNumber) {
        return new LedgerEntry(id, balanceId, account, externalTransactionRef, entryType, amount,
                balanceBefore, balanceAfter, actorId, description, createdAt, sequenceNumber);
    }

    /**
     * Effect of this entry on the balance: positive for credits, negative for debits.
     */
    public Money signedAmount() {
        return entryType.signed(amount);
    }

    public boolean isArithmeticallyValid(Money tolerance) {
        return amount.isPositive()
                && Money.equalsWithinTolerance(entryType.applyTo(balanceBefore, amount), balanceAfter, tolerance);
    }
}
