package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.money.Money;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage port for balances and the append-only entry log.
 *
 * Only {@link LedgerStore} writes through this interface. Time ranges are
 * half-open: {@code from} inclusive, {@code to} exclusive. Entry lists are
 * ordered by sequence number.
 */
public interface LedgerRepository {

    /**
     * Loads the balance row for update, creating a zero row first if the account
     * has never been posted to. Must be called inside a transaction; the row stays
     * locked until it ends.
     */
    AccountBalance lockOrCreate(AccountRef account, Instant now);

    /**
     * Writes {@code updated} if the stored version still equals {@code expectedVersion}.
     *
     * @return false if another writer got there first
     */
    boolean updateBalance(AccountBalance updated, long expectedVersion);

    /**
     * Loads an existing balance row for update. Must be called inside a transaction.
     */
    Optional<AccountBalance> lockExisting(AccountRef account);

    /**
     * Appends an entry and returns it with its storage-assigned sequence number.
     */
    LedgerEntry appendEntry(LedgerEntry entry);

    Optional<AccountBalance> findBalance(AccountRef account);

    List<AccountBalance> findAllBalances();

    List<LedgerEntry> findEntries(AccountRef account, Instant from, Instant to);

    List<LedgerEntry> findEntriesBetween(Instant from, Instant to);

    Optional<LedgerEntry> findLastEntryBefore(AccountRef account, Instant before);

    /**
     * Sum of the signed amounts of all entries for the account created at or after {@code since}.
     */
    Money netChangeSince(AccountRef account, Instant since);

    /**
     * Stored balance minus the net change of entries created at or after {@code at}, read as
     * one consistent snapshot so a posting committed meanwhile is either in both parts or
     * in neither. Empty if the account does not exist.
     */
    Optional<Money> balanceAt(AccountRef account, Instant at);
}
