package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.config.LedgerProperties;
import com.flagship.revenue_ledger.exception.AccountNotFoundException;
import com.flagship.revenue_ledger.exception.IntegrityException;
import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Sole writer of account balances and ledger entries.
 *
 * This service enforces the core invariants:
 * 1. Every balance mutation creates exactly one ledger entry
 * 2. currentBalance == totalCredits - totalDebits after every posting
 * 3. Balance row and entry are written as one atomic unit
 * 4. Postings to the same account are serialized by a row lock
 *
 * After writing, the balance is re-read and verified. If verification fails the
 * whole posting (and any outer transaction it joined) is rolled back and an
 * {@link IntegrityException} is raised, so no caller observes a partial update.
 */
@Service
@Slf4j
public class LedgerStore {

    private final LedgerRepository repository;
    private final TransactionRunner transactionRunner;
    private final Clock clock;
    private final LedgerMetrics metrics;
    private final Money tolerance;

    public LedgerStore(LedgerRepository repository,
                       TransactionRunner transactionRunner,
                       Clock clock,
                       LedgerMetrics metrics,
                       LedgerProperties properties) {
        this.repository = repository;
        this.transactionRunner = transactionRunner;
        this.clock = clock;
        this.metrics = metrics;
        this.tolerance = Money.of(properties.getTolerance());
    }

    public UpdatedBalance post(AccountRef account, Money amount, EntryType entryType,
                               String externalTransactionRef, String actorId, String description) {
        return post(PostingRequest.of(account, amount, entryType, externalTransactionRef, actorId, description));
    }

    /**
     * Posts one entry to one account.
     *
     * @param request the posting; amount must be greater than zero
     * @return the re-read balance and the entry that produced it
     * @throws com.flagship.revenue_ledger.exception.ValidationException if the request is invalid
     * @throws IntegrityException if post-write verification fails
     */
    public UpdatedBalance post(PostingRequest request) {
        request.validate();
        MDC.put(CorrelationContext.ACCOUNT_MDC_KEY, request.getAccount().key());

        try {
            UpdatedBalance result = transactionRunner.inTransaction(() -> postLocked(request));
            metrics.recordPosting(request.getEntryType().name());

            log.debug("Posted {} {} to {}: {} -> {}",
                    request.getEntryType(), request.getAmount(), request.getAccount().key(),
                    result.getEntry().getBalanceBefore(), result.getEntry().getBalanceAfter());
            return result;

        } catch (IntegrityException e) {
            metrics.recordIntegrityFailure("post");
            log.error("Ledger posting rolled back: account={}, type={}, amount={}, error={}",
                    request.getAccount().key(), request.getEntryType(), request.getAmount(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_MDC_KEY);
        }
    }

    private UpdatedBalance postLocked(PostingRequest request) {
        Instant now = clock.instant();
        AccountBalance current = repository.lockOrCreate(request.getAccount(), now);
        AccountBalance updated = current.apply(request.getEntryType(), request.getAmount(), now);

        if (!repository.updateBalance(updated, current.getVersion())) {
            throw new IntegrityException(String.format(
                "Concurrent modification of %s detected (expected version %d)",
                request.getAccount().key(), current.getVersion()));
        }

        LedgerEntry entry = repository.appendEntry(
            LedgerEntry.record(current, request, updated.getCurrentBalance(), now));

        AccountBalance reread = repository.findBalance(request.getAccount())
            .orElseThrow(() -> new IntegrityException(
                "Balance row vanished after posting to " + request.getAccount().key()));

        verify(reread, entry, updated);
        return new UpdatedBalance(reread, entry);
    }

    private void verify(AccountBalance reread, LedgerEntry entry, AccountBalance intended) {
        if (!reread.isConsistent(tolerance)) {
            throw new IntegrityException(String.format(
                "Balance invariant violated for %s: current=%s, credits=%s, debits=%s",
                reread.getAccount().key(), reread.getCurrentBalance(),
                reread.getTotalCredits(), reread.getTotalDebits()));
        }
        if (!Money.equalsWithinTolerance(reread.getCurrentBalance(), intended.getCurrentBalance(), tolerance)) {
            throw new IntegrityException(String.format(
                "Stored balance for %s is %s after posting, expected %s",
                reread.getAccount().key(), reread.getCurrentBalance(), intended.getCurrentBalance()));
        }
        if (!entry.isArithmeticallyValid(tolerance)) {
            throw new IntegrityException(String.format(
                "Ledger entry %s is arithmetically invalid: %s %s %s -> %s",
                entry.getId(), entry.getBalanceBefore(), entry.getEntryType(),
                entry.getAmount(), entry.getBalanceAfter()));
        }
    }

    /**
     * Locks the balance row until the surrounding transaction ends. Callers that decide
     * what to post from the current balance read it here, not through {@link #getBalance}.
     *
     * @throws AccountNotFoundException if the account has never been posted to
     */
    public AccountBalance lockBalance(AccountRef account) {
        return transactionRunner.inTransaction(() -> repository.lockExisting(account)
            .orElseThrow(() -> new AccountNotFoundException("No ledger balance for " + account.key())));
    }

    public Optional<AccountBalance> findBalance(AccountRef account) {
        return repository.findBalance(account);
    }

    /**
     * @throws AccountNotFoundException if the account has never been posted to
     */
    public AccountBalance getBalance(AccountRef account) {
        return repository.findBalance(account)
            .orElseThrow(() -> new AccountNotFoundException("No ledger balance for " + account.key()));
    }

    public List<AccountBalance> findAllBalances() {
        return repository.findAllBalances();
    }

    /**
     * Entries for one account in {@code [from, to)}, in posting order. Re-querying the
     * same range returns the same entries, since entries are immutable.
     */
    public List<LedgerEntry> getEntries(AccountRef account, Instant from, Instant to) {
        return repository.findEntries(account, from, to);
    }

    public List<LedgerEntry> findEntriesBetween(Instant from, Instant to) {
        return repository.findEntriesBetween(from, to);
    }

    public Optional<LedgerEntry> findLastEntryBefore(AccountRef account, Instant before) {
        return repository.findLastEntryBefore(account, before);
    }

    public Money netChangeSince(AccountRef account, Instant since) {
        return repository.netChangeSince(account, since);
    }

    /**
     * Balance as it stood at {@code at}: the stored balance minus everything posted since,
     * taken from a single read so concurrent postings cannot tear it.
     * Returns zero for accounts that do not exist yet.
     */
    public Money balanceAt(AccountRef account, Instant at) {
        return repository.balanceAt(account, at).orElse(Money.ZERO);
    }
}
