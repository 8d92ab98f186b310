package com.flagship.revenue_ledger.support;

import com.flagship.revenue_ledger.audit.AuditEvent;
import com.flagship.revenue_ledger.audit.AuditTrail;
import com.flagship.revenue_ledger.correction.BalanceCorrection;
import com.flagship.revenue_ledger.correction.CorrectionRepository;
import com.flagship.revenue_ledger.distribution.DistributionRecord;
import com.flagship.revenue_ledger.distribution.DistributionRepository;
import com.flagship.revenue_ledger.distribution.PayeeAccountResolver;
import com.flagship.revenue_ledger.events.LedgerEvent;
import com.flagship.revenue_ledger.events.LedgerEventPublisher;
import com.flagship.revenue_ledger.exception.DuplicateDistributionException;
import com.flagship.revenue_ledger.ledger.AccountBalance;
import com.flagship.revenue_ledger.ledger.AccountRef;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.ledger.LedgerRepository;
import com.flagship.revenue_ledger.ledger.TransactionRunner;
import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.reconciliation.DiscrepancyAlert;
import com.flagship.revenue_ledger.reconciliation.ReconciliationRecord;
import com.flagship.revenue_ledger.reconciliation.ReconciliationRepository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * In-memory stand-in for the Postgres schema, implementing every storage port.
 *
 * Transactions are serialized on this object's monitor. Everything written inside
 * the outermost {@link #inTransaction} call is discarded if it throws, the same
 * all-or-nothing behaviour the JDBC adapters get from Postgres. All stored values
 * are immutable, so a snapshot is a shallow copy of each collection.
 *
 * Because the monitor serializes everything, races are reproduced explicitly with
 * {@link #onNextBalanceRead}: the registered work plays a second writer that gets in
 * right after a balance read. Rows locked by the running transaction hold that writer
 * back until the transaction ends, as {@code SELECT ... FOR UPDATE} does.
 */
public class InMemoryLedgerDatabase implements TransactionRunner, LedgerRepository, DistributionRepository,
        PayeeAccountResolver, ReconciliationRepository, CorrectionRepository, AuditTrail, LedgerEventPublisher {

    private State state = new State();
    private int depth;

    private boolean failAuditWrites;
    private boolean failEventPublishing;
    private Money balanceWriteSkew;

    private final Set<String> lockedAccounts = new HashSet<>();
    private final List<Runnable> blockedWriters = new ArrayList<>();
    private AccountRef interleaveAccount;
    private Runnable interleaveWork;

    // --- TransactionRunner ---

    @Override
    public synchronized <T> T inTransaction(Supplier<T> work) {
        if (depth > 0) {
            depth++;
            try {
                return work.get();
            } finally {
                depth--;
            }
        }
        State snapshot = state.copy();
        depth = 1;
        try {
            return work.get();
        } catch (RuntimeException | Error e) {
            state = snapshot;
            throw e;
        } finally {
            depth = 0;
            lockedAccounts.clear();
            releaseBlockedWriters();
        }
    }

    private void releaseBlockedWriters() {
        List<Runnable> released = List.copyOf(blockedWriters);
        blockedWriters.clear();
        released.forEach(Runnable::run);
    }

    private void afterBalanceRead(AccountRef account) {
        if (interleaveWork == null || !interleaveAccount.equals(account)) {
            return;
        }
        Runnable work = interleaveWork;
        interleaveWork = null;
        interleaveAccount = null;
        if (depth > 0 && lockedAccounts.contains(account.key())) {
            blockedWriters.add(work);
            return;
        }
        runOutsideCurrentTransaction(work);
    }

    private void runOutsideCurrentTransaction(Runnable work) {
        int suspendedDepth = depth;
        Set<String> suspendedLocks = Set.copyOf(lockedAccounts);
        depth = 0;
        lockedAccounts.clear();
        try {
            work.run();
        } finally {
            depth = suspendedDepth;
            lockedAccounts.addAll(suspendedLocks);
        }
    }

    private void lock(AccountRef account) {
        if (depth > 0) {
            lockedAccounts.add(account.key());
        }
    }

    // --- LedgerRepository ---

    @Override
    public synchronized AccountBalance lockOrCreate(AccountRef account, Instant now) {
        AccountBalance balance = state.balances.computeIfAbsent(account.key(),
                key -> AccountBalance.open(UUID.randomUUID(), account, now));
        lock(account);
        afterBalanceRead(account);
        return balance;
    }

    @Override
    public synchronized Optional<AccountBalance> lockExisting(AccountRef account) {
        Optional<AccountBalance> balance = Optional.ofNullable(state.balances.get(account.key()));
        if (balance.isPresent()) {
            lock(account);
        }
        afterBalanceRead(account);
        return balance;
    }

    @Override
    public synchronized boolean updateBalance(AccountBalance updated, long expectedVersion) {
        AccountBalance stored = state.balances.get(updated.getAccount().key());
        if (stored == null || stored.getVersion() != expectedVersion) {
            return false;
        }
        AccountBalance toStore = updated;
        if (balanceWriteSkew != null) {
            toStore = new AccountBalance(updated.getId(), updated.getAccount(),
                    updated.getCurrentBalance().add(balanceWriteSkew), updated.getTotalCredits(),
                    updated.getTotalDebits(), updated.getPendingAmount(), updated.getLastTransactionAt(),
                    updated.getVersion(), updated.getCreatedAt());
        }
        state.balances.put(updated.getAccount().key(), toStore);
        return true;
    }

    @Override
    public synchronized LedgerEntry appendEntry(LedgerEntry entry) {
        LedgerEntry stored = entry.withSequenceNumber(++state.sequence);
        state.entries.add(stored);
        return stored;
    }

    @Override
    public synchronized Optional<AccountBalance> findBalance(AccountRef account) {
        Optional<AccountBalance> balance = Optional.ofNullable(state.balances.get(account.key()));
        afterBalanceRead(account);
        return balance;
    }

    @Override
    public synchronized List<AccountBalance> findAllBalances() {
        return List.copyOf(state.balances.values());
    }

    @Override
    public synchronized List<LedgerEntry> findEntries(AccountRef account, Instant from, Instant to) {
        return state.entries.stream()
            .filter(e -> e.getAccount().equals(account))
            .filter(e -> !e.getCreatedAt().isBefore(from) && e.getCreatedAt().isBefore(to))
            .toList();
    }

    @Override
    public synchronized List<LedgerEntry> findEntriesBetween(Instant from, Instant to) {
        return state.entries.stream()
            .filter(e -> !e.getCreatedAt().isBefore(from) && e.getCreatedAt().isBefore(to))
            .toList();
    }

    @Override
    public synchronized Optional<LedgerEntry> findLastEntryBefore(AccountRef account, Instant before) {
        return state.entries.stream()
            .filter(e -> e.getAccount().equals(account) && e.getCreatedAt().isBefore(before))
            .reduce((first, second) -> second);
    }

    @Override
    public synchronized Money netChangeSince(AccountRef account, Instant since) {
        return state.entries.stream()
            .filter(e -> e.getAccount().equals(account) && !e.getCreatedAt().isBefore(since))
            .map(LedgerEntry::signedAmount)
            .reduce(Money.ZERO, Money::add);
    }

    @Override
    public synchronized Optional<Money> balanceAt(AccountRef account, Instant at) {
        Optional<Money> balance = Optional.ofNullable(state.balances.get(account.key()))
            .map(stored -> stored.getCurrentBalance().subtract(netChangeSince(account, at)));
        afterBalanceRead(account);
        return balance;
    }

    // --- DistributionRepository ---

    @Override
    public synchronized void claim(DistributionRecord record) {
        if (state.distributions.containsKey(record.getTransactionId())) {
            throw new DuplicateDistributionException(record.getTransactionId());
        }
        state.distributions.put(record.getTransactionId(), record);
    }

    @Override
    public synchronized Optional<DistributionRecord> find(String transactionId) {
        return Optional.ofNullable(state.distributions.get(transactionId));
    }

    @Override
    public synchronized Optional<DistributionRecord> findForUpdate(String transactionId) {
        return find(transactionId);
    }

    @Override
    public synchronized boolean exists(String transactionId) {
        return state.distributions.containsKey(transactionId);
    }

    @Override
    public synchronized void updateRefund(DistributionRecord record) {
        state.distributions.put(record.getTransactionId(), record);
    }

    // --- PayeeAccountResolver ---

    @Override
    public synchronized Optional<AccountRef> resolve(String payeeScopeId) {
        return Optional.ofNullable(payeeScopeId).map(state.payees::get);
    }

    @Override
    public synchronized AccountRef register(String payeeScopeId, String ownerId) {
        AccountRef account = AccountRef.payee(ownerId, payeeScopeId);
        state.payees.put(payeeScopeId, account);
        return account;
    }

    // --- ReconciliationRepository ---

    @Override
    public synchronized void saveRecord(ReconciliationRecord record) {
        state.records.add(record);
    }

    @Override
    public synchronized Optional<ReconciliationRecord> findLatest(LocalDate date) {
        return state.records.stream()
            .filter(r -> r.getDate().equals(date))
            .max(Comparator.comparingInt(ReconciliationRecord::getRevision));
    }

    @Override
    public synchronized Optional<ReconciliationRecord> findMostRecent() {
        return state.records.stream()
            .max(Comparator.comparing(ReconciliationRecord::getDate)
                .thenComparingInt(ReconciliationRecord::getRevision));
    }

    @Override
    public synchronized List<ReconciliationRecord> findHistory(LocalDate from, LocalDate to) {
        return state.records.stream()
            .filter(r -> !r.getDate().isBefore(from) && !r.getDate().isAfter(to))
            .sorted(Comparator.comparing(ReconciliationRecord::getDate)
                .thenComparingInt(ReconciliationRecord::getRevision))
            .toList();
    }

    @Override
    public synchronized void saveAlert(DiscrepancyAlert alert) {
        state.alerts.put(alert.getId(), alert);
    }

    @Override
    public synchronized void updateAlert(DiscrepancyAlert alert) {
        DiscrepancyAlert stored = state.alerts.get(alert.getId());
        if (stored == null || !stored.isOpen()) {
            throw new IllegalStateException("Discrepancy alert " + alert.getId() + " is not open");
        }
        state.alerts.put(alert.getId(), alert);
    }

    @Override
    public synchronized Optional<DiscrepancyAlert> findAlert(UUID alertId) {
        return Optional.ofNullable(state.alerts.get(alertId));
    }

    @Override
    public synchronized List<DiscrepancyAlert> findOpenAlerts() {
        return state.alerts.values().stream().filter(DiscrepancyAlert::isOpen).toList();
    }

    @Override
    public synchronized boolean hasOpenAlert(LocalDate reconciliationDate, String accountKey) {
        return state.alerts.values().stream()
            .anyMatch(a -> a.isOpen() && a.getReconciliationDate().equals(reconciliationDate)
                    && a.getAccountKey().equals(accountKey));
    }

    @Override
    public synchronized List<DiscrepancyAlert> findAlertsForDates(LocalDate from, LocalDate to) {
        return state.alerts.values().stream()
            .filter(a -> !a.getReconciliationDate().isBefore(from) && !a.getReconciliationDate().isAfter(to))
            .toList();
    }

    // --- CorrectionRepository ---

    @Override
    public synchronized void save(BalanceCorrection correction) {
        state.corrections.add(correction);
    }

    @Override
    public synchronized List<BalanceCorrection> findByAccount(AccountRef account) {
        return state.corrections.stream().filter(c -> c.getAccount().equals(account)).toList();
    }

    // --- AuditTrail ---

    @Override
    public synchronized void record(AuditEvent event) {
        if (failAuditWrites) {
            throw new IllegalStateException("audit store unavailable");
        }
        state.auditEvents.add(event);
    }

    @Override
    public synchronized List<AuditEvent> findByEntity(String entityType, String entityId) {
        return state.auditEvents.stream()
            .filter(e -> e.getEntityType().equals(entityType) && e.getEntityId().equals(entityId))
            .toList();
    }

    // --- LedgerEventPublisher ---

    @Override
    public synchronized void publish(LedgerEvent event) {
        if (failEventPublishing) {
            throw new IllegalStateException("outbox unavailable");
        }
        state.events.add(event);
    }

    // --- test controls and inspection ---

    public synchronized void failAuditWrites(boolean fail) {
        this.failAuditWrites = fail;
    }

    public synchronized void failEventPublishing(boolean fail) {
        this.failEventPublishing = fail;
    }

    /**
     * Every subsequent balance write stores {@code skew} more than it was given,
     * simulating a storage layer that corrupts rows.
     */
    public synchronized void skewBalanceWrites(Money skew) {
        this.balanceWriteSkew = skew;
    }

    /**
     * Runs {@code work} once, as a separate writer, right after the next balance read of
     * {@code account}. If the reading transaction holds the row lock the writer waits for
     * it to commit or roll back; otherwise it commits before the reader continues.
     */
    public synchronized void onNextBalanceRead(AccountRef account, Runnable work) {
        this.interleaveAccount = account;
        this.interleaveWork = work;
    }

    /**
     * Overwrites a stored balance directly, bypassing the ledger. No entry is written.
     */
    public synchronized void overwriteBalance(AccountRef account, Money current, Money credits, Money debits) {
        AccountBalance stored = state.balances.get(account.key());
        state.balances.put(account.key(), new AccountBalance(stored.getId(), account, current, credits, debits,
                stored.getPendingAmount(), stored.getLastTransactionAt(), stored.getVersion() + 1,
                stored.getCreatedAt()));
    }

    /**
     * Appends an entry as-is, bypassing the balance row.
     */
    public synchronized LedgerEntry insertRawEntry(LedgerEntry entry) {
        return appendEntry(entry);
    }

    public synchronized List<LedgerEntry> allEntries() {
        return List.copyOf(state.entries);
    }

    public synchronized List<LedgerEntry> entriesFor(AccountRef account) {
        return state.entries.stream().filter(e -> e.getAccount().equals(account)).toList();
    }

    public synchronized List<LedgerEvent> publishedEvents() {
        return List.copyOf(state.events);
    }

    public synchronized List<AuditEvent> auditEvents() {
        return List.copyOf(state.auditEvents);
    }

    public synchronized List<BalanceCorrection> corrections() {
        return List.copyOf(state.corrections);
    }

    public synchronized List<ReconciliationRecord> reconciliationRecords() {
        return List.copyOf(state.records);
    }

    public synchronized List<DiscrepancyAlert> allAlerts() {
        return List.copyOf(state.alerts.values());
    }

    private static final class State {
        final Map<String, AccountBalance> balances = new LinkedHashMap<>();
        final List<LedgerEntry> entries = new ArrayList<>();
        long sequence;
        final Map<String, DistributionRecord> distributions = new LinkedHashMap<>();
        final Map<String, AccountRef> payees = new LinkedHashMap<>();
        final List<ReconciliationRecord> records = new ArrayList<>();
        final Map<UUID, DiscrepancyAlert> alerts = new LinkedHashMap<>();
        final List<BalanceCorrection> corrections = new ArrayList<>();
        final List<AuditEvent> auditEvents = new ArrayList<>();
        final List<LedgerEvent> events = new ArrayList<>();

        State copy() {
            State copy = new State();
            copy.balances.putAll(balances);
            copy.entries.addAll(entries);
            copy.sequence = sequence;
            copy.distributions.putAll(distributions);
            copy.payees.putAll(payees);
            copy.records.addAll(records);
            copy.alerts.putAll(alerts);
            copy.corrections.addAll(corrections);
            copy.auditEvents.addAll(auditEvents);
            copy.events.addAll(events);
            return copy;
        }
    }
}
