package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.AccountNotFoundException;
import com.flagship.revenue_ledger.exception.IntegrityException;
import com.flagship.revenue_ledger.exception.LedgerException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the balance invariant through the only writer of balances.
 */
class LedgerStoreTest {

    private LedgerFixture fixture;
    private LedgerStore store;
    private AccountRef account;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        store = fixture.ledgerStore;
        account = AccountRef.payee("owner-7", "H7");
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("First posting lazily creates the balance and writes exactly one entry")
    void firstPostingCreatesBalance() {
        printTestHeader("Lazy Balance Creation");

        assertTrue(store.findBalance(account).isEmpty());

        UpdatedBalance result = store.post(account, Money.of("250.00"), EntryType.CREDIT, "tx-1", "tester", "seed");

        AccountBalance balance = store.getBalance(account);
        assertEquals(Money.of("250.00"), balance.getCurrentBalance());
        assertEquals(Money.of("250.00"), balance.getTotalCredits());
        assertEquals(Money.ZERO, balance.getTotalDebits());
        assertEquals(1L, balance.getVersion());
        assertEquals(fixture.clock.instant(), balance.getLastTransactionAt());

        LedgerEntry entry = result.getEntry();
        assertEquals(Money.ZERO, entry.getBalanceBefore());
        assertEquals(Money.of("250.00"), entry.getBalanceAfter());
        assertEquals("tx-1", entry.getExternalTransactionRef());
        assertNotNull(entry.getSequenceNumber());
        assertEquals(1, fixture.db.entriesFor(account).size());
        printSuccess("Balance row and entry written together");
    }

    @Test
    @DisplayName("Invariant currentBalance == credits - debits holds after every posting")
    void invariantHoldsAfterEveryPosting() {
        printTestHeader("Invariant Across Mixed Postings");

        EntryType[] types = {EntryType.CREDIT, EntryType.DEBIT, EntryType.CREDIT_ADJUSTMENT, EntryType.DEBIT_ADJUSTMENT};
        String[] amounts = {"100.10", "33.33", "0.01", "12.34", "999.99", "0.07"};

        for (int i = 0; i < 60; i++) {
            EntryType type = types[i % types.length];
            Money amount = Money.of(amounts[i % amounts.length]);
            UpdatedBalance result = store.post(account, amount, type, "ref-" + i, "tester", null);

            AccountBalance balance = result.getBalance();
            assertTrue(balance.isConsistent(Money.DEFAULT_TOLERANCE), "invariant broken after posting " + i);
            assertEquals(type.applyTo(result.getEntry().getBalanceBefore(), amount), result.getEntry().getBalanceAfter());
        }

        AccountBalance balance = store.getBalance(account);
        Money replayed = fixture.db.entriesFor(account).stream()
            .map(LedgerEntry::signedAmount)
            .reduce(Money.ZERO, Money::add);
        assertEquals(replayed, balance.getCurrentBalance());
        assertEquals(60, fixture.db.entriesFor(account).size());
        printSuccess("Invariant held for 60 postings; replay matches stored balance");
    }

    @Test
    @DisplayName("Zero, negative and missing amounts are rejected before any write")
    void invalidAmountsRejected() {
        assertThrows(ValidationException.class,
                () -> store.post(account, Money.ZERO, EntryType.CREDIT, "r", "tester", null));
        assertThrows(ValidationException.class,
                () -> store.post(account, Money.of("-5"), EntryType.CREDIT, "r", "tester", null));
        assertThrows(ValidationException.class,
                () -> store.post(account, null, EntryType.CREDIT, "r", "tester", null));
        assertThrows(ValidationException.class,
                () -> store.post(account, Money.of(5), EntryType.CREDIT, "r", " ", null));

        assertTrue(store.findBalance(account).isEmpty());
        assertTrue(fixture.db.allEntries().isEmpty());
    }

    @Test
    @DisplayName("Failed post-write verification rolls back the balance and the entry")
    void verificationFailureRollsBack() {
        printTestHeader("Rollback On Integrity Failure");

        store.post(account, Money.of("100.00"), EntryType.CREDIT, "tx-ok", "tester", null);
        fixture.db.skewBalanceWrites(Money.of("5.00"));

        IntegrityException e = assertThrows(IntegrityException.class,
                () -> store.post(account, Money.of("40.00"), EntryType.DEBIT, "tx-bad", "tester", null));
        System.out.println("  Exception Message: " + e.getMessage());

        assertTrue(e.isCritical());
        assertEquals(LedgerException.GENERIC_FAILURE_MESSAGE, e.getUserMessage());
        assertEquals(Money.of("100.00"), store.getBalance(account).getCurrentBalance());
        assertEquals(1, fixture.db.entriesFor(account).size());
        assertEquals(1.0, fixture.counter("ledger.integrity.failures", "operation", "post"));
        printSuccess("No partial update was observable");
    }

    @Test
    @DisplayName("Unknown account lookups raise AccountNotFoundException")
    void unknownAccount() {
        AccountNotFoundException e = assertThrows(AccountNotFoundException.class, () -> store.getBalance(account));
        assertFalse(e.isRetryable());
        assertEquals(Money.ZERO, store.balanceAt(account, Instant.now()));
    }

    @Test
    @DisplayName("Entry queries are chronological, half-open and repeatable")
    void entriesByRange() {
        Instant t0 = fixture.clock.instant();
        store.post(account, Money.of(10), EntryType.CREDIT, "a", "tester", null);
        fixture.clock.advance(Duration.ofMinutes(1));
        Instant t1 = fixture.clock.instant();
        store.post(account, Money.of(20), EntryType.CREDIT, "b", "tester", null);
        fixture.clock.advance(Duration.ofMinutes(1));
        store.post(account, Money.of(5), EntryType.DEBIT, "c", "tester", null);

        List<LedgerEntry> firstTwo = store.getEntries(account, t0, fixture.clock.instant());
        assertEquals(List.of("a", "b"), firstTwo.stream().map(LedgerEntry::getExternalTransactionRef).toList());
        assertEquals(firstTwo, store.getEntries(account, t0, fixture.clock.instant()));

        assertEquals(Money.of(25), store.netChangeSince(account, t1).add(Money.of(10)));
        assertEquals(Money.of(10), store.balanceAt(account, t1));
    }

    @Test
    @DisplayName("Concurrent postings to one account are serialized without lost updates")
    void concurrentPostingsSerialized() throws Exception {
        printTestHeader("Concurrent Postings");

        int threads = 8;
        int postingsPerThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < postingsPerThread; i++) {
                    store.post(account, Money.of("1.25"), EntryType.CREDIT, "t" + thread + "-" + i, "tester", null);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get();
        }
        executor.shutdown();

        AccountBalance balance = store.getBalance(account);
        assertEquals(Money.of("250.00"), balance.getCurrentBalance());
        assertEquals(threads * postingsPerThread, balance.getVersion());

        List<LedgerEntry> entries = fixture.db.entriesFor(account);
        for (int i = 1; i < entries.size(); i++) {
            assertEquals(entries.get(i - 1).getBalanceAfter(), entries.get(i).getBalanceBefore(),
                    "entry chain broken at " + i);
        }
        printSuccess("200 concurrent postings, chain intact");
    }
}
