package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.config.LedgerProperties;
import com.flagship.revenue_ledger.events.LedgerEvent;
import com.flagship.revenue_ledger.events.RevenueDistributedEvent;
import com.flagship.revenue_ledger.exception.AccountNotFoundException;
import com.flagship.revenue_ledger.exception.CalculationIntegrityException;
import com.flagship.revenue_ledger.exception.DuplicateDistributionException;
import com.flagship.revenue_ledger.exception.ErrorSeverity;
import com.flagship.revenue_ledger.exception.LedgerException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.AccountRef;
import com.flagship.revenue_ledger.ledger.EntryType;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.notification.AlertLevel;
import com.flagship.revenue_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class RevenueDistributorTest {

    private LedgerFixture fixture;
    private RevenueDistributor distributor;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        distributor = fixture.distributor;
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("1000 at the default 5% credits payee 950.00 and platform 50.00")
    void defaultSplit() {
        printTestHeader("Default Split");

        DistributionResult result = distributor.distribute("tx1", Money.of(1000), LedgerFixture.SCOPE);
        printOutput("Result", result);

        assertEquals(Money.of("950.00"), result.getPayeeAmount());
        assertEquals(Money.of("50.00"), result.getServiceCharge());
        assertEquals(Money.of("950.00"), fixture.ledgerStore.getBalance(fixture.payee()).getCurrentBalance());
        assertEquals(Money.of("50.00"), fixture.ledgerStore.getBalance(fixture.platform()).getCurrentBalance());

        List<LedgerEntry> payeeEntries = fixture.db.entriesFor(fixture.payee());
        List<LedgerEntry> platformEntries = fixture.db.entriesFor(fixture.platform());
        assertEquals(1, payeeEntries.size());
        assertEquals(1, platformEntries.size());
        assertEquals(EntryType.CREDIT, payeeEntries.get(0).getEntryType());
        assertEquals("tx1", platformEntries.get(0).getExternalTransactionRef());
        assertEquals(RevenueDistributor.SYSTEM_ACTOR, payeeEntries.get(0).getActorId());

        List<LedgerEvent> events = fixture.db.publishedEvents();
        assertEquals(1, events.size());
        assertInstanceOf(RevenueDistributedEvent.class, events.get(0));
        assertEquals(1, fixture.notifications.notifications().size());
        assertEquals(1, fixture.db.auditEvents().size());
        assertEquals(1.0, fixture.counter("ledger.distributions", "status", "success"));
        printSuccess("Both sides posted, event written, payee notified");
    }

    @Test
    @DisplayName("Split always adds back up to the gross amount")
    void splitSumsToGross() {
        String[] grossAmounts = {"1.00", "1.01", "3.33", "99.99", "123.45", "1000.01", "77777.77", "999999.99"};
        BigDecimal[] rates = {new BigDecimal("0.05"), new BigDecimal("0.075"), new BigDecimal("0.333"), BigDecimal.ZERO};

        for (String gross : grossAmounts) {
            for (BigDecimal rate : rates) {
                RevenueSplit split = RevenueSplit.compute(Money.of(gross), rate, Money.DEFAULT_TOLERANCE);
                assertEquals(Money.of(gross), split.getServiceCharge().add(split.getPayeeAmount()),
                        "gross " + gross + " at rate " + rate);
            }
        }
    }

    @Test
    @DisplayName("Concurrent distributions of one transaction id credit once")
    void concurrentDuplicateCreditsOnce() throws Exception {
        printTestHeader("Concurrent Duplicate");

        int attempts = 6;
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<DistributionResult>> futures = new ArrayList<>();
        for (int i = 0; i < attempts; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return distributor.distribute("tx-dup", Money.of(1000), LedgerFixture.SCOPE);
            }));
        }
        start.countDown();

        int succeeded = 0;
        int duplicates = 0;
        for (Future<DistributionResult> future : futures) {
            try {
                future.get();
                succeeded++;
            } catch (ExecutionException e) {
                assertInstanceOf(DuplicateDistributionException.class, e.getCause());
                duplicates++;
            }
        }
        executor.shutdown();
        printOutput("Succeeded", succeeded);
        printOutput("Rejected as duplicate", duplicates);

        assertEquals(1, succeeded);
        assertEquals(attempts - 1, duplicates);
        assertEquals(Money.of("950.00"), fixture.ledgerStore.getBalance(fixture.payee()).getCurrentBalance());
        assertEquals(Money.of("50.00"), fixture.ledgerStore.getBalance(fixture.platform()).getCurrentBalance());
        assertEquals(2, fixture.db.allEntries().size());
        printSuccess("Second and later attempts rejected; balances credited once");
    }

    @Test
    @DisplayName("A sequential re-run is rejected and leaves both balances untouched")
    void sequentialDuplicateRejected() {
        distributor.distribute("tx-seq", Money.of(500), LedgerFixture.SCOPE);

        DuplicateDistributionException e = assertThrows(DuplicateDistributionException.class,
                () -> distributor.distribute("tx-seq", Money.of(500), LedgerFixture.SCOPE));

        assertEquals("tx-seq", e.getTransactionId());
        assertFalse(e.isRetryable());
        assertEquals(Money.of("475.00"), fixture.ledgerStore.getBalance(fixture.payee()).getCurrentBalance());
        assertEquals(1.0, fixture.counter("ledger.distributions", "status", "duplicate"));
    }

    @Test
    @DisplayName("Out-of-range and missing inputs are rejected before any mutation")
    void validation() {
        assertThrows(ValidationException.class, () -> distributor.distribute("tx", Money.of("0.50"), LedgerFixture.SCOPE));
        assertThrows(ValidationException.class, () -> distributor.distribute("tx", Money.of("1000000.01"), LedgerFixture.SCOPE));
        assertThrows(ValidationException.class, () -> distributor.distribute("tx", null, LedgerFixture.SCOPE));
        assertThrows(ValidationException.class, () -> distributor.distribute(" ", Money.of(10), LedgerFixture.SCOPE));

        assertTrue(fixture.db.allEntries().isEmpty());
        assertTrue(fixture.db.publishedEvents().isEmpty());
        assertTrue(fixture.db.find("tx").isEmpty());
    }

    @Test
    @DisplayName("Unregistered payee scope is non-retryable and posts nothing")
    void unknownPayee() {
        AccountNotFoundException e = assertThrows(AccountNotFoundException.class,
                () -> distributor.distribute("tx-h9", Money.of(100), "H9"));

        assertEquals(ErrorSeverity.NON_RETRYABLE, e.getSeverity());
        assertTrue(fixture.db.allEntries().isEmpty());
        assertFalse(fixture.db.exists("tx-h9"));
    }

    @Test
    @DisplayName("Invalid scope rate falls back to the default rate with a warning metric")
    void invalidRateFallsBack() {
        LedgerProperties properties = new LedgerProperties();
        properties.getDistribution().getRates().put("H1", new BigDecimal("0.90"));
        properties.getDistribution().getRates().put("H2", new BigDecimal("0.10"));
        LedgerFixture custom = new LedgerFixture(properties);
        custom.db.register("H2", "hospital-owner-2");

        DistributionResult fallback = custom.distributor.distribute("tx-a", Money.of(1000), "H1");
        DistributionResult configured = custom.distributor.distribute("tx-b", Money.of(1000), "H2");

        assertEquals(new BigDecimal("0.05"), fallback.getRate());
        assertEquals(Money.of("50.00"), fallback.getServiceCharge());
        assertEquals(Money.of("100.00"), configured.getServiceCharge());
        assertEquals(1.0, custom.counter("ledger.config.fallbacks"));
    }

    @Test
    @DisplayName("Failure after the first credit rolls back the claim and both postings")
    void failureRollsBackEverything() {
        printTestHeader("Atomic Distribution");
        fixture.db.failEventPublishing(true);

        assertThrows(IllegalStateException.class,
                () -> distributor.distribute("tx-fail", Money.of(1000), LedgerFixture.SCOPE));

        assertTrue(fixture.db.allEntries().isEmpty());
        assertTrue(fixture.ledgerStore.findBalance(fixture.payee()).isEmpty());
        assertFalse(fixture.db.exists("tx-fail"));

        fixture.db.failEventPublishing(false);
        DistributionResult retried = distributor.distribute("tx-fail", Money.of(1000), LedgerFixture.SCOPE);
        assertEquals(Money.of("950.00"), retried.getPayeeBalance());
        printSuccess("Nothing persisted by the failed attempt; retry succeeded");
    }

    @Test
    @DisplayName("A broken notification sink never fails the distribution")
    void notificationFailureIgnored() {
        fixture.notifications.failPayeeNotifications(true);

        DistributionResult result = distributor.distribute("tx-n", Money.of(200), LedgerFixture.SCOPE);

        assertEquals(Money.of("190.00"), result.getPayeeBalance());
        assertEquals(1.0, fixture.counter("ledger.notifications.failed", "kind", "payee"));
    }

    @Test
    @DisplayName("Preview computes the split without writing anything")
    void previewDoesNotPost() {
        RevenueSplit split = distributor.previewSplit(Money.of("2500.00"), LedgerFixture.SCOPE);

        assertEquals(Money.of("125.00"), split.getServiceCharge());
        assertEquals(Money.of("2375.00"), split.getPayeeAmount());
        assertTrue(fixture.db.allEntries().isEmpty());
    }

    @Nested
    @DisplayName("Payment records from the payment subsystem")
    class PaymentRecords {

        @Test
        @DisplayName("Only completed payments are distributed")
        void onlyCompleted() {
            PaymentTransaction pending = new PaymentTransaction("tx-p", Money.of(100), null, null,
                    LedgerFixture.SCOPE, PaymentStatus.PENDING);

            assertThrows(ValidationException.class, () -> distributor.distribute(pending));
            assertTrue(fixture.db.allEntries().isEmpty());

            distributor.distribute(PaymentTransaction.completed("tx-c", Money.of(100), LedgerFixture.SCOPE));
            assertEquals(Money.of("95.00"), fixture.ledgerStore.getBalance(fixture.payee()).getCurrentBalance());
        }

        @Test
        @DisplayName("A record whose own split does not add up is a critical failure and raises an alert")
        void inconsistentRecord() {
            PaymentTransaction broken = new PaymentTransaction("tx-x", Money.of(1000), Money.of(50), Money.of(900),
                    LedgerFixture.SCOPE, PaymentStatus.COMPLETED);

            CalculationIntegrityException e = assertThrows(CalculationIntegrityException.class,
                    () -> distributor.distribute(broken));

            assertEquals(LedgerException.GENERIC_FAILURE_MESSAGE, e.getUserMessage());
            assertTrue(fixture.db.allEntries().isEmpty());
        }
    }

    @Nested
    @DisplayName("Refunds")
    class Refunds {

        @BeforeEach
        void distribute() {
            distributor.distribute("tx-r", Money.of(1000), LedgerFixture.SCOPE);
        }

        @Test
        @DisplayName("Partial refunds debit both sides proportionally and sum exactly to the refund")
        void proportionalRefund() {
            RefundResult first = distributor.refund("tx-r", Money.of("333.33"), "admin-1");

            assertEquals(Money.of("333.33"), first.getPayeeDebit().add(first.getPlatformDebit()));
            assertEquals(Money.of("316.66"), first.getPayeeDebit());
            assertEquals(Money.of("16.67"), first.getPlatformDebit());
            assertEquals(Money.of("666.67"), first.getRemainingRefundable());

            RefundResult second = distributor.refund("tx-r", Money.of("666.67"), "admin-1");
            assertEquals(Money.ZERO, second.getRemainingRefundable());

            Money payee = fixture.ledgerStore.getBalance(fixture.payee()).getCurrentBalance();
            Money platform = fixture.ledgerStore.getBalance(fixture.platform()).getCurrentBalance();
            assertEquals(Money.ZERO, payee.add(platform));

            List<String> refs = fixture.db.entriesFor(fixture.payee()).stream()
                .map(LedgerEntry::getExternalTransactionRef).toList();
            assertEquals(List.of("tx-r", "tx-r/refund-1", "tx-r/refund-2"), refs);
        }

        @Test
        @DisplayName("Refunding more than remains, or an unknown transaction, is rejected")
        void refundBounds() {
            distributor.refund("tx-r", Money.of(600), "admin-1");

            assertThrows(ValidationException.class, () -> distributor.refund("tx-r", Money.of("400.01"), "admin-1"));
            assertThrows(ValidationException.class, () -> distributor.refund("tx-none", Money.of(1), "admin-1"));
            assertThrows(ValidationException.class, () -> distributor.refund("tx-r", Money.of(1), ""));

            assertEquals(Money.of("380.00"), fixture.ledgerStore.getBalance(fixture.payee()).getCurrentBalance());
        }
    }

    @Test
    @DisplayName("Critical failures raise a CRITICAL operator alert after rollback")
    void criticalFailureAlerts() {
        fixture.db.skewBalanceWrites(Money.of("1.00"));

        assertThrows(LedgerException.class, () -> distributor.distribute("tx-c", Money.of(100), LedgerFixture.SCOPE));

        assertEquals(1, fixture.notifications.alertsOfType("LEDGER_INTEGRITY_FAILURE").size());
        assertEquals(AlertLevel.CRITICAL, fixture.notifications.alerts().get(0).getLevel());
        AccountRef payee = fixture.payee();
        assertTrue(fixture.ledgerStore.findBalance(payee).isEmpty());
    }
}
