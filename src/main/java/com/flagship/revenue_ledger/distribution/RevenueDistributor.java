package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.audit.AuditEvent;
import com.flagship.revenue_ledger.audit.AuditEventType;
import com.flagship.revenue_ledger.audit.AuditTrail;
import com.flagship.revenue_ledger.config.LedgerProperties;
import com.flagship.revenue_ledger.events.LedgerEventPublisher;
import com.flagship.revenue_ledger.events.RevenueDistributedEvent;
import com.flagship.revenue_ledger.events.RevenueRefundedEvent;
import com.flagship.revenue_ledger.exception.AccountNotFoundException;
import com.flagship.revenue_ledger.exception.CalculationIntegrityException;
import com.flagship.revenue_ledger.exception.DuplicateDistributionException;
import com.flagship.revenue_ledger.exception.IntegrityException;
import com.flagship.revenue_ledger.exception.LedgerException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.AccountRef;
import com.flagship.revenue_ledger.ledger.EntryType;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.ledger.TransactionRunner;
import com.flagship.revenue_ledger.ledger.UpdatedBalance;
import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.notification.AlertLevel;
import com.flagship.revenue_ledger.notification.LedgerAlert;
import com.flagship.revenue_ledger.notification.NotificationGateway;
import com.flagship.revenue_ledger.notification.PayeeRevenueNotification;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Splits completed payments into a platform service charge and a payee share,
 * and posts both sides to the ledger atomically.
 *
 * Key principles:
 * - Validation, rate resolution, split calculation and payee lookup all happen
 *   before anything is written
 * - Claiming the transaction id, both credits and the outbox event share one
 *   database transaction; any failure rolls back all of them
 * - A payment transaction is distributed at most once (transaction id is the
 *   idempotency key)
 * - After posting, the balance deltas are re-verified against the gross amount
 * - Payee notification and the audit record happen after commit and can never
 *   fail the distribution
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RevenueDistributor {

    public static final String SYSTEM_ACTOR = "system:revenue-distributor";

    private final LedgerStore ledgerStore;
    private final TransactionRunner transactionRunner;
    private final DistributionRepository distributionRepository;
    private final PayeeAccountResolver payeeAccountResolver;
    private final ServiceChargeRateProvider rateProvider;
    private final DistributionIdempotencyService idempotencyService;
    private final LedgerEventPublisher eventPublisher;
    private final NotificationGateway notificationGateway;
    private final AuditTrail auditTrail;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Distributes a payment record received from the payment subsystem.
     *
     * @throws ValidationException if the payment is not completed
     * @throws CalculationIntegrityException if the record's own split does not add up
     */
    public DistributionResult distribute(PaymentTransaction payment) {
        if (payment == null) {
            throw new ValidationException("Payment transaction is required");
        }
        if (!payment.isCompleted()) {
            throw new ValidationException(String.format(
                "Payment %s is %s; only completed payments are distributed", payment.getId(), payment.getStatus()));
        }
        if (!payment.isSplitConsistent(tolerance())) {
            metrics.recordIntegrityFailure("payment_record");
            throw new CalculationIntegrityException(String.format(
                "Payment %s reports serviceCharge=%s + payeeAmount=%s != gross=%s",
                payment.getId(), payment.getServiceCharge(), payment.getPayeeAmount(), payment.getGrossAmount()));
        }
        return distribute(payment.getId(), payment.getGrossAmount(), payment.getPayeeScopeId());
    }

    /**
     * Splits {@code grossAmount} and credits the payee and platform accounts.
     *
     * @param transactionId payment transaction id; the idempotency key
     * @param grossAmount amount paid by the patient
     * @param payeeScopeId hospital (payee scope) receiving the payee share
     * @return both postings and the resulting balances
     * @throws ValidationException for a missing id or an out-of-range amount
     * @throws DuplicateDistributionException if the transaction was already distributed
     * @throws AccountNotFoundException if no payee account is registered for the scope
     * @throws IntegrityException if post-write verification fails (rolled back)
     */
    public DistributionResult distribute(String transactionId, Money grossAmount, String payeeScopeId) {
        long startNanos = System.nanoTime();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(transactionId));

        try {
            requireTransactionId(transactionId);
            validateGrossAmount(grossAmount);

            if (idempotencyService.isDistributed(transactionId)) {
                throw new DuplicateDistributionException(transactionId);
            }

            RevenueSplit split = previewSplit(grossAmount, payeeScopeId);
            AccountRef payee = payeeAccountResolver.resolve(payeeScopeId)
                .orElseThrow(() -> new AccountNotFoundException(
                    "No payee account registered for scope " + payeeScopeId));
            AccountRef platform = platformAccount();

            DistributionResult result = transactionRunner.inTransaction(
                () -> postDistribution(transactionId, split, payee, platform));

            idempotencyService.remember(transactionId);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.recordDistribution("success");
            metrics.recordDistributionLatency(elapsed);

            log.info("Revenue distributed: gross={}, rate={}, payee={} -> {}, platform={} -> {}, duration={}ms",
                    grossAmount, split.getRate(), split.getPayeeAmount(), payee.key(),
                    split.getServiceCharge(), platform.key(), elapsed.toMillis());

            notifyPayee(result);
            recordAudit(AuditEventType.REVENUE_DISTRIBUTED, transactionId, SYSTEM_ACTOR, distributionChanges(result));
            return result;

        } catch (DuplicateDistributionException e) {
            metrics.recordDistribution("duplicate");
            log.warn("Rejected duplicate distribution: {}", e.getMessage());
            throw e;
        } catch (LedgerException e) {
            handleFailure("distribute", transactionId, e);
            metrics.recordDistribution(e.isCritical() ? "error" : "rejected");
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private DistributionResult postDistribution(String transactionId, RevenueSplit split,
                                                AccountRef payee, AccountRef platform) {
        Instant now = clock.instant();
        distributionRepository.claim(DistributionRecord.of(transactionId, payee, split, now));

        // Payee first, then platform.
        UpdatedBalance payeePosting = creditIfPositive(payee, split.getPayeeAmount(), transactionId,
                "Revenue share for transaction " + transactionId);
        UpdatedBalance platformPosting = creditIfPositive(platform, split.getServiceCharge(), transactionId,
                "Service charge for transaction " + transactionId);

        Money totalDelta = delta(payeePosting).add(delta(platformPosting));
        if (!Money.equalsWithinTolerance(totalDelta, split.getGrossAmount(), tolerance())) {
            throw new IntegrityException(String.format(
                "Balance deltas %s do not match gross %s for transaction %s",
                totalDelta, split.getGrossAmount(), transactionId));
        }

        eventPublisher.publish(new RevenueDistributedEvent(
            UUID.randomUUID(),
            transactionId,
            payee.key(),
            platform.key(),
            split.getGrossAmount(),
            split.getServiceCharge(),
            split.getPayeeAmount(),
            split.getRate(),
            now
        ));

        return new DistributionResult(
            transactionId,
            payee,
            platform,
            split.getGrossAmount(),
            split.getRate(),
            split.getServiceCharge(),
            split.getPayeeAmount(),
            balanceAfter(payeePosting, payee),
            balanceAfter(platformPosting, platform),
            payeePosting != null ? payeePosting.getEntry().getId() : null,
            platformPosting != null ? platformPosting.getEntry().getId() : null,
            now
        );
    }

    /**
     * Computes the split that {@link #distribute} would post, without posting anything.
     */
    public RevenueSplit previewSplit(Money grossAmount, String payeeScopeId) {
        validateGrossAmount(grossAmount);
        BigDecimal rate = rateProvider.rateFor(payeeScopeId);
        return RevenueSplit.compute(grossAmount, rate, tolerance());
    }

    /**
     * Reverses (part of) a distribution. The payee is debited its proportional share
     * of the refund and the platform the remainder, so both debits sum exactly to
     * {@code refundAmount}.
     *
     * @throws ValidationException for unknown transactions or amounts above what is still refundable
     */
    public RefundResult refund(String transactionId, Money refundAmount, String actorId) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(transactionId));
        try {
            requireTransactionId(transactionId);
            if (refundAmount == null || !refundAmount.isPositive()) {
                throw new ValidationException("Refund amount must be greater than zero, got " + refundAmount);
            }
            if (actorId == null || actorId.isBlank()) {
                throw new ValidationException("Actor id is required for a refund");
            }

            RefundResult result = transactionRunner.inTransaction(
                () -> postRefund(transactionId, refundAmount, actorId));

            metrics.recordRefund("success");
            log.info("Revenue refunded: amount={}, payeeDebit={}, platformDebit={}, remaining={}",
                    refundAmount, result.getPayeeDebit(), result.getPlatformDebit(), result.getRemainingRefundable());

            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put("refundAmount", refundAmount.toBigDecimal());
            changes.put("payeeDebit", result.getPayeeDebit().toBigDecimal());
            changes.put("platformDebit", result.getPlatformDebit().toBigDecimal());
            changes.put("totalRefunded", result.getTotalRefunded().toBigDecimal());
            recordAudit(AuditEventType.REVENUE_REFUNDED, transactionId, actorId, changes);
            return result;

        } catch (LedgerException e) {
            handleFailure("refund", transactionId, e);
            metrics.recordRefund(e.isCritical() ? "error" : "rejected");
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private RefundResult postRefund(String transactionId, Money refundAmount, String actorId) {
        DistributionRecord record = distributionRepository.findForUpdate(transactionId)
            .orElseThrow(() -> new ValidationException("No distribution recorded for transaction " + transactionId));

        if (refundAmount.isGreaterThan(record.refundable())) {
            throw new ValidationException(String.format(
                "Refund %s exceeds refundable amount %s for transaction %s",
                refundAmount, record.refundable(), transactionId));
        }

        BigDecimal ratio = refundAmount.toBigDecimal()
            .divide(record.getGrossAmount().toBigDecimal(), 10, RoundingMode.HALF_UP);
        Money payeeDebit = record.getPayeeAmount().multiply(ratio);
        if (payeeDebit.isGreaterThan(refundAmount)) {
            payeeDebit = refundAmount;
        }
        Money platformDebit = refundAmount.subtract(payeeDebit);

        String reference = record.nextRefundReference();
        debitIfPositive(record.getPayeeAccount(), payeeDebit, reference, actorId,
                "Refund of revenue share for transaction " + transactionId);
        debitIfPositive(platformAccount(), platformDebit, reference, actorId,
                "Refund of service charge for transaction " + transactionId);

        DistributionRecord updated = record.withRefund(refundAmount);
        distributionRepository.updateRefund(updated);

        eventPublisher.publish(new RevenueRefundedEvent(
            UUID.randomUUID(),
            transactionId,
            refundAmount,
            payeeDebit,
            platformDebit,
            updated.getRefundedAmount(),
            actorId,
            clock.instant()
        ));

        return new RefundResult(transactionId, refundAmount, payeeDebit, platformDebit,
                updated.getRefundedAmount(), updated.refundable());
    }

    public AccountRef platformAccount() {
        return AccountRef.platform(properties.getPlatformOwnerId());
    }

    private UpdatedBalance creditIfPositive(AccountRef account, Money amount, String reference, String description) {
        if (!amount.isPositive()) {
            return null;
        }
        return ledgerStore.post(account, amount, EntryType.CREDIT, reference, SYSTEM_ACTOR, description);
    }

    private void debitIfPositive(AccountRef account, Money amount, String reference, String actorId,
                                 String description) {
        if (amount.isPositive()) {
            ledgerStore.post(account, amount, EntryType.DEBIT, reference, actorId, description);
        }
    }

    private Money balanceAfter(UpdatedBalance posting, AccountRef account) {
        if (posting != null) {
            return posting.getBalance().getCurrentBalance();
        }
        return ledgerStore.findBalance(account).map(b -> b.getCurrentBalance()).orElse(Money.ZERO);
    }

    private static Money delta(UpdatedBalance posting) {
        return posting != null ? posting.delta() : Money.ZERO;
    }

    private void validateGrossAmount(Money grossAmount) {
        LedgerProperties.Distribution limits = properties.getDistribution();
        if (grossAmount == null) {
            throw new ValidationException("Gross amount is required");
        }
        if (grossAmount.toBigDecimal().compareTo(limits.getMinAmount()) < 0
                || grossAmount.toBigDecimal().compareTo(limits.getMaxAmount()) > 0) {
            throw new ValidationException(String.format(
                "Gross amount %s is outside the accepted range %s to %s",
                grossAmount.format(), Money.of(limits.getMinAmount()).format(),
                Money.of(limits.getMaxAmount()).format()));
        }
    }

    private static void requireTransactionId(String transactionId) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new ValidationException("Transaction id is required");
        }
    }

    private void handleFailure(String operation, String transactionId, LedgerException e) {
        if (!e.isCritical()) {
            log.warn("{} rejected for transaction {}: {}", operation, transactionId, e.getMessage());
            return;
        }
        metrics.recordIntegrityFailure(operation);
        log.error("{} aborted and rolled back for transaction {}: {}", operation, transactionId, e.getMessage(), e);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        details.put("transactionId", String.valueOf(transactionId));
        details.put("error", e.getClass().getSimpleName());
        notificationGateway.raiseAlert(LedgerAlert.of("LEDGER_INTEGRITY_FAILURE", AlertLevel.CRITICAL,
                e.getMessage(), details, clock.instant()));
    }

    private void notifyPayee(DistributionResult result) {
        try {
            notificationGateway.notifyPayee(new PayeeRevenueNotification(
                result.getPayeeAccount().getOwnerId(),
                result.getPayeeAccount().getScopeId(),
                result.getTransactionId(),
                result.getGrossAmount(),
                result.getServiceCharge(),
                result.getPayeeAmount(),
                result.getPayeeBalance(),
                result.getDistributedAt()
            ));
        } catch (RuntimeException e) {
            metrics.recordNotificationFailure("payee");
            log.warn("Payee notification failed for transaction {}: {}", result.getTransactionId(), e.getMessage());
        }
    }

    private void recordAudit(AuditEventType type, String transactionId, String actorId, Map<String, Object> changes) {
        try {
            auditTrail.record(AuditEvent.of(type, "PaymentTransaction", transactionId, actorId,
                    changes, null, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Best-effort audit write failed: type={}, transaction={}, error={}",
                    type, transactionId, e.getMessage());
        }
    }

    private static Map<String, Object> distributionChanges(DistributionResult result) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("grossAmount", result.getGrossAmount().toBigDecimal());
        changes.put("rate", result.getRate());
        changes.put("serviceCharge", result.getServiceCharge().toBigDecimal());
        changes.put("payeeAmount", result.getPayeeAmount().toBigDecimal());
        changes.put("payeeAccount", result.getPayeeAccount().key());
        changes.put("payeeBalanceAfter", result.getPayeeBalance().toBigDecimal());
        changes.put("platformBalanceAfter", result.getPlatformBalance().toBigDecimal());
        return changes;
    }

    private Money tolerance() {
        return Money.of(properties.getTolerance());
    }
}
