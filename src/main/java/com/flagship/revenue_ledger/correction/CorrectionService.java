package com.flagship.revenue_ledger.correction;

import com.flagship.revenue_ledger.audit.AuditEvent;
import com.flagship.revenue_ledger.audit.AuditEventType;
import com.flagship.revenue_ledger.audit.AuditTrail;
import com.flagship.revenue_ledger.config.LedgerProperties;
import com.flagship.revenue_ledger.events.BalanceCorrectedEvent;
import com.flagship.revenue_ledger.events.LedgerEventPublisher;
import com.flagship.revenue_ledger.exception.AuditWriteException;
import com.flagship.revenue_ledger.exception.LedgerException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.AccountBalance;
import com.flagship.revenue_ledger.ledger.AccountRef;
import com.flagship.revenue_ledger.ledger.EntryType;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.ledger.TransactionRunner;
import com.flagship.revenue_ledger.ledger.UpdatedBalance;
import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.notification.AlertLevel;
import com.flagship.revenue_ledger.notification.LedgerAlert;
import com.flagship.revenue_ledger.notification.NotificationGateway;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Privileged, audited balance adjustment.
 *
 * The adjustment entry, the correction row, the audit event and the outbox event
 * are written in one transaction. The audit write is mandatory: if it fails,
 * everything is rolled back and an operator alert is raised.
 *
 * Callers are expected to have authorized the admin actor already.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorrectionService {

    private final LedgerStore ledgerStore;
    private final CorrectionRepository correctionRepository;
    private final TransactionRunner transactionRunner;
    private final AuditTrail auditTrail;
    private final LedgerEventPublisher eventPublisher;
    private final NotificationGateway notificationGateway;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Same as {@link #correct(AccountRef, Money, Money, String, String, String)} with amounts
     * given as text, e.g. {@code "৳500.00"}.
     */
    public BalanceCorrection correct(AccountRef account, String currentBalance, String targetBalance,
                                     String reason, String evidence, String adminActorId) {
        return correct(account, Money.parse(currentBalance), Money.parse(targetBalance), reason, evidence,
                adminActorId);
    }

    /**
     * Moves {@code account} from {@code currentBalance} to {@code targetBalance} with a single
     * adjustment entry of {@code |target - current|}. The balance row stays locked from the
     * staleness check until commit, and the adjustment is computed from the locked balance.
     *
     * @param currentBalance the balance the admin saw; must match the stored balance
     * @throws ValidationException if reason or actor is blank, the target is missing, the
     *         difference is zero, or {@code currentBalance} is stale
     * @throws com.flagship.revenue_ledger.exception.AccountNotFoundException if the account has no balance
     * @throws AuditWriteException if the audit trail could not be written (rolled back)
     */
    public BalanceCorrection correct(AccountRef account, Money currentBalance, Money targetBalance,
                                     String reason, String evidence, String adminActorId) {
        if (account == null) {
            throw new ValidationException("Account is required");
        }
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A reason is required for a balance correction");
        }
        if (adminActorId == null || adminActorId.isBlank()) {
            throw new ValidationException("Admin actor id is required for a balance correction");
        }
        if (currentBalance == null || targetBalance == null) {
            throw new ValidationException("Current and target balances are required");
        }
        Money difference = targetBalance.subtract(currentBalance);
        if (difference.isZero()) {
            throw new ValidationException("Target balance equals current balance; nothing to correct");
        }

        MDC.put(CorrelationContext.ACCOUNT_MDC_KEY, account.key());
        try {
            BalanceCorrection correction = transactionRunner.inTransaction(
                () -> applyCorrection(account, currentBalance, targetBalance, reason.trim(), evidence, adminActorId));

            metrics.recordCorrection("success");
            log.info("Balance corrected by {}: account={}, {} -> {} (difference {}), reason={}",
                    adminActorId, account.key(), correction.getOriginalBalance(), targetBalance,
                    correction.getDifference(), correction.getReason());
            return correction;

        } catch (AuditWriteException e) {
            metrics.recordCorrection("audit_failure");
            metrics.recordIntegrityFailure("correct");
            log.error("Balance correction rolled back, audit trail unavailable: account={}, actor={}, error={}",
                    account.key(), adminActorId, e.getMessage(), e);
            raiseAuditFailureAlert(account, adminActorId, difference, e);
            throw e;
        } catch (LedgerException e) {
            metrics.recordCorrection(e.isCritical() ? "error" : "rejected");
            if (e.isCritical()) {
                log.error("Balance correction failed: account={}, error={}", account.key(), e.getMessage(), e);
            } else {
                log.warn("Balance correction rejected: account={}, error={}", account.key(), e.getMessage());
            }
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_MDC_KEY);
        }
    }

    private BalanceCorrection applyCorrection(AccountRef account, Money currentBalance, Money targetBalance,
                                              String reason, String evidence, String adminActorId) {
        AccountBalance stored = ledgerStore.lockBalance(account);
        Money lockedBalance = stored.getCurrentBalance();
        if (!Money.equalsWithinTolerance(lockedBalance, currentBalance, Money.of(properties.getTolerance()))) {
            throw new ValidationException(String.format(
                "Stale current balance for %s: given %s, stored %s",
                account.key(), currentBalance.format(), lockedBalance.format()));
        }
        Money difference = targetBalance.subtract(lockedBalance);
        if (difference.isZero()) {
            throw new ValidationException("Stored balance already equals target balance; nothing to correct");
        }

        UUID correctionId = UUID.randomUUID();
        UpdatedBalance posting = ledgerStore.post(account, difference.abs(), EntryType.adjustmentFor(difference),
                "correction:" + correctionId, adminActorId, "Balance correction: " + reason);

        Instant now = clock.instant();
        BalanceCorrection correction = new BalanceCorrection(
            correctionId,
            stored.getId(),
            account,
            lockedBalance,
            targetBalance,
            difference,
            reason,
            evidence,
            adminActorId,
            posting.getEntry().getId(),
            now
        );
        correctionRepository.save(correction);

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("balanceBefore", posting.getEntry().getBalanceBefore().toBigDecimal());
        changes.put("balanceAfter", posting.getEntry().getBalanceAfter().toBigDecimal());
        changes.put("difference", difference.toBigDecimal());
        changes.put("ledgerEntryId", posting.getEntry().getId().toString());
        if (evidence != null) {
            changes.put("evidence", evidence);
        }
        try {
            auditTrail.record(AuditEvent.of(AuditEventType.BALANCE_CORRECTION, "AccountBalance", account.key(),
                    adminActorId, changes, reason, now));
        } catch (RuntimeException e) {
            throw new AuditWriteException("Audit write failed for correction " + correctionId, e);
        }

        eventPublisher.publish(new BalanceCorrectedEvent(
            UUID.randomUUID(),
            correctionId,
            account.key(),
            lockedBalance,
            posting.getBalance().getCurrentBalance(),
            difference,
            adminActorId,
            now
        ));
        return correction;
    }

    public List<BalanceCorrection> corrections(AccountRef account) {
        return correctionRepository.findByAccount(account);
    }

    private void raiseAuditFailureAlert(AccountRef account, String adminActorId, Money difference,
                                        AuditWriteException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("account", account.key());
        details.put("adminActorId", adminActorId);
        details.put("difference", difference.toBigDecimal());
        details.put("error", String.valueOf(e.getCause()));
        notificationGateway.raiseAlert(LedgerAlert.of("CORRECTION_AUDIT_FAILURE", AlertLevel.CRITICAL,
                "Balance correction aborted: audit trail write failed", details, clock.instant()));
    }
}
