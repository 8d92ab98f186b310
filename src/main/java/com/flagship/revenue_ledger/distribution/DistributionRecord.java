package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.ledger.AccountRef;
import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Stored fact that a payment transaction has been distributed, and how.
 * Keyed by transaction id; its existence is what makes distribution idempotent.
 */
@Value
public class DistributionRecord {
    String transactionId;
    AccountRef payeeAccount;
    Money grossAmount;
    Money serviceCharge;
    Money payeeAmount;
    BigDecimal rate;
    Money refundedAmount;
    int refundCount;
    Instant distributedAt;

    public static DistributionRecord of(String transactionId, AccountRef payeeAccount,
                                        RevenueSplit split, Instant distributedAt) {
        return new DistributionRecord(transactionId, payeeAccount, split.getGrossAmount(),
                split.getServiceCharge(), split.getPayeeAmount(), split.getRate(),
                Money.ZERO, 0, distributedAt);
    }

    public Money refundable() {
        return grossAmount.subtract(refundedAmount);
    }

    public DistributionRecord withRefund(Money amount) {
        return new DistributionRecord(transactionId, payeeAccount, grossAmount, serviceCharge,
                payeeAmount, rate, refundedAmount.add(amount), refundCount + 1, distributedAt);
    }

    /**
     * External reference for the entries of the next refund, unique per refund
     * so that partial refunds are not mistaken for duplicate postings.
     */
    public String nextRefundReference() {
        return transactionId + "/refund-" + (refundCount + 1);
    }
}
