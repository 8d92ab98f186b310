package com.flagship.revenue_ledger.notification;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.time.Instant;

/**
 * Tells a payee that its share of a payment has been credited.
 */
@Value
public class PayeeRevenueNotification {
    String payeeOwnerId;
    String payeeScopeId;
    String transactionId;
    Money grossAmount;
    Money serviceCharge;
    Money payeeAmount;
    Money newBalance;
    Instant distributedAt;

    /** Human-readable summary, e.g. "Revenue received: ৳950.00 (gross ৳1,000.00, service charge ৳50.00)". */
    public String summary() {
        return String.format("Revenue received: %s (gross %s, service charge %s)",
                payeeAmount.format(), grossAmount.format(), serviceCharge.format());
    }
}
