package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

@Value
public class RefundResult {
    String transactionId;
    Money refundAmount;
    Money payeeDebit;
    Money platformDebit;
    Money totalRefunded;
    Money remainingRefundable;
}
