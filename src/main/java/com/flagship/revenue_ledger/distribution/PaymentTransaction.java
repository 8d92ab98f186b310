package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

/**
 * A payment record received from the payment subsystem. Read-only to the ledger.
 *
 * {@code serviceCharge} and {@code payeeAmount} are optional; when the payment
 * subsystem supplies them they must add up to {@code grossAmount}. This is checked,
 * not assumed.
 */
@Value
public class PaymentTransaction {
    String id;
    Money grossAmount;
    Money serviceCharge;
    Money payeeAmount;
    String payeeScopeId;
    PaymentStatus status;

    public static PaymentTransaction completed(String id, Money grossAmount, String payeeScopeId) {
        return new PaymentTransaction(id, grossAmount, null, null, payeeScopeId, PaymentStatus.COMPLETED);
    }

    public boolean isCompleted() {
        return status == PaymentStatus.COMPLETED;
    }

    public boolean hasSplit() {
        return serviceCharge != null && payeeAmount != null;
    }

    public boolean isSplitConsistent(Money tolerance) {
        return !hasSplit()
                || Money.equalsWithinTolerance(serviceCharge.add(payeeAmount), grossAmount, tolerance);
    }
}
