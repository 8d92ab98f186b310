package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.exception.CalculationIntegrityException;
import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Service charge / payee split of one gross amount.
 */
@Value
public class RevenueSplit {
    Money grossAmount;
    BigDecimal rate;
    Money serviceCharge;
    Money payeeAmount;

    /**
     * serviceCharge = round(gross * rate), payeeAmount = round(gross - serviceCharge).
     *
     * @throws CalculationIntegrityException if the parts do not add back up to the gross
     */
    public static RevenueSplit compute(Money grossAmount, BigDecimal rate, Money tolerance) {
        Money serviceCharge = grossAmount.multiply(rate);
        Money payeeAmount = grossAmount.subtract(serviceCharge);

        if (!Money.equalsWithinTolerance(serviceCharge.add(payeeAmount), grossAmount, tolerance)) {
            throw new CalculationIntegrityException(String.format(
                "Split does not add up: serviceCharge=%s + payeeAmount=%s != gross=%s (rate %s)",
                serviceCharge, payeeAmount, grossAmount, rate));
        }
        return new RevenueSplit(grossAmount, rate, serviceCharge, payeeAmount);
    }
}
