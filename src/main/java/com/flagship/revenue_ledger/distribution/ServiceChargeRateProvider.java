package com.flagship.revenue_ledger.distribution;

import java.math.BigDecimal;

/**
 * Supplies the service charge rate for a payee scope.
 */
public interface ServiceChargeRateProvider {

    /**
     * @return a rate in [0, max rate]; never null
     */
    BigDecimal rateFor(String payeeScopeId);
}
