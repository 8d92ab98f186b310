package com.flagship.revenue_ledger.distribution;

import java.util.Optional;

/**
 * Storage port for distribution records.
 */
public interface DistributionRepository {

    /**
     * Inserts the record. Must run inside the distribution transaction.
     *
     * @throws com.flagship.revenue_ledger.exception.DuplicateDistributionException
     *         if the transaction id has already been claimed
     */
    void claim(DistributionRecord record);

    Optional<DistributionRecord> find(String transactionId);

    /**
     * Loads and locks the record for a refund.
     */
    Optional<DistributionRecord> findForUpdate(String transactionId);

    boolean exists(String transactionId);

    void updateRefund(DistributionRecord record);
}
