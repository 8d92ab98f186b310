package com.flagship.revenue_ledger.correction;

import com.flagship.revenue_ledger.ledger.AccountRef;

import java.util.List;

public interface CorrectionRepository {

    void save(BalanceCorrection correction);

    /**
     * Corrections for one account, oldest first.
     */
    List<BalanceCorrection> findByAccount(AccountRef account);
}
