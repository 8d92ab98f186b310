package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.ledger.AccountRef;
import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class DistributionResult {
    String transactionId;
    AccountRef payeeAccount;
    AccountRef platformAccount;
    Money grossAmount;
    BigDecimal rate;
    Money serviceCharge;
    Money payeeAmount;
    Money payeeBalance;
    Money platformBalance;
    UUID payeeEntryId;        // null when the payee share is zero
    UUID platformEntryId;     // null when the service charge is zero
    Instant distributedAt;
}
