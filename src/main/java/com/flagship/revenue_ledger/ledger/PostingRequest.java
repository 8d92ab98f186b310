package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.money.Money;
import lombok.Value;

/**
 * Request to move one account balance by one ledger entry.
 */
@Value
public class PostingRequest {
    AccountRef account;
    Money amount;
    EntryType entryType;
    String externalTransactionRef;
    String actorId;
    String description;

    public static PostingRequest of(AccountRef account, Money amount, EntryType entryType,
                                    String externalTransactionRef, String actorId, String description) {
        return new PostingRequest(account, amount, entryType, externalTransactionRef, actorId, description);
    }

    /**
     * @throws ValidationException if the request cannot be posted
     */
    public void validate() {
        if (account == null) {
            throw new ValidationException("Account is required");
        }
        if (entryType == null) {
            throw new ValidationException("Entry type is required");
        }
        if (amount == null || !amount.isPositive()) {
            throw new ValidationException("Posting amount must be greater than zero, got " + amount);
        }
        if (actorId == null || actorId.isBlank()) {
            throw new ValidationException("Actor id is required for every posting");
        }
    }
}
