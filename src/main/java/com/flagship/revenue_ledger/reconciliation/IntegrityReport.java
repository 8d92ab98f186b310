package com.flagship.revenue_ledger.reconciliation;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Result of one integrity pass over recent ledger entries.
 */
@Value
public class IntegrityReport {
    Instant windowStart;
    Instant windowEnd;
    int entriesChecked;
    List<Issue> issues;

    public boolean isClean() {
        return issues.isEmpty();
    }

    public enum IssueType {
        ARITHMETIC,
        CHAIN_BREAK,
        DUPLICATE_POSTING
    }

    @Value
    public static class Issue {
        IssueType type;
        String accountKey;
        String entryId;
        String detail;
    }
}
