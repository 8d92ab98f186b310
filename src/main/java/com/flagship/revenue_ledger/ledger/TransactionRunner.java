package com.flagship.revenue_ledger.ledger;

import java.util.function.Supplier;

/**
 * Runs work inside one storage transaction.
 *
 * Calls nest: an inner call joins the outer transaction, and any exception that
 * escapes the outermost call rolls back everything done inside it.
 */
public interface TransactionRunner {

    <T> T inTransaction(Supplier<T> work);

    default void runInTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }
}
