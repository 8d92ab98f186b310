package com.flagship.revenue_ledger.events;

/**
 * Publishes ledger events atomically with the state change they describe.
 * Must be called inside the business transaction; if it rolls back, so does the event.
 */
public interface LedgerEventPublisher {

    void publish(LedgerEvent event);
}
