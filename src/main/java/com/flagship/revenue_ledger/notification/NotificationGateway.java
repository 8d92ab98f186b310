package com.flagship.revenue_ledger.notification;

/**
 * Fire-and-forget sink for payee notifications and operator alerts.
 *
 * Implementations must not throw: a failed notification never fails a
 * ledger operation.
 */
public interface NotificationGateway {

    void notifyPayee(PayeeRevenueNotification notification);

    void raiseAlert(LedgerAlert alert);
}
