package com.flagship.revenue_ledger.support;

import com.flagship.revenue_ledger.notification.LedgerAlert;
import com.flagship.revenue_ledger.notification.NotificationGateway;
import com.flagship.revenue_ledger.notification.PayeeRevenueNotification;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every notification and alert in memory. Can be told to throw from
 * {@link #notifyPayee} to check that callers survive a broken sink.
 */
public class RecordingNotificationGateway implements NotificationGateway {

    private final List<PayeeRevenueNotification> notifications = new CopyOnWriteArrayList<>();
    private final List<LedgerAlert> alerts = new CopyOnWriteArrayList<>();
    private volatile boolean failPayeeNotifications;

    @Override
    public void notifyPayee(PayeeRevenueNotification notification) {
        if (failPayeeNotifications) {
            throw new IllegalStateException("notification service unreachable");
        }
        notifications.add(notification);
    }

    @Override
    public void raiseAlert(LedgerAlert alert) {
        alerts.add(alert);
    }

    public void failPayeeNotifications(boolean fail) {
        this.failPayeeNotifications = fail;
    }

    public List<PayeeRevenueNotification> notifications() {
        return List.copyOf(notifications);
    }

    public List<LedgerAlert> alerts() {
        return List.copyOf(alerts);
    }

    public List<LedgerAlert> alertsOfType(String alertType) {
        return alerts.stream().filter(a -> a.getAlertType().equals(alertType)).toList();
    }
}
