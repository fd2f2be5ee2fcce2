package io.clinicqueue.notification;

/**
 * Delivery channel. Implementations throw on failure; the caller decides about retries.
 */
public interface NotificationSender {
    void send(NotificationRecord notification);
}
