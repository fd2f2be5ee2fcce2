package io.clinicqueue.notification;

public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED
}
