package io.clinicqueue.notification;

public enum NotificationType {
    APPOINTMENT,
    PAYMENT,
    SYSTEM
}
