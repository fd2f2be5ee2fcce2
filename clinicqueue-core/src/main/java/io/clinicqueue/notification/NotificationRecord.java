package io.clinicqueue.notification;

import java.time.Instant;

/**
 * A message to one recipient and its delivery state.
 *
 * @param eventKey idempotency key of the event that produced the notification; may be null
 * @param attempts failed delivery attempts so far
 */
public record NotificationRecord(
        String id,
        String eventKey,
        NotificationType type,
        String recipientId,
        String title,
        String message,
        NotificationPriority priority,
        NotificationStatus status,
        int attempts,
        String errorMessage,
        Instant createdAt,
        Instant sentAt,
        Instant failedAt
) {

    public static NotificationRecord pending(String id,
                                             String eventKey,
                                             NotificationType type,
                                             String recipientId,
                                             String title,
                                             String message,
                                             NotificationPriority priority,
                                             Instant createdAt) {
        return new NotificationRecord(id, eventKey, type, recipientId, title, message, priority,
                NotificationStatus.PENDING, 0, null, createdAt, null, null);
    }
}
