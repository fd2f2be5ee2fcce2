package io.clinicqueue.notification;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SendNotificationPayload(
        @JsonProperty("notification_id") String notificationId,
        @JsonProperty("recipient_id") String recipientId,
        @JsonProperty("type") NotificationType type,
        @JsonProperty("title") String title,
        @JsonProperty("message") String message,
        @JsonProperty("priority") NotificationPriority priority
) {

    public static SendNotificationPayload of(NotificationRecord record) {
        return new SendNotificationPayload(record.id(), record.recipientId(), record.type(),
                record.title(), record.message(), record.priority());
    }
}
