package io.clinicqueue.notification;

import java.util.Map;

public record NotificationStats(long pending, long sent, long failed) {

    public static NotificationStats from(Map<NotificationStatus, Long> counts) {
        return new NotificationStats(
                counts.getOrDefault(NotificationStatus.PENDING, 0L),
                counts.getOrDefault(NotificationStatus.SENT, 0L),
                counts.getOrDefault(NotificationStatus.FAILED, 0L)
        );
    }

    public long total() {
        return pending + sent + failed;
    }
}
