package io.clinicqueue.notification;

import io.clinicqueue.core.Priority;

/**
 * Urgency of a notification, mapped onto the priority of its delivery job.
 */
public enum NotificationPriority {
    LOW(Priority.LOW),
    NORMAL(Priority.NORMAL),
    HIGH(Priority.HIGH);

    private final Priority jobPriority;

    NotificationPriority(Priority jobPriority) {
        this.jobPriority = jobPriority;
    }

    public Priority jobPriority() {
        return jobPriority;
    }
}
