package io.clinicqueue.notification;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence port for notification records.
 */
public interface NotificationStore {

    /**
     * Inserts the record unless one with the same non-null event key exists.
     *
     * @return the stored record: the new one, or the existing one for a known event key
     */
    NotificationRecord insertIfAbsent(NotificationRecord record);

    Optional<NotificationRecord> findById(String id);

    /**
     * PENDING to SENT.
     *
     * @return false if the record is missing or no longer PENDING
     */
    boolean markSent(String id, Instant sentAt);

    /**
     * Counts a failed attempt on a PENDING record and keeps the last error.
     */
    boolean recordAttempt(String id, String errorMessage);

    /**
     * PENDING to FAILED. FAILED is permanent.
     */
    boolean markFailed(String id, Instant failedAt, String errorMessage);

    Map<NotificationStatus, Long> countByStatus();
}
