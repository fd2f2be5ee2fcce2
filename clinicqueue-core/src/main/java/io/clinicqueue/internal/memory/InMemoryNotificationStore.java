package io.clinicqueue.internal.memory;

import io.clinicqueue.notification.NotificationRecord;
import io.clinicqueue.notification.NotificationStatus;
import io.clinicqueue.notification.NotificationStore;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Heap-backed {@link NotificationStore} for tests and single-process setups.
 */
public class InMemoryNotificationStore implements NotificationStore {

    private final Map<String, NotificationRecord> records = new LinkedHashMap<>();
    private final Map<String, String> idsByEventKey = new LinkedHashMap<>();

    @Override
    public synchronized NotificationRecord insertIfAbsent(NotificationRecord record) {
        if (record.eventKey() != null) {
            String existingId = idsByEventKey.get(record.eventKey());
            if (existingId != null) {
                return records.get(existingId);
            }
            idsByEventKey.put(record.eventKey(), record.id());
        }
        records.put(record.id(), record);
        return record;
    }

    @Override
    public synchronized Optional<NotificationRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized boolean markSent(String id, Instant sentAt) {
        NotificationRecord r = records.get(id);
        if (r == null || r.status() != NotificationStatus.PENDING) {
            return false;
        }
        records.put(id, new NotificationRecord(r.id(), r.eventKey(), r.type(), r.recipientId(), r.title(), r.message(),
                r.priority(), NotificationStatus.SENT, r.attempts(), r.errorMessage(), r.createdAt(), sentAt, null));
        return true;
    }

    @Override
    public synchronized boolean recordAttempt(String id, String errorMessage) {
        NotificationRecord r = records.get(id);
        if (r == null || r.status() != NotificationStatus.PENDING) {
            return false;
        }
        records.put(id, new NotificationRecord(r.id(), r.eventKey(), r.type(), r.recipientId(), r.title(), r.message(),
                r.priority(), r.status(), r.attempts() + 1, errorMessage, r.createdAt(), null, null));
        return true;
    }

    @Override
    public synchronized boolean markFailed(String id, Instant failedAt, String errorMessage) {
        NotificationRecord r = records.get(id);
        if (r == null || r.status() != NotificationStatus.PENDING) {
            return false;
        }
        records.put(id, new NotificationRecord(r.id(), r.eventKey(), r.type(), r.recipientId(), r.title(), r.message(),
                r.priority(), NotificationStatus.FAILED, r.attempts(), errorMessage, r.createdAt(), null, failedAt));
        return true;
    }

    @Override
    public synchronized Map<NotificationStatus, Long> countByStatus() {
        Map<NotificationStatus, Long> counts = new EnumMap<>(NotificationStatus.class);
        for (NotificationRecord r : records.values()) {
            counts.merge(r.status(), 1L, Long::sum);
        }
        return counts;
    }
}
