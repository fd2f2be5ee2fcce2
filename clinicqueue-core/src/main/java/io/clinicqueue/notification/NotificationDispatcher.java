package io.clinicqueue.notification;

import io.clinicqueue.JobQueue;
import io.clinicqueue.core.JobType;
import io.clinicqueue.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Records notifications and hands their delivery to the job queue.
 *
 * <p>{@link #notify} returns as soon as the record is stored and the delivery job accepted.
 * Delivery itself runs in {@link NotificationDeliveryHandler}.
 */
public class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationStore store;
    private final JobQueue jobQueue;
    private final Clock clock;
    private final int maxRetries;

    public NotificationDispatcher(NotificationStore store, JobQueue jobQueue, Clock clock, int maxRetries) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive");
        }
        this.maxRetries = maxRetries;
    }

    public NotificationRecord notify(NotificationType type,
                                     String recipientId,
                                     String title,
                                     String message,
                                     NotificationPriority priority) {
        return notify(null, type, recipientId, title, message, priority);
    }

    /**
     * Like {@link #notify(NotificationType, String, String, String, NotificationPriority)}, but a
     * second call with the same {@code eventKey} returns the first record instead of creating
     * another. If that record is still PENDING its delivery job is requested again; the job's
     * unique key merges the request into a queued job, and a record left without one (the
     * process died between the two writes) gets delivered after all.
     */
    public NotificationRecord notify(String eventKey,
                                     NotificationType type,
                                     String recipientId,
                                     String title,
                                     String message,
                                     NotificationPriority priority) {
        if (recipientId == null || recipientId.isBlank()) {
            throw new ValidationException("recipientId is required");
        }
        if (title == null || title.isBlank()) {
            throw new ValidationException("title is required");
        }
        Objects.requireNonNull(type, "type must not be null");
        NotificationPriority effectivePriority = priority == null ? NotificationPriority.NORMAL : priority;

        Instant now = clock.instant();
        NotificationRecord candidate = NotificationRecord.pending(
                UUID.randomUUID().toString(), eventKey, type, recipientId, title, message, effectivePriority, now);
        NotificationRecord stored = store.insertIfAbsent(candidate);
        if (!stored.id().equals(candidate.id())) {
            log.debug("notification already recorded eventKey={} id={} status={}", eventKey, stored.id(), stored.status());
            if (stored.status() == NotificationStatus.PENDING) {
                enqueueDelivery(stored);
            }
            return stored;
        }

        try {
            enqueueDelivery(stored);
        } catch (RuntimeException e) {
            store.markFailed(stored.id(), clock.instant(), "delivery job not accepted: " + e.getMessage());
            throw e;
        }
        log.debug("notification queued id={} type={} recipientId={}", stored.id(), type, recipientId);
        return stored;
    }

    private void enqueueDelivery(NotificationRecord record) {
        jobQueue.create(JobType.SEND_NOTIFICATION, SendNotificationPayload.of(record))
                .uniqueKey(record.id())
                .priority(record.priority().jobPriority())
                .maxRetries(maxRetries)
                .save();
    }

    public Optional<NotificationRecord> find(String id) {
        return store.findById(id);
    }

    public NotificationStats stats() {
        return NotificationStats.from(store.countByStatus());
    }
}
