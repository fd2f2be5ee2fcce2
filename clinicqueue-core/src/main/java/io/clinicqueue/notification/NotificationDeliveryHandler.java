package io.clinicqueue.notification;

import io.clinicqueue.JobHandler;
import io.clinicqueue.core.JobType;
import io.clinicqueue.error.DeliveryException;
import io.clinicqueue.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Runs SEND_NOTIFICATION jobs. A sender failure becomes a {@link DeliveryException} so the
 * job queue retries it; once retries run out the record is marked FAILED for good.
 */
public class NotificationDeliveryHandler implements JobHandler<SendNotificationPayload> {
    private static final Logger log = LoggerFactory.getLogger(NotificationDeliveryHandler.class);

    private final NotificationStore store;
    private final NotificationSender sender;
    private final NotificationMetrics metrics;
    private final Clock clock;

    public NotificationDeliveryHandler(NotificationStore store,
                                       NotificationSender sender,
                                       NotificationMetrics metrics,
                                       Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public JobType type() {
        return JobType.SEND_NOTIFICATION;
    }

    @Override
    public Class<SendNotificationPayload> payloadClass() {
        return SendNotificationPayload.class;
    }

    @Override
    public void execute(SendNotificationPayload payload) {
        if (payload == null || payload.notificationId() == null) {
            throw new ValidationException("notification_id is required");
        }
        NotificationRecord record = store.findById(payload.notificationId())
                .orElseThrow(() -> new ValidationException("notification not found: " + payload.notificationId()));

        if (record.status() != NotificationStatus.PENDING) {
            // a retried job after a lost acknowledgement; nothing left to do
            log.debug("notification already settled id={} status={}", record.id(), record.status());
            return;
        }

        try {
            sender.send(record);
        } catch (RuntimeException e) {
            store.recordAttempt(record.id(), e.getMessage());
            metrics.recordDeliveryResult(NotificationMetrics.RESULT_RETRY);
            throw new DeliveryException("delivery failed for notification " + record.id() + ": " + e.getMessage(), e);
        }

        store.markSent(record.id(), clock.instant());
        metrics.recordDeliveryResult(NotificationMetrics.RESULT_SENT);
    }

    @Override
    public void onExhausted(SendNotificationPayload payload, Exception lastError) {
        if (payload == null || payload.notificationId() == null) {
            return;
        }
        String message = lastError == null ? null : lastError.getMessage();
        if (store.markFailed(payload.notificationId(), clock.instant(), message)) {
            metrics.recordDeliveryResult(NotificationMetrics.RESULT_FAILED);
            log.warn("notification failed permanently id={} msg={}", payload.notificationId(), message);
        }
    }
}
