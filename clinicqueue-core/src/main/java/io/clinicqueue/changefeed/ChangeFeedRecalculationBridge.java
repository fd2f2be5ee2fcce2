package io.clinicqueue.changefeed;

import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.core.Priority;
import io.clinicqueue.queue.RecalculationScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns change-feed events into recalculation requests, so edits made outside the lifecycle
 * API still refresh the queue. Never writes appointments itself.
 */
public class ChangeFeedRecalculationBridge implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChangeFeedRecalculationBridge.class);

    private final AppointmentChangeFeed feed;
    private final RecalculationScheduler scheduler;
    private final Map<String, AppointmentChangeFeed.Subscription> subscriptions = new ConcurrentHashMap<>();

    public ChangeFeedRecalculationBridge(AppointmentChangeFeed feed, RecalculationScheduler scheduler) {
        this.feed = Objects.requireNonNull(feed, "feed must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    /**
     * Starts following one doctor's appointments. Idempotent per doctor.
     */
    public void watch(String doctorId) {
        Objects.requireNonNull(doctorId, "doctorId must not be null");
        subscriptions.computeIfAbsent(doctorId, id -> feed.subscribe(id, this::onChange));
    }

    public void unwatch(String doctorId) {
        AppointmentChangeFeed.Subscription subscription = subscriptions.remove(doctorId);
        if (subscription != null) {
            subscription.close();
        }
    }

    void onChange(AppointmentChange change) {
        if (change.touchesOnlyQueueFields()) {
            return;
        }
        DoctorDay doctorDay = change.doctorDay();
        if (doctorDay == null) {
            log.debug("change without doctor/day ignored op={} appointmentId={}", change.operation(), change.appointmentId());
            return;
        }
        try {
            scheduler.request(doctorDay, Priority.MEDIUM);
        } catch (RuntimeException e) {
            log.warn("recalculation request from change feed failed doctorDay={} msg={}",
                    doctorDay.lockKey(), e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        subscriptions.keySet().forEach(this::unwatch);
    }
}
