package io.clinicqueue.queue;

import io.clinicqueue.JobHandler;
import io.clinicqueue.appointment.Appointment;
import io.clinicqueue.appointment.AppointmentStatus;
import io.clinicqueue.core.JobType;
import io.clinicqueue.error.ValidationException;
import io.clinicqueue.notification.NotificationDispatcher;
import io.clinicqueue.notification.NotificationPriority;
import io.clinicqueue.notification.NotificationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Runs RECALCULATE_QUEUE jobs. Optionally tells waiting patients when their estimated start
 * moved.
 */
public class RecalculateQueueHandler implements JobHandler<RecalculateQueuePayload> {
    private static final Logger log = LoggerFactory.getLogger(RecalculateQueueHandler.class);

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    private final QueueRecalculationEngine engine;
    private final NotificationDispatcher notifications;
    private final boolean etaUpdateNotifications;
    private final ZoneId zone;

    public RecalculateQueueHandler(QueueRecalculationEngine engine,
                                   NotificationDispatcher notifications,
                                   boolean etaUpdateNotifications,
                                   ZoneId zone) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.notifications = notifications;
        this.etaUpdateNotifications = etaUpdateNotifications && notifications != null;
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public JobType type() {
        return JobType.RECALCULATE_QUEUE;
    }

    @Override
    public Class<RecalculateQueuePayload> payloadClass() {
        return RecalculateQueuePayload.class;
    }

    @Override
    public void execute(RecalculateQueuePayload payload) {
        if (payload == null || payload.doctorId() == null || payload.doctorId().isBlank() || payload.serviceDay() == null) {
            throw new ValidationException("doctor_id and service_day are required");
        }
        if (payload.effectiveStartPosition() < 1) {
            throw new ValidationException("start_from_position must be at least 1");
        }

        RecalculationResult result = engine.recalculate(payload.doctorDay(), payload.effectiveStartPosition());
        if (etaUpdateNotifications) {
            notifyEtaChanges(result);
        }
    }

    private void notifyEtaChanges(RecalculationResult result) {
        for (QueueSlot slot : result.etaChanges()) {
            Appointment a = slot.appointment();
            // first placement is covered by the scheduling notification
            if (a.estimatedStartTime() == null || a.status() == AppointmentStatus.IN_PROGRESS) {
                continue;
            }
            String eventKey = "eta:" + a.id() + ":" + slot.estimatedStartTime();
            try {
                notifications.notify(eventKey, NotificationType.APPOINTMENT, a.patientId(),
                        "Updated start time",
                        "Your appointment is now expected to start at "
                                + TIME.format(slot.estimatedStartTime().atZone(zone))
                                + " (" + slot.delayMinutes() + " min delay).",
                        NotificationPriority.NORMAL);
            } catch (RuntimeException e) {
                log.warn("eta notification failed appointmentId={} msg={}", a.id(), e.getMessage(), e);
            }
        }
    }
}
