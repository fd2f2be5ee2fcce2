package io.clinicqueue.queue;

import io.clinicqueue.appointment.AppointmentEvent;
import io.clinicqueue.appointment.AppointmentEventListener;
import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.core.EnqueueResult;
import io.clinicqueue.core.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Requests a recalculation of every queue touched by a lifecycle transition. Transitions that
 * move the doctor (start, complete) are the most urgent.
 */
public class RecalculationTrigger implements AppointmentEventListener {
    private static final Logger log = LoggerFactory.getLogger(RecalculationTrigger.class);

    private final RecalculationScheduler scheduler;

    public RecalculationTrigger(RecalculationScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    @Override
    public void onEvent(AppointmentEvent event) {
        Priority priority = switch (event.type()) {
            case STARTED, COMPLETED -> Priority.CRITICAL;
            case CHECKED_IN, CANCELLED, NO_SHOW -> Priority.HIGH;
            case CREATED, RESCHEDULED -> Priority.MEDIUM;
        };
        for (DoctorDay doctorDay : event.affectedQueues()) {
            EnqueueResult result = scheduler.request(doctorDay, priority);
            log.debug("recalculation requested doctorDay={} event={} jobId={} created={}",
                    doctorDay.lockKey(), event.type(), result.jobId(), result.created());
        }
    }
}
