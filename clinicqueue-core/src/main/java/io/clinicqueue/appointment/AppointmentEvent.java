package io.clinicqueue.appointment;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Published after a lifecycle transition was stored.
 *
 * @param appointment the appointment as written by the transition
 * @param replacement for RESCHEDULED, the newly created appointment; otherwise null
 */
public record AppointmentEvent(
        AppointmentEventType type,
        Appointment appointment,
        Appointment replacement,
        Instant occurredAt
) {

    public static AppointmentEvent of(AppointmentEventType type, Appointment appointment, Instant occurredAt) {
        return new AppointmentEvent(type, appointment, null, occurredAt);
    }

    /**
     * Queues whose ordering may have changed: the appointment's own day, plus the
     * replacement's day for a reschedule.
     */
    public Set<DoctorDay> affectedQueues() {
        Set<DoctorDay> days = new LinkedHashSet<>();
        days.add(DoctorDay.of(appointment));
        if (replacement != null) {
            days.add(DoctorDay.of(replacement));
        }
        return days;
    }
}
