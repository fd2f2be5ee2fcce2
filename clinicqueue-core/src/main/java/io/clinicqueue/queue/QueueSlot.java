package io.clinicqueue.queue;

import io.clinicqueue.appointment.Appointment;
import io.clinicqueue.appointment.QueueAssignment;

import java.time.Instant;
import java.util.Objects;

/**
 * Computed queue fields for one active appointment.
 */
public record QueueSlot(Appointment appointment, int position, Instant estimatedStartTime, int delayMinutes) {

    /**
     * True if any queue field differs from what the appointment currently stores.
     */
    public boolean changed() {
        return !Objects.equals(appointment.queuePosition(), position)
                || etaChanged()
                || appointment.delayMinutes() != delayMinutes;
    }

    public boolean etaChanged() {
        return !Objects.equals(appointment.estimatedStartTime(), estimatedStartTime);
    }

    public QueueAssignment toAssignment() {
        return new QueueAssignment(appointment.id(), appointment.version(), position, estimatedStartTime, delayMinutes);
    }
}
