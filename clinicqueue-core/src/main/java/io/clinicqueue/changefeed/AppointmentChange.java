package io.clinicqueue.changefeed;

import io.clinicqueue.appointment.DoctorDay;

import java.time.LocalDate;
import java.util.Set;

/**
 * One row-level change of an appointment, as seen by the store.
 *
 * @param serviceDay    may be null when the store cannot tell (a delete without the old row)
 * @param updatedFields names of the fields an UPDATE touched; empty for INSERT, DELETE and
 *                      REPLACE
 */
public record AppointmentChange(
        Operation operation,
        String appointmentId,
        String doctorId,
        LocalDate serviceDay,
        Set<String> updatedFields
) {

    public enum Operation {
        INSERT,
        UPDATE,
        REPLACE,
        DELETE
    }

    /**
     * Fields written by queue recalculation itself.
     */
    public static final Set<String> QUEUE_FIELDS =
            Set.of("queuePosition", "estimatedStartTime", "delayMinutes", "updatedAt");

    public AppointmentChange {
        updatedFields = updatedFields == null ? Set.of() : Set.copyOf(updatedFields);
    }

    public boolean touchesOnlyQueueFields() {
        return operation == Operation.UPDATE
                && !updatedFields.isEmpty()
                && QUEUE_FIELDS.containsAll(updatedFields);
    }

    public DoctorDay doctorDay() {
        return doctorId == null || serviceDay == null ? null : new DoctorDay(doctorId, serviceDay);
    }
}
