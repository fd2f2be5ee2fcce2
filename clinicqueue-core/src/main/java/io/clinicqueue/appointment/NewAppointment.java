package io.clinicqueue.appointment;

import java.time.Instant;

/**
 * Scheduling request. {@code durationMinutes} may be null for the default duration.
 */
public record NewAppointment(
        String doctorId,
        String patientId,
        Instant scheduledAt,
        Integer durationMinutes,
        String notes
) {
}
