package io.clinicqueue.appointment;

import java.time.Instant;

/**
 * New queue fields for one appointment, valid only if the appointment still has
 * {@code expectedVersion} when written.
 */
public record QueueAssignment(
        String appointmentId,
        long expectedVersion,
        int queuePosition,
        Instant estimatedStartTime,
        int delayMinutes
) {
}
