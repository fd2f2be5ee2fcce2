package io.clinicqueue.queue;

import io.clinicqueue.appointment.DoctorDay;

import java.time.Instant;

/**
 * Running-late minutes reported for one doctor's day. Waiting appointments of that day are not
 * expected to start before their scheduled time plus {@code minutes}.
 */
public record DoctorDelay(DoctorDay doctorDay, int minutes, Instant updatedAt) {
}
