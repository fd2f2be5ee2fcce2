package io.clinicqueue.queue;

import io.clinicqueue.appointment.DoctorDay;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence port for reported doctor delays.
 */
public interface DoctorDelayStore {

    /**
     * Adds {@code minutes} to the day's total, starting from zero when nothing was reported.
     *
     * @return the delay after the update
     */
    DoctorDelay add(DoctorDay doctorDay, int minutes, Instant updatedAt);

    Optional<DoctorDelay> find(DoctorDay doctorDay);

    /**
     * @return false if no delay was reported for the day
     */
    boolean clear(DoctorDay doctorDay);
}
