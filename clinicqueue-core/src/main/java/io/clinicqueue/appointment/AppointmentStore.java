package io.clinicqueue.appointment;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for appointments.
 * <p>
 * Implementations translate their own failures into
 * {@link io.clinicqueue.error.TransientStoreException}.
 */
public interface AppointmentStore {

    Optional<Appointment> findById(String id);

    /**
     * Appointments of one doctor and service day in the given statuses, in no particular order.
     */
    List<Appointment> findByDoctorDay(DoctorDay doctorDay, Collection<AppointmentStatus> statuses);

    /**
     * Active appointments of the doctor that overlap {@code [start, end)}.
     */
    List<Appointment> findOverlapping(String doctorId, Instant start, Instant end);

    /**
     * Scheduled appointments whose start is before {@code cutoff}, oldest first.
     */
    List<Appointment> findScheduledBefore(Instant cutoff, int limit);

    /**
     * Inserts a new appointment. The id must already be assigned.
     */
    Appointment insert(Appointment appointment);

    /**
     * Writes the lifecycle fields of {@code updated} if the stored version still equals
     * {@code expectedVersion}. Queue fields are written only when the new status is inactive,
     * in which case they are cleared.
     *
     * @return false if the appointment is gone or was changed concurrently
     */
    boolean updateLifecycle(Appointment updated, long expectedVersion);

    /**
     * Atomically marks {@code source} as rescheduled (guarded like {@link #updateLifecycle}) and
     * inserts {@code replacement}. Either both writes happen or neither does.
     */
    boolean reschedule(Appointment source, long expectedVersion, Appointment replacement);

    /**
     * Writes queue fields for a batch of appointments in one atomic unit. Each row is guarded by
     * its expected version.
     *
     * @throws io.clinicqueue.error.TransientStoreException if any guard misses; nothing is written
     */
    void applyQueueAssignments(List<QueueAssignment> assignments, Instant updatedAt);
}
