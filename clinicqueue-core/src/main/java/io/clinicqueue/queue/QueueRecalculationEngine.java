package io.clinicqueue.queue;

import io.clinicqueue.appointment.Appointment;
import io.clinicqueue.appointment.AppointmentStatus;
import io.clinicqueue.appointment.AppointmentStore;
import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.appointment.QueueAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Recomputes positions and estimated start times of one doctor's day and writes the rows that
 * changed in one atomic batch.
 *
 * <p>Callers must hold the per-(doctor, day) lock from the read through the write. The job
 * queue does this for RECALCULATE_QUEUE jobs via their lock key.
 */
public class QueueRecalculationEngine {
    private static final Logger log = LoggerFactory.getLogger(QueueRecalculationEngine.class);

    private final AppointmentStore store;
    private final DoctorDelayStore delays;
    private final Clock clock;

    public QueueRecalculationEngine(AppointmentStore store, DoctorDelayStore delays, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.delays = Objects.requireNonNull(delays, "delays must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RecalculationResult recalculate(DoctorDay doctorDay) {
        return recalculate(doctorDay, 1);
    }

    public RecalculationResult recalculate(DoctorDay doctorDay, int startFromPosition) {
        Objects.requireNonNull(doctorDay, "doctorDay must not be null");

        List<Appointment> active = store.findByDoctorDay(doctorDay, AppointmentStatus.ACTIVE);
        if (active.isEmpty()) {
            log.debug("queue empty, nothing to recalculate doctorDay={}", doctorDay.lockKey());
            return RecalculationResult.empty(doctorDay);
        }

        int doctorDelay = delays.find(doctorDay).map(DoctorDelay::minutes).orElse(0);
        List<QueueSlot> changed = QueueCalculator.calculate(active, startFromPosition, doctorDelay).stream()
                .filter(QueueSlot::changed)
                .toList();
        if (!changed.isEmpty()) {
            List<QueueAssignment> assignments = changed.stream().map(QueueSlot::toAssignment).toList();
            store.applyQueueAssignments(assignments, clock.instant());
        }

        log.debug("queue recalculated doctorDay={} active={} doctorDelay={} written={}",
                doctorDay.lockKey(), active.size(), doctorDelay, changed.size());
        return new RecalculationResult(doctorDay, active.size(), changed);
    }
}
