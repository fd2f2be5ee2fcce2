package io.clinicqueue.queue;

import io.clinicqueue.appointment.Appointment;
import io.clinicqueue.appointment.AppointmentStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Single-server queue model per doctor and day.
 *
 * <p>In-Progress appointments come first, since the doctor is already busy with them. The
 * waiting ones follow, ordered by scheduled time, then id. Each estimated start is the later of
 * the appointment's earliest possible start and the previous appointment's estimated end, so a
 * late start pushes every later appointment back and consecutive slots never overlap.
 *
 * <p>The earliest possible start is the actual start for an In-Progress appointment, and the
 * scheduled time plus the doctor's reported delay for a waiting one. The result depends only on
 * the input.
 */
public final class QueueCalculator {

    public static final Comparator<Appointment> QUEUE_ORDER =
            Comparator.comparing(Appointment::scheduledAt).thenComparing(Appointment::id);

    private QueueCalculator() {
    }

    public static List<QueueSlot> calculate(Collection<Appointment> active, int startFromPosition) {
        return calculate(active, startFromPosition, 0);
    }

    /**
     * @param active             appointments of one doctor and day; inactive ones are ignored
     * @param startFromPosition  position given to the first appointment, at least 1
     * @param doctorDelayMinutes minutes the doctor reported running late, added to the scheduled
     *                           time of every waiting appointment
     */
    public static List<QueueSlot> calculate(Collection<Appointment> active, int startFromPosition, int doctorDelayMinutes) {
        if (startFromPosition < 1) {
            throw new IllegalArgumentException("startFromPosition must be at least 1");
        }
        if (doctorDelayMinutes < 0) {
            throw new IllegalArgumentException("doctorDelayMinutes must not be negative");
        }
        List<Appointment> ordered = new ArrayList<>();
        active.stream()
                .filter(a -> a.status() == AppointmentStatus.IN_PROGRESS)
                .sorted(QUEUE_ORDER)
                .forEach(ordered::add);
        active.stream()
                .filter(a -> a.isActive() && a.status() != AppointmentStatus.IN_PROGRESS)
                .sorted(QUEUE_ORDER)
                .forEach(ordered::add);

        Duration doctorDelay = Duration.ofMinutes(doctorDelayMinutes);
        List<QueueSlot> slots = new ArrayList<>(ordered.size());
        Instant previousEnd = null;
        int position = startFromPosition;
        for (Appointment a : ordered) {
            Instant eta = estimateStart(a, previousEnd, doctorDelay);
            int delay = (int) Math.max(0L, Duration.between(a.scheduledAt(), eta).toMinutes());
            slots.add(new QueueSlot(a, position++, eta, delay));
            previousEnd = eta.plus(Duration.ofMinutes(a.durationMinutes()));
        }
        return slots;
    }

    private static Instant estimateStart(Appointment a, Instant previousEnd, Duration doctorDelay) {
        Instant earliest;
        if (a.status() == AppointmentStatus.IN_PROGRESS) {
            earliest = a.actualStartTime() != null ? a.actualStartTime() : a.scheduledAt();
        } else {
            earliest = a.scheduledAt().plus(doctorDelay);
        }
        if (previousEnd != null && previousEnd.isAfter(earliest)) {
            return previousEnd;
        }
        return earliest;
    }
}
