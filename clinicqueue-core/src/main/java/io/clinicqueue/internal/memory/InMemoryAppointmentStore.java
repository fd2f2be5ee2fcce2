package io.clinicqueue.internal.memory;

import io.clinicqueue.appointment.Appointment;
import io.clinicqueue.appointment.AppointmentStatus;
import io.clinicqueue.appointment.AppointmentStore;
import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.appointment.QueueAssignment;
import io.clinicqueue.changefeed.AppointmentChange;
import io.clinicqueue.changefeed.AppointmentChangeFeed;
import io.clinicqueue.changefeed.AppointmentChangeListener;
import io.clinicqueue.error.TransientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Heap-backed {@link AppointmentStore} that also acts as its own {@link AppointmentChangeFeed}.
 * Change listeners are called on the writing thread after the write is visible.
 */
public class InMemoryAppointmentStore implements AppointmentStore, AppointmentChangeFeed {
    private static final Logger log = LoggerFactory.getLogger(InMemoryAppointmentStore.class);

    private static final Map<String, Function<Appointment, Object>> FIELDS = new LinkedHashMap<>();

    static {
        FIELDS.put("doctorId", Appointment::doctorId);
        FIELDS.put("patientId", Appointment::patientId);
        FIELDS.put("scheduledAt", Appointment::scheduledAt);
        FIELDS.put("serviceDay", Appointment::serviceDay);
        FIELDS.put("durationMinutes", Appointment::durationMinutes);
        FIELDS.put("status", Appointment::status);
        FIELDS.put("checkedInAt", Appointment::checkedInAt);
        FIELDS.put("actualStartTime", Appointment::actualStartTime);
        FIELDS.put("actualEndTime", Appointment::actualEndTime);
        FIELDS.put("queuePosition", Appointment::queuePosition);
        FIELDS.put("estimatedStartTime", Appointment::estimatedStartTime);
        FIELDS.put("delayMinutes", Appointment::delayMinutes);
        FIELDS.put("notes", Appointment::notes);
        FIELDS.put("cancellationReason", Appointment::cancellationReason);
        FIELDS.put("rescheduledFromId", Appointment::rescheduledFromId);
        FIELDS.put("rescheduledToId", Appointment::rescheduledToId);
        FIELDS.put("version", Appointment::version);
        FIELDS.put("updatedAt", Appointment::updatedAt);
    }

    private final Map<String, Appointment> appointments = new LinkedHashMap<>();
    private final Map<String, List<AppointmentChangeListener>> listeners = new ConcurrentHashMap<>();

    @Override
    public synchronized Optional<Appointment> findById(String id) {
        return Optional.ofNullable(appointments.get(id));
    }

    @Override
    public synchronized List<Appointment> findByDoctorDay(DoctorDay doctorDay, Collection<AppointmentStatus> statuses) {
        return appointments.values().stream()
                .filter(a -> a.doctorId().equals(doctorDay.doctorId()) && a.serviceDay().equals(doctorDay.serviceDay()))
                .filter(a -> statuses.contains(a.status()))
                .toList();
    }

    @Override
    public synchronized List<Appointment> findOverlapping(String doctorId, Instant start, Instant end) {
        return appointments.values().stream()
                .filter(a -> a.doctorId().equals(doctorId) && a.isActive())
                .filter(a -> a.scheduledAt().isBefore(end)
                        && a.scheduledAt().plus(Duration.ofMinutes(a.durationMinutes())).isAfter(start))
                .toList();
    }

    @Override
    public synchronized List<Appointment> findScheduledBefore(Instant cutoff, int limit) {
        return appointments.values().stream()
                .filter(a -> a.status() == AppointmentStatus.SCHEDULED && a.scheduledAt().isBefore(cutoff))
                .sorted(Comparator.comparing(Appointment::scheduledAt))
                .limit(limit)
                .toList();
    }

    @Override
    public Appointment insert(Appointment appointment) {
        Objects.requireNonNull(appointment.id(), "appointment id must be assigned");
        synchronized (this) {
            if (appointments.putIfAbsent(appointment.id(), appointment) != null) {
                throw new IllegalStateException("appointment already exists: " + appointment.id());
            }
        }
        publish(inserted(appointment));
        return appointment;
    }

    @Override
    public boolean updateLifecycle(Appointment updated, long expectedVersion) {
        AppointmentChange change;
        synchronized (this) {
            Appointment current = appointments.get(updated.id());
            if (current == null || current.version() != expectedVersion) {
                return false;
            }
            Appointment merged = mergeLifecycle(current, updated);
            appointments.put(merged.id(), merged);
            change = diff(current, merged);
        }
        publish(change);
        return true;
    }

    @Override
    public boolean reschedule(Appointment source, long expectedVersion, Appointment replacement) {
        List<AppointmentChange> changes = new ArrayList<>(2);
        synchronized (this) {
            Appointment current = appointments.get(source.id());
            if (current == null || current.version() != expectedVersion) {
                return false;
            }
            if (appointments.containsKey(replacement.id())) {
                throw new IllegalStateException("appointment already exists: " + replacement.id());
            }
            Appointment merged = mergeLifecycle(current, source);
            appointments.put(merged.id(), merged);
            appointments.put(replacement.id(), replacement);
            changes.add(diff(current, merged));
            changes.add(inserted(replacement));
        }
        changes.forEach(this::publish);
        return true;
    }

    @Override
    public void applyQueueAssignments(List<QueueAssignment> assignments, Instant updatedAt) {
        List<AppointmentChange> changes = new ArrayList<>(assignments.size());
        synchronized (this) {
            for (QueueAssignment qa : assignments) {
                Appointment current = appointments.get(qa.appointmentId());
                if (current == null || current.version() != qa.expectedVersion()) {
                    throw new TransientStoreException("appointment " + qa.appointmentId()
                            + " changed since the queue was read; batch not applied");
                }
            }
            for (QueueAssignment qa : assignments) {
                Appointment current = appointments.get(qa.appointmentId());
                Appointment next = current.toBuilder()
                        .queuePosition(qa.queuePosition())
                        .estimatedStartTime(qa.estimatedStartTime())
                        .delayMinutes(qa.delayMinutes())
                        .updatedAt(updatedAt)
                        .build();
                appointments.put(next.id(), next);
                changes.add(diff(current, next));
            }
        }
        changes.forEach(this::publish);
    }

    /**
     * Replaces a row as an outside writer would, bypassing lifecycle rules. Published to the
     * change feed like any other write.
     */
    public void put(Appointment appointment) {
        List<AppointmentChange> changes = new ArrayList<>(2);
        synchronized (this) {
            Appointment previous = appointments.put(appointment.id(), appointment);
            if (previous == null) {
                changes.add(inserted(appointment));
            } else {
                AppointmentChange change = diff(previous, appointment);
                changes.add(change);
                // moved to another queue: the old one has a gap now
                if (!previous.doctorDay().equals(appointment.doctorDay())) {
                    changes.add(new AppointmentChange(change.operation(), previous.id(), previous.doctorId(),
                            previous.serviceDay(), change.updatedFields()));
                }
            }
        }
        changes.forEach(this::publish);
    }

    public synchronized List<Appointment> findAll() {
        return List.copyOf(appointments.values());
    }

    @Override
    public Subscription subscribe(String doctorId, AppointmentChangeListener listener) {
        Objects.requireNonNull(doctorId, "doctorId must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        List<AppointmentChangeListener> forDoctor =
                listeners.computeIfAbsent(doctorId, id -> new CopyOnWriteArrayList<>());
        forDoctor.add(listener);
        return () -> forDoctor.remove(listener);
    }

    private void publish(AppointmentChange change) {
        List<AppointmentChangeListener> forDoctor = listeners.get(change.doctorId());
        if (forDoctor == null) {
            return;
        }
        for (AppointmentChangeListener listener : forDoctor) {
            try {
                listener.onChange(change);
            } catch (RuntimeException e) {
                log.warn("appointment change listener failed appointmentId={} msg={}", change.appointmentId(), e.getMessage(), e);
            }
        }
    }

    // queue fields belong to recalculation; a lifecycle write only clears them
    private static Appointment mergeLifecycle(Appointment current, Appointment updated) {
        Appointment.Builder b = updated.toBuilder();
        if (updated.isActive()) {
            b.queuePosition(current.queuePosition())
                    .estimatedStartTime(current.estimatedStartTime())
                    .delayMinutes(current.delayMinutes());
        } else {
            b.clearQueueFields();
        }
        return b.build();
    }

    private static AppointmentChange inserted(Appointment a) {
        return new AppointmentChange(AppointmentChange.Operation.INSERT, a.id(), a.doctorId(), a.serviceDay(), Set.of());
    }

    private static AppointmentChange diff(Appointment before, Appointment after) {
        Set<String> changed = new LinkedHashSet<>();
        FIELDS.forEach((name, getter) -> {
            if (!Objects.equals(getter.apply(before), getter.apply(after))) {
                changed.add(name);
            }
        });
        return new AppointmentChange(AppointmentChange.Operation.UPDATE, after.id(), after.doctorId(), after.serviceDay(), changed);
    }
}
