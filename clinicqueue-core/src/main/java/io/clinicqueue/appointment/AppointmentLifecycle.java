package io.clinicqueue.appointment;

import io.clinicqueue.error.InvalidTransitionException;
import io.clinicqueue.error.TransientStoreException;
import io.clinicqueue.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Appointment state machine.
 *
 * <pre>
 * Scheduled  -> Checked-In -> In-Progress -> Completed
 * Scheduled  -> No-Show
 * (non-terminal) -> Cancelled | Rescheduled
 * </pre>
 *
 * Every stored transition is published to the registered {@link AppointmentEventListener}s after
 * the write. Listener failures are logged and never undo the transition.
 */
public class AppointmentLifecycle {
    private static final Logger log = LoggerFactory.getLogger(AppointmentLifecycle.class);

    private static final int MAX_WRITE_ATTEMPTS = 3;
    private static final int MAX_DURATION_MINUTES = 24 * 60;

    private final AppointmentStore store;
    private final Clock clock;
    private final ZoneId zone;
    private final int defaultDurationMinutes;
    private final boolean rejectOverlaps;
    private final List<AppointmentEventListener> listeners = new CopyOnWriteArrayList<>();

    public AppointmentLifecycle(AppointmentStore store,
                                Clock clock,
                                ZoneId zone,
                                int defaultDurationMinutes,
                                boolean rejectOverlaps) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        if (defaultDurationMinutes <= 0) {
            throw new IllegalArgumentException("defaultDurationMinutes must be positive");
        }
        this.defaultDurationMinutes = defaultDurationMinutes;
        this.rejectOverlaps = rejectOverlaps;
    }

    public void addListener(AppointmentEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public Optional<Appointment> find(String id) {
        return store.findById(id);
    }

    /**
     * Creates a new Scheduled appointment.
     *
     * @throws ValidationException if the request is incomplete, or it overlaps another active
     *                             appointment of the same doctor while overlap rejection is on
     */
    public Appointment schedule(NewAppointment request) {
        Objects.requireNonNull(request, "request must not be null");
        requireText(request.doctorId(), "doctorId");
        requireText(request.patientId(), "patientId");
        if (request.scheduledAt() == null) {
            throw new ValidationException("scheduledAt is required");
        }
        int duration = resolveDuration(request.durationMinutes(), defaultDurationMinutes);
        checkOverlap(request.doctorId(), request.scheduledAt(), duration, null);

        Instant now = clock.instant();
        Appointment created = store.insert(Appointment.builder()
                .id(UUID.randomUUID().toString())
                .doctorId(request.doctorId())
                .patientId(request.patientId())
                .scheduledAt(request.scheduledAt())
                .serviceDay(request.scheduledAt().atZone(zone).toLocalDate())
                .durationMinutes(duration)
                .status(AppointmentStatus.SCHEDULED)
                .notes(request.notes())
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.debug("appointment scheduled id={} doctorId={} at={}", created.id(), created.doctorId(), created.scheduledAt());
        publish(AppointmentEvent.of(AppointmentEventType.CREATED, created, now));
        return created;
    }

    public Appointment checkIn(String id) {
        return transition(id, AppointmentEventType.CHECKED_IN, Set.of(AppointmentStatus.SCHEDULED),
                (b) -> b.status(AppointmentStatus.CHECKED_IN).checkedInAt(clock.instant()));
    }

    public Appointment start(String id) {
        return transition(id, AppointmentEventType.STARTED, Set.of(AppointmentStatus.CHECKED_IN),
                (b) -> b.status(AppointmentStatus.IN_PROGRESS).actualStartTime(clock.instant()));
    }

    public Appointment complete(String id) {
        return transition(id, AppointmentEventType.COMPLETED, Set.of(AppointmentStatus.IN_PROGRESS),
                (b) -> b.status(AppointmentStatus.COMPLETED).actualEndTime(clock.instant()).clearQueueFields());
    }

    public Appointment cancel(String id, String reason) {
        return transition(id, AppointmentEventType.CANCELLED, AppointmentStatus.ACTIVE,
                (b) -> b.status(AppointmentStatus.CANCELLED).cancellationReason(reason).clearQueueFields());
    }

    public Appointment markNoShow(String id) {
        return transition(id, AppointmentEventType.NO_SHOW, Set.of(AppointmentStatus.SCHEDULED),
                (b) -> b.status(AppointmentStatus.NO_SHOW).clearQueueFields());
    }

    /**
     * Marks the appointment Rescheduled and creates its replacement in one atomic write.
     *
     * @param newDurationMinutes null keeps the original duration
     * @return the replacement appointment
     */
    public Appointment reschedule(String id, Instant newScheduledAt, Integer newDurationMinutes) {
        if (newScheduledAt == null) {
            throw new ValidationException("new scheduledAt is required");
        }

        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Appointment current = load(id);
            requireFrom(current, AppointmentStatus.ACTIVE, AppointmentEventType.RESCHEDULED);

            int duration = resolveDuration(newDurationMinutes, current.durationMinutes());
            checkOverlap(current.doctorId(), newScheduledAt, duration, current.id());

            Instant now = clock.instant();
            Appointment replacement = Appointment.builder()
                    .id(UUID.randomUUID().toString())
                    .doctorId(current.doctorId())
                    .patientId(current.patientId())
                    .scheduledAt(newScheduledAt)
                    .serviceDay(newScheduledAt.atZone(zone).toLocalDate())
                    .durationMinutes(duration)
                    .status(AppointmentStatus.SCHEDULED)
                    .notes(current.notes())
                    .rescheduledFromId(current.id())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            Appointment source = current.toBuilder()
                    .status(AppointmentStatus.RESCHEDULED)
                    .rescheduledToId(replacement.id())
                    .clearQueueFields()
                    .version(current.version() + 1)
                    .updatedAt(now)
                    .build();

            if (store.reschedule(source, current.version(), replacement)) {
                log.debug("appointment rescheduled id={} newId={} at={}", source.id(), replacement.id(), newScheduledAt);
                publish(new AppointmentEvent(AppointmentEventType.RESCHEDULED, source, replacement, now));
                return replacement;
            }
            log.debug("appointment changed concurrently, retrying reschedule id={} attempt={}", id, attempt);
        }
        throw new TransientStoreException("appointment " + id + " kept changing during reschedule");
    }

    private Appointment transition(String id,
                                   AppointmentEventType eventType,
                                   Set<AppointmentStatus> allowedFrom,
                                   UnaryOperator<Appointment.Builder> change) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Appointment current = load(id);
            requireFrom(current, allowedFrom, eventType);

            Instant now = clock.instant();
            Appointment updated = change.apply(current.toBuilder())
                    .version(current.version() + 1)
                    .updatedAt(now)
                    .build();

            if (store.updateLifecycle(updated, current.version())) {
                log.debug("appointment transition id={} {} -> {}", id, current.status(), updated.status());
                publish(AppointmentEvent.of(eventType, updated, now));
                return updated;
            }
            log.debug("appointment changed concurrently, retrying transition id={} event={} attempt={}", id, eventType, attempt);
        }
        throw new TransientStoreException("appointment " + id + " kept changing during " + eventType);
    }

    private Appointment load(String id) {
        requireText(id, "appointment id");
        return store.findById(id)
                .orElseThrow(() -> new ValidationException("appointment not found: " + id));
    }

    private static void requireFrom(Appointment current, Set<AppointmentStatus> allowedFrom, AppointmentEventType eventType) {
        if (!allowedFrom.contains(current.status())) {
            throw new InvalidTransitionException(
                    "cannot apply " + eventType + " to appointment " + current.id() + " in status " + current.status().label());
        }
    }

    private void checkOverlap(String doctorId, Instant start, int durationMinutes, String ignoreId) {
        if (!rejectOverlaps) {
            return;
        }
        Instant end = start.plus(Duration.ofMinutes(durationMinutes));
        boolean conflict = store.findOverlapping(doctorId, start, end).stream()
                .anyMatch(a -> !a.id().equals(ignoreId));
        if (conflict) {
            throw new ValidationException("doctor " + doctorId + " already has an appointment between " + start + " and " + end);
        }
    }

    private void publish(AppointmentEvent event) {
        for (AppointmentEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("appointment event listener failed type={} id={} msg={}",
                        event.type(), event.appointment().id(), e.getMessage(), e);
            }
        }
    }

    private static int resolveDuration(Integer requested, int fallback) {
        if (requested == null) {
            return fallback;
        }
        if (requested <= 0 || requested > MAX_DURATION_MINUTES) {
            throw new ValidationException("durationMinutes must be between 1 and " + MAX_DURATION_MINUTES);
        }
        return requested;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }
}
