package io.clinicqueue.noshow;

import io.clinicqueue.JobHandler;
import io.clinicqueue.appointment.Appointment;
import io.clinicqueue.appointment.AppointmentLifecycle;
import io.clinicqueue.appointment.AppointmentStore;
import io.clinicqueue.core.JobType;
import io.clinicqueue.error.InvalidTransitionException;
import io.clinicqueue.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Marks Scheduled appointments as No-Show once they are past their start by more than the grace
 * period. Goes through the lifecycle so each one triggers a recalculation.
 */
public class NoShowSweepHandler implements JobHandler<NoShowSweepPayload> {
    private static final Logger log = LoggerFactory.getLogger(NoShowSweepHandler.class);

    private final AppointmentStore store;
    private final AppointmentLifecycle lifecycle;
    private final Clock clock;
    private final int batchLimit;

    public NoShowSweepHandler(AppointmentStore store, AppointmentLifecycle lifecycle, Clock clock, int batchLimit) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (batchLimit <= 0) {
            throw new IllegalArgumentException("batchLimit must be positive");
        }
        this.batchLimit = batchLimit;
    }

    @Override
    public JobType type() {
        return JobType.NO_SHOW_SWEEP;
    }

    @Override
    public Class<NoShowSweepPayload> payloadClass() {
        return NoShowSweepPayload.class;
    }

    @Override
    public void execute(NoShowSweepPayload payload) {
        if (payload == null || payload.graceMinutes() < 0) {
            throw new ValidationException("grace_minutes must be zero or positive");
        }
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(payload.graceMinutes()));
        List<Appointment> overdue = store.findScheduledBefore(cutoff, batchLimit);

        int marked = 0;
        for (Appointment appointment : overdue) {
            try {
                lifecycle.markNoShow(appointment.id());
                marked++;
            } catch (InvalidTransitionException e) {
                // checked in or cancelled since the read
                log.debug("no-show skipped id={} msg={}", appointment.id(), e.getMessage());
            }
        }
        if (marked > 0) {
            log.info("no-show sweep marked={} cutoff={}", marked, cutoff);
        }
    }
}
