package io.clinicqueue.queue;

import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.core.Priority;
import io.clinicqueue.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Records that a doctor is running late and has the day's queue recalculated, so every waiting
 * patient's estimated start moves back accordingly.
 */
public class DoctorDelayRecorder {
    private static final Logger log = LoggerFactory.getLogger(DoctorDelayRecorder.class);

    private static final int MAX_DELAY_MINUTES = 24 * 60;

    private final DoctorDelayStore store;
    private final RecalculationScheduler scheduler;
    private final Clock clock;

    public DoctorDelayRecorder(DoctorDelayStore store, RecalculationScheduler scheduler, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Adds to the delay already reported for the day.
     *
     * @throws ValidationException if the doctor is missing or the resulting delay is not between
     *                             1 and 1440 minutes
     */
    public DoctorDelay addDelay(DoctorDay doctorDay, int minutes) {
        requireDoctorDay(doctorDay);
        int current = store.find(doctorDay).map(DoctorDelay::minutes).orElse(0);
        if (minutes <= 0 || current + minutes > MAX_DELAY_MINUTES) {
            throw new ValidationException("delay must be positive and at most " + MAX_DELAY_MINUTES + " minutes per day");
        }
        DoctorDelay delay = store.add(doctorDay, minutes, clock.instant());
        log.info("doctor delay reported doctorDay={} added={} total={}", doctorDay.lockKey(), minutes, delay.minutes());
        scheduler.request(doctorDay, Priority.HIGH);
        return delay;
    }

    /**
     * Withdraws the day's delay, for example when the doctor has caught up.
     */
    public void clearDelay(DoctorDay doctorDay) {
        requireDoctorDay(doctorDay);
        if (store.clear(doctorDay)) {
            log.info("doctor delay cleared doctorDay={}", doctorDay.lockKey());
            scheduler.request(doctorDay, Priority.HIGH);
        }
    }

    public int currentDelayMinutes(DoctorDay doctorDay) {
        requireDoctorDay(doctorDay);
        return store.find(doctorDay).map(DoctorDelay::minutes).orElse(0);
    }

    private static void requireDoctorDay(DoctorDay doctorDay) {
        if (doctorDay == null || doctorDay.doctorId().isBlank()) {
            throw new ValidationException("doctorId and serviceDay are required");
        }
    }
}
