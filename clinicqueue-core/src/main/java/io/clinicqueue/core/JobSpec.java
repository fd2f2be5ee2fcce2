package io.clinicqueue.core;

import java.time.Instant;

/**
 * Immutable job definition produced by JobBuilder.build().
 * This is a pure data object with no persistence logic.
 */
public record JobSpec<T>(

        // identity
        JobType type,
        String uniqueKey,
        String lockKey,

        // scheduling
        Instant scheduledFor,
        String repeatInterval,
        String repeatTimezone,

        // execution metadata
        int priority,
        int maxRetries,

        // payload
        T payload
) {

    public boolean isRecurring() {
        return repeatInterval != null && !repeatInterval.isBlank();
    }

    public <R> JobSpec<R> withPayload(R converted) {
        return new JobSpec<>(type, uniqueKey, lockKey, scheduledFor, repeatInterval, repeatTimezone,
                priority, maxRetries, converted);
    }
}
