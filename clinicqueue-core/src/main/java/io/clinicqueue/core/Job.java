package io.clinicqueue.core;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a persisted job as seen by the runner and by operators.
 *
 * <p>The payload is kept in its stored map form; handlers receive it converted to their
 * payload class.
 */
public record Job(
        String id,
        JobType type,
        String uniqueKey,
        String lockKey,
        JobStatus status,
        int priority,
        Map<String, Object> payload,
        int retryCount,
        int maxRetries,
        String errorMessage,
        Instant createdAt,
        Instant scheduledFor,
        Instant startedAt,
        Instant completedAt,
        Instant failedAt,
        String lockedBy,
        Instant leaseUntil,
        String repeatInterval,
        String repeatTimezone
) {

    public boolean isRecurring() {
        return repeatInterval != null && !repeatInterval.isBlank();
    }
}
