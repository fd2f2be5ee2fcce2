package io.clinicqueue.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence port for jobs. The job queue is the only caller.
 *
 * <p>Every {@code mark*} method is conditional on the job still being RUNNING and owned by
 * {@code workerId}; it returns false when the lease was lost to another worker.
 */
public interface JobStore {

    /**
     * Persist a job spec. A spec with a unique key is merged into a PENDING job with the same
     * (type, uniqueKey) when one exists: the merged job keeps the smaller priority value and
     * the earlier scheduledFor.
     */
    EnqueueResult save(JobSpec<Map<String, Object>> spec, Instant now);

    /**
     * Upsert the singleton recurring job of a type. An existing PENDING or RUNNING job with the
     * same (type, uniqueKey) is kept; otherwise a new one is inserted.
     */
    EnqueueResult saveRecurring(JobSpec<Map<String, Object>> spec, Instant now);

    Optional<Job> findById(String id);

    /**
     * Atomically claims at most {@code batchSize} due jobs, ordered by priority ascending then
     * createdAt ascending. Due means PENDING with {@code scheduledFor <= now}, or RUNNING with an
     * expired lease (worker crashed mid-run).
     */
    List<Job> claimDue(Instant now, int batchSize, Duration lease, String workerId);

    boolean markCompleted(String id, String workerId, Instant finishedAt);

    /**
     * Recurring job finished a run: back to PENDING at {@code nextRunAt} with retries reset.
     */
    boolean markRescheduled(String id, String workerId, Instant finishedAt, Instant nextRunAt);

    boolean markRetry(String id, String workerId, int retryCount, Instant nextRunAt, String errorMessage);

    boolean markFailed(String id, String workerId, int retryCount, Instant failedAt, String errorMessage);

    /**
     * @return number of jobs moved from PENDING to CANCELLED (0 or 1)
     */
    long cancelPending(String id);

    CancelResult cancelPending(CancelQuery query, int limit);

    Map<JobStatus, Long> countByStatus();
}
