package io.clinicqueue;

import io.clinicqueue.core.CancelQuery;
import io.clinicqueue.core.CancelResult;
import io.clinicqueue.core.EnqueueResult;
import io.clinicqueue.core.Job;
import io.clinicqueue.core.JobQueueStats;
import io.clinicqueue.core.JobType;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable, priority-ordered queue of asynchronous work.
 *
 * <p>Enqueueing never waits for execution: callers are only told the job was accepted.
 * Execution is at-least-once with bounded retries.
 *
 * <p>Cancellation only affects PENDING jobs. A RUNNING job cannot be cancelled; it always
 * runs to COMPLETED or FAILED so a batch write is never interrupted halfway.
 */
public interface JobQueue {
    void start();

    void stop();

    <T> JobBuilder<T> create(JobType type, T payload);

    /**
     * Enqueue a job that is due immediately.
     */
    <T> EnqueueResult enqueue(JobType type, T payload, int priority);

    <T> EnqueueResult enqueue(JobType type, T payload, int priority, Instant scheduledFor);

    /**
     * Create the singleton repeating job of a type, or keep the live one.
     */
    <T> EnqueueResult every(JobType type, String interval, T payload, JobBuilder.RepeatOptions options);

    /**
     * @return a result with {@code cancelled == 1} when the job was still PENDING
     */
    CancelResult cancel(String jobId);

    CancelResult cancel(CancelQuery query);

    Optional<Job> find(String jobId);

    JobQueueStats stats();
}
