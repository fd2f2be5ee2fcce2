package io.clinicqueue.core;

import java.util.Objects;

/**
 * Outcome of persisting a job.
 *
 * @param jobId   id of the job that will run the work
 * @param created true when a new job was inserted, false when the request was merged into
 *                a pending job with the same unique key
 */
public record EnqueueResult(
        String jobId,
        boolean created
) {
    public EnqueueResult {
        Objects.requireNonNull(jobId, "jobId must not be null");
    }

    public static EnqueueResult createdResult(String jobId) {
        return new EnqueueResult(jobId, true);
    }

    public static EnqueueResult coalescedResult(String jobId) {
        return new EnqueueResult(jobId, false);
    }
}
