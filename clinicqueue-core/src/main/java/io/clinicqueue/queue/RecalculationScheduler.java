package io.clinicqueue.queue;

import io.clinicqueue.JobQueue;
import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.core.EnqueueResult;
import io.clinicqueue.core.JobType;
import io.clinicqueue.core.Priority;

import java.util.Objects;

/**
 * Enqueues RECALCULATE_QUEUE jobs. Requests for the same queue coalesce while a job is still
 * pending, and all jobs of one queue share a lock key so they never run concurrently.
 */
public class RecalculationScheduler {

    private final JobQueue jobQueue;

    public RecalculationScheduler(JobQueue jobQueue) {
        this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue must not be null");
    }

    public EnqueueResult request(DoctorDay doctorDay, Priority priority) {
        RecalculateQueuePayload payload = RecalculateQueuePayload.of(doctorDay);
        return jobQueue.create(JobType.RECALCULATE_QUEUE, payload)
                .uniqueKey(doctorDay.lockKey() + "|" + payload.effectiveStartPosition())
                .lockKey(doctorDay.lockKey())
                .priority(priority)
                .save();
    }
}
