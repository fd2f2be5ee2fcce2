package io.clinicqueue;

import io.clinicqueue.core.JobType;

public interface JobHandler<T> {
    JobType type();

    Class<T> payloadClass();

    void execute(T payload) throws Exception;

    /**
     * Called once after the job moved to FAILED because its retries are exhausted or the
     * error was not retryable. The default does nothing.
     */
    default void onExhausted(T payload, Exception lastError) {
    }
}
