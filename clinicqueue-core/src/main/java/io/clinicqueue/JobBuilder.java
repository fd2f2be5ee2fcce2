package io.clinicqueue;

import io.clinicqueue.core.EnqueueResult;
import io.clinicqueue.core.JobSpec;
import io.clinicqueue.core.Priority;

import java.time.Instant;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + persist (insert, or merge into a pending job with the same unique key)</li>
 * </ul>
 */
public interface JobBuilder<T> {

    /**
     * Options for repeat scheduling.
     * <ul>
     *   <li>skipImmediate: if true, do not run immediately; schedule from the next computed run time</li>
     *   <li>timezone: IANA time zone id (e.g. "Europe/Berlin"); null means system default</li>
     * </ul>
     */
    record RepeatOptions(boolean skipImmediate, String timezone) {
        public static RepeatOptions defaults() {
            return new RepeatOptions(true, null);
        }
    }

    /**
     * Coalescing key. Pending jobs of the same type and key are merged instead of duplicated.
     */
    JobBuilder<T> uniqueKey(String uniqueKey);

    /**
     * Serialization key. Jobs sharing a lock key never run concurrently.
     */
    JobBuilder<T> lockKey(String lockKey);

    JobBuilder<T> priority(Priority priority);

    /**
     * Raw priority value, 1 (most urgent) to 10.
     */
    JobBuilder<T> priority(int priority);

    /**
     * Number of failed executions after which the job is marked FAILED.
     */
    JobBuilder<T> maxRetries(int maxRetries);

    JobBuilder<T> timezone(String timezone);

    /**
     * Run no earlier than the given instant. Defaults to now.
     */
    JobBuilder<T> schedule(Instant time);

    /**
     * Repeat every X amount of time.
     * Accepts human-interval strings (e.g. "10 minutes"), numeric seconds, cron, or "AT HH:mm".
     */
    JobBuilder<T> repeatEvery(String interval);

    JobBuilder<T> repeatEvery(String interval, RepeatOptions options);

    JobSpec<T> build();

    EnqueueResult save();
}
