package io.clinicqueue.internal;

import io.clinicqueue.JobBuilder;
import io.clinicqueue.core.EnqueueResult;
import io.clinicqueue.core.JobSpec;
import io.clinicqueue.core.JobType;
import io.clinicqueue.core.Priority;
import io.clinicqueue.utils.IntervalParser;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation used by {@link DefaultJobQueue}.
 */
public class SimpleJobBuilder<T> implements JobBuilder<T> {

    private final JobType type;
    private final T payload;
    private final Clock clock;
    private final Function<JobSpec<T>, EnqueueResult> persister;

    private String uniqueKey;
    private String lockKey;

    private Instant scheduledFor;
    private String repeatInterval;
    private String repeatTimezone;

    private int priority = Priority.NORMAL.value();
    private int maxRetries;

    public SimpleJobBuilder(JobType type,
                            T payload,
                            Clock clock,
                            int defaultMaxRetries,
                            Function<JobSpec<T>, EnqueueResult> persister) {
        this.type = Objects.requireNonNull(type, "job type must not be null");
        this.payload = payload;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxRetries = defaultMaxRetries;
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobBuilder<T> uniqueKey(String uniqueKey) {
        this.uniqueKey = requireNotBlank(uniqueKey, "uniqueKey");
        return this;
    }

    @Override
    public JobBuilder<T> lockKey(String lockKey) {
        this.lockKey = requireNotBlank(lockKey, "lockKey");
        return this;
    }

    @Override
    public JobBuilder<T> priority(Priority priority) {
        Objects.requireNonNull(priority, "priority must not be null");
        this.priority = priority.value();
        return this;
    }

    @Override
    public JobBuilder<T> priority(int priority) {
        this.priority = Priority.checkRange(priority);
        return this;
    }

    @Override
    public JobBuilder<T> maxRetries(int maxRetries) {
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive");
        }
        this.maxRetries = maxRetries;
        return this;
    }

    @Override
    public JobBuilder<T> timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        ZoneId.of(timezone);
        this.repeatTimezone = timezone;
        return this;
    }

    @Override
    public JobBuilder<T> schedule(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        this.scheduledFor = time;
        return this;
    }

    @Override
    public JobBuilder<T> repeatEvery(String interval) {
        return repeatEvery(interval, RepeatOptions.defaults());
    }

    @Override
    public JobBuilder<T> repeatEvery(String interval, RepeatOptions options) {
        requireNotBlank(interval, "interval");
        if (options == null) {
            options = RepeatOptions.defaults();
        }
        if (options.timezone() != null) {
            timezone(options.timezone());
        }

        Instant now = clock.instant();
        // validates the spec even when the first run is pinned by schedule()
        Instant firstRun = IntervalParser.computeNextRunAt(interval, repeatTimezone, null, now);

        this.repeatInterval = interval;
        if (this.scheduledFor == null) {
            this.scheduledFor = options.skipImmediate() ? firstRun : now;
        }
        return this;
    }

    @Override
    public JobSpec<T> build() {
        return new JobSpec<>(
                type,
                uniqueKey,
                lockKey,
                scheduledFor,
                repeatInterval,
                repeatTimezone,
                priority,
                maxRetries,
                payload
        );
    }

    @Override
    public EnqueueResult save() {
        return persister.apply(build());
    }

    private static String requireNotBlank(String value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
