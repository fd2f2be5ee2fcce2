package io.clinicqueue.internal.memory;

import io.clinicqueue.core.CancelQuery;
import io.clinicqueue.core.CancelResult;
import io.clinicqueue.core.EnqueueResult;
import io.clinicqueue.core.Job;
import io.clinicqueue.core.JobSpec;
import io.clinicqueue.core.JobStatus;
import io.clinicqueue.core.JobStore;
import io.clinicqueue.core.JobType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Heap-backed {@link JobStore}. Jobs are lost on restart; use it for tests and local runs.
 * Every method is atomic with respect to the others.
 */
public class InMemoryJobStore implements JobStore {

    private static final Comparator<Row> CLAIM_ORDER =
            Comparator.comparingInt((Row r) -> r.priority).thenComparing(r -> r.createdAt);

    private final Map<String, Row> rows = new LinkedHashMap<>();

    private static final class Row {
        String id;
        JobType type;
        String uniqueKey;
        String lockKey;
        JobStatus status;
        int priority;
        Map<String, Object> payload;
        int retryCount;
        int maxRetries;
        String errorMessage;
        Instant createdAt;
        Instant scheduledFor;
        Instant startedAt;
        Instant completedAt;
        Instant failedAt;
        String lockedBy;
        Instant leaseUntil;
        String repeatInterval;
        String repeatTimezone;

        Job toJob() {
            return new Job(id, type, uniqueKey, lockKey, status, priority,
                    payload == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(payload)),
                    retryCount, maxRetries, errorMessage, createdAt, scheduledFor, startedAt,
                    completedAt, failedAt, lockedBy, leaseUntil, repeatInterval, repeatTimezone);
        }

        void release() {
            lockedBy = null;
            leaseUntil = null;
        }
    }

    @Override
    public synchronized EnqueueResult save(JobSpec<Map<String, Object>> spec, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");
        Instant scheduledFor = spec.scheduledFor() != null ? spec.scheduledFor() : now;

        if (spec.uniqueKey() != null) {
            Optional<Row> pending = findLive(spec.type(), spec.uniqueKey(), false);
            if (pending.isPresent()) {
                Row row = pending.get();
                row.priority = Math.min(row.priority, spec.priority());
                if (scheduledFor.isBefore(row.scheduledFor)) {
                    row.scheduledFor = scheduledFor;
                }
                return EnqueueResult.coalescedResult(row.id);
            }
        }
        return EnqueueResult.createdResult(insert(spec, scheduledFor, now).id);
    }

    @Override
    public synchronized EnqueueResult saveRecurring(JobSpec<Map<String, Object>> spec, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");
        Optional<Row> live = findLive(spec.type(), spec.uniqueKey(), true);
        if (live.isPresent()) {
            return EnqueueResult.coalescedResult(live.get().id);
        }
        Instant scheduledFor = spec.scheduledFor() != null ? spec.scheduledFor() : now;
        return EnqueueResult.createdResult(insert(spec, scheduledFor, now).id);
    }

    @Override
    public synchronized Optional<Job> findById(String id) {
        return Optional.ofNullable(rows.get(id)).map(Row::toJob);
    }

    @Override
    public synchronized List<Job> claimDue(Instant now, int batchSize, Duration lease, String workerId) {
        List<Row> due = new ArrayList<>();
        for (Row row : rows.values()) {
            boolean pendingDue = row.status == JobStatus.PENDING && !row.scheduledFor.isAfter(now);
            boolean leaseExpired = row.status == JobStatus.RUNNING && row.leaseUntil != null && row.leaseUntil.isBefore(now);
            if (pendingDue || leaseExpired) {
                due.add(row);
            }
        }
        due.sort(CLAIM_ORDER);

        List<Job> claimed = new ArrayList<>();
        for (Row row : due) {
            if (claimed.size() >= batchSize) {
                break;
            }
            row.status = JobStatus.RUNNING;
            row.startedAt = now;
            row.lockedBy = workerId;
            row.leaseUntil = now.plus(lease);
            claimed.add(row.toJob());
        }
        return claimed;
    }

    @Override
    public synchronized boolean markCompleted(String id, String workerId, Instant finishedAt) {
        Row row = owned(id, workerId);
        if (row == null) {
            return false;
        }
        row.status = JobStatus.COMPLETED;
        row.completedAt = finishedAt;
        row.errorMessage = null;
        row.release();
        return true;
    }

    @Override
    public synchronized boolean markRescheduled(String id, String workerId, Instant finishedAt, Instant nextRunAt) {
        Row row = owned(id, workerId);
        if (row == null) {
            return false;
        }
        row.status = JobStatus.PENDING;
        row.completedAt = finishedAt;
        row.scheduledFor = nextRunAt;
        row.retryCount = 0;
        row.errorMessage = null;
        row.release();
        return true;
    }

    @Override
    public synchronized boolean markRetry(String id, String workerId, int retryCount, Instant nextRunAt, String errorMessage) {
        Row row = owned(id, workerId);
        if (row == null) {
            return false;
        }
        row.status = JobStatus.PENDING;
        row.retryCount = retryCount;
        row.scheduledFor = nextRunAt;
        row.errorMessage = errorMessage;
        row.release();
        return true;
    }

    @Override
    public synchronized boolean markFailed(String id, String workerId, int retryCount, Instant failedAt, String errorMessage) {
        Row row = owned(id, workerId);
        if (row == null) {
            return false;
        }
        row.status = JobStatus.FAILED;
        row.retryCount = retryCount;
        row.failedAt = failedAt;
        row.errorMessage = errorMessage;
        row.release();
        return true;
    }

    @Override
    public synchronized long cancelPending(String id) {
        Row row = rows.get(id);
        if (row == null || row.status != JobStatus.PENDING) {
            return 0;
        }
        row.status = JobStatus.CANCELLED;
        return 1;
    }

    @Override
    public synchronized CancelResult cancelPending(CancelQuery query, int limit) {
        long matched = 0;
        long cancelled = 0;
        for (Row row : rows.values()) {
            if (!query.matches(row.toJob())) {
                continue;
            }
            matched++;
            if (row.status == JobStatus.PENDING && cancelled < limit) {
                row.status = JobStatus.CANCELLED;
                cancelled++;
            }
        }
        return new CancelResult(matched, cancelled);
    }

    @Override
    public synchronized Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (Row row : rows.values()) {
            counts.merge(row.status, 1L, Long::sum);
        }
        return counts;
    }

    private Optional<Row> findLive(JobType type, String uniqueKey, boolean includeRunning) {
        return rows.values().stream()
                .filter(r -> r.type == type && Objects.equals(r.uniqueKey, uniqueKey))
                .filter(r -> r.status == JobStatus.PENDING || (includeRunning && r.status == JobStatus.RUNNING))
                .findFirst();
    }

    private Row owned(String id, String workerId) {
        Row row = rows.get(id);
        if (row == null || row.status != JobStatus.RUNNING || !Objects.equals(row.lockedBy, workerId)) {
            return null;
        }
        return row;
    }

    private Row insert(JobSpec<Map<String, Object>> spec, Instant scheduledFor, Instant now) {
        Row row = new Row();
        row.id = UUID.randomUUID().toString();
        row.type = spec.type();
        row.uniqueKey = spec.uniqueKey();
        row.lockKey = spec.lockKey();
        row.status = JobStatus.PENDING;
        row.priority = spec.priority();
        row.payload = spec.payload() == null ? null : new LinkedHashMap<>(spec.payload());
        row.maxRetries = spec.maxRetries();
        row.createdAt = now;
        row.scheduledFor = scheduledFor;
        row.repeatInterval = spec.repeatInterval();
        row.repeatTimezone = spec.repeatTimezone();
        rows.put(row.id, row);
        return row;
    }
}
