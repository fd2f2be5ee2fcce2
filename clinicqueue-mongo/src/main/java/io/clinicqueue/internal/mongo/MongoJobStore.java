package io.clinicqueue.internal.mongo;

import io.clinicqueue.core.CancelQuery;
import io.clinicqueue.core.CancelResult;
import io.clinicqueue.core.EnqueueResult;
import io.clinicqueue.core.Job;
import io.clinicqueue.core.JobSpec;
import io.clinicqueue.core.JobStatus;
import io.clinicqueue.core.JobStore;
import io.clinicqueue.core.JobType;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.clinicqueue.internal.mongo.MongoStoreSupport.translate;

/**
 * MongoDB persistence layer for jobs (collection {@code job_queue}).
 *
 * <p>Coalescing relies on the partial unique index on (type, uniqueKey) over PENDING jobs: an
 * insert that loses a race against another enqueuer is turned into a merge.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final MongoTemplate mongoTemplate;
    private final Duration storeTimeout;

    public MongoJobStore(MongoTemplate mongoTemplate, Duration storeTimeout) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.storeTimeout = Objects.requireNonNull(storeTimeout, "storeTimeout must not be null");
    }

    @Override
    public EnqueueResult save(JobSpec<Map<String, Object>> spec, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");
        return translate("save job", () -> {
            Instant scheduledFor = spec.scheduledFor() != null ? spec.scheduledFor() : now;
            if (isBlank(spec.uniqueKey())) {
                return EnqueueResult.createdResult(mongoTemplate.insert(toDocument(spec, scheduledFor, now)).getId());
            }

            Optional<String> merged = mergeIntoPending(spec, scheduledFor);
            if (merged.isPresent()) {
                return EnqueueResult.coalescedResult(merged.get());
            }
            try {
                return EnqueueResult.createdResult(mongoTemplate.insert(toDocument(spec, scheduledFor, now)).getId());
            } catch (DuplicateKeyException e) {
                log.debug("clinicqueue concurrent enqueue, merging type={} uniqueKey={}", spec.type(), spec.uniqueKey());
                return mergeIntoPending(spec, scheduledFor)
                        .map(EnqueueResult::coalescedResult)
                        .orElseThrow(() -> e);
            }
        });
    }

    private Optional<String> mergeIntoPending(JobSpec<Map<String, Object>> spec, Instant scheduledFor) {
        Query q = new Query(Criteria.where("type").is(spec.type())
                .and("uniqueKey").is(spec.uniqueKey())
                .and("status").is(JobStatus.PENDING));
        Update u = new Update()
                .min("priority", spec.priority())
                .min("scheduledFor", scheduledFor);
        JobDocument doc = mongoTemplate.findAndModify(q, u, FindAndModifyOptions.options().returnNew(true), JobDocument.class);
        return Optional.ofNullable(doc).map(JobDocument::getId);
    }

    @Override
    public EnqueueResult saveRecurring(JobSpec<Map<String, Object>> spec, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");
        if (isBlank(spec.uniqueKey())) {
            throw new IllegalArgumentException("recurring jobs need a uniqueKey");
        }
        return translate("save recurring job", () -> {
            Optional<JobDocument> live = findLive(spec.type(), spec.uniqueKey());
            if (live.isPresent()) {
                return EnqueueResult.coalescedResult(live.get().getId());
            }
            Instant scheduledFor = spec.scheduledFor() != null ? spec.scheduledFor() : now;
            try {
                return EnqueueResult.createdResult(mongoTemplate.insert(toDocument(spec, scheduledFor, now)).getId());
            } catch (DuplicateKeyException e) {
                return findLive(spec.type(), spec.uniqueKey())
                        .map(doc -> EnqueueResult.coalescedResult(doc.getId()))
                        .orElseThrow(() -> e);
            }
        });
    }

    private Optional<JobDocument> findLive(JobType type, String uniqueKey) {
        Query q = new Query(Criteria.where("type").is(type)
                .and("uniqueKey").is(uniqueKey)
                .and("status").in(JobStatus.PENDING, JobStatus.RUNNING))
                .maxTime(storeTimeout);
        return Optional.ofNullable(mongoTemplate.findOne(q, JobDocument.class));
    }

    @Override
    public Optional<Job> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return translate("find job", () -> Optional.ofNullable(mongoTemplate.findById(id, JobDocument.class)).map(JobDocument::toJob));
    }

    /**
     * Each claim is one {@code findAndModify}, so concurrent workers never claim the same job.
     */
    @Override
    public List<Job> claimDue(Instant now, int batchSize, Duration lease, String workerId) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lease, "lease must not be null");
        if (batchSize <= 0) {
            return List.of();
        }
        if (lease.isZero() || lease.isNegative()) {
            throw new IllegalArgumentException("lease must be a positive duration");
        }
        if (isBlank(workerId)) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Query due = new Query(new Criteria().orOperator(
                Criteria.where("status").is(JobStatus.PENDING).and("scheduledFor").lte(now),
                Criteria.where("status").is(JobStatus.RUNNING).and("leaseUntil").lt(now)
        ));
        due.with(Sort.by(Sort.Order.asc("priority"), Sort.Order.asc("createdAt")));

        Update claim = new Update()
                .set("status", JobStatus.RUNNING)
                .set("startedAt", now)
                .set("lockedBy", workerId)
                .set("leaseUntil", now.plus(lease));

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        return translate("claim jobs", () -> {
            List<Job> claimed = new ArrayList<>(Math.min(batchSize, 64));
            for (int i = 0; i < batchSize; i++) {
                JobDocument doc = mongoTemplate.findAndModify(due, claim, options, JobDocument.class);
                if (doc == null) {
                    break;
                }
                claimed.add(doc.toJob());
            }
            return claimed;
        });
    }

    @Override
    public boolean markCompleted(String id, String workerId, Instant finishedAt) {
        Update u = releaseLease(new Update())
                .set("status", JobStatus.COMPLETED)
                .set("completedAt", finishedAt)
                .unset("errorMessage");
        return updateOwned("mark job completed", id, workerId, u);
    }

    @Override
    public boolean markRescheduled(String id, String workerId, Instant finishedAt, Instant nextRunAt) {
        Objects.requireNonNull(nextRunAt, "nextRunAt must not be null");
        Update u = releaseLease(new Update())
                .set("status", JobStatus.PENDING)
                .set("completedAt", finishedAt)
                .set("scheduledFor", nextRunAt)
                .set("retryCount", 0)
                .unset("errorMessage");
        return updateOwned("reschedule job", id, workerId, u);
    }

    @Override
    public boolean markRetry(String id, String workerId, int retryCount, Instant nextRunAt, String errorMessage) {
        Update u = releaseLease(new Update())
                .set("status", JobStatus.PENDING)
                .set("retryCount", retryCount)
                .set("scheduledFor", nextRunAt)
                .set("errorMessage", errorMessage);
        return updateOwned("mark job for retry", id, workerId, u);
    }

    @Override
    public boolean markFailed(String id, String workerId, int retryCount, Instant failedAt, String errorMessage) {
        Update u = releaseLease(new Update())
                .set("status", JobStatus.FAILED)
                .set("retryCount", retryCount)
                .set("failedAt", failedAt)
                .set("errorMessage", errorMessage);
        return updateOwned("mark job failed", id, workerId, u);
    }

    private boolean updateOwned(String operation, String id, String workerId, Update u) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");
        Query q = new Query(Criteria.where("_id").is(id)
                .and("status").is(JobStatus.RUNNING)
                // Prevent stale write-back if another worker already re-claimed this job.
                .and("lockedBy").is(workerId));
        return translate(operation, () -> mongoTemplate.updateFirst(q, u, JobDocument.class).getMatchedCount() > 0);
    }

    private static Update releaseLease(Update u) {
        return u.unset("lockedBy").unset("leaseUntil");
    }

    @Override
    public long cancelPending(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id).and("status").is(JobStatus.PENDING));
        Update u = new Update().set("status", JobStatus.CANCELLED);
        return translate("cancel job", () -> mongoTemplate.updateFirst(q, u, JobDocument.class).getModifiedCount());
    }

    /**
     * Cancels up to {@code limit} PENDING jobs matching the query, earliest due first.
     */
    @Override
    public CancelResult cancelPending(CancelQuery query, int limit) {
        Objects.requireNonNull(query, "query must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Criteria selector = buildCriteria(query);

        return translate("cancel jobs", () -> {
            long matched = mongoTemplate.count(new Query(selector).maxTime(storeTimeout), JobDocument.class);

            Query pending = new Query(new Criteria().andOperator(selector, Criteria.where("status").is(JobStatus.PENDING)))
                    .with(Sort.by(Sort.Order.asc("scheduledFor"), Sort.Order.asc("priority")))
                    .maxTime(storeTimeout);
            if (limit != Integer.MAX_VALUE) {
                pending.limit(limit);
            }
            pending.fields().include("_id");

            List<String> ids = mongoTemplate.find(pending, JobDocument.class).stream()
                    .map(JobDocument::getId)
                    .toList();
            if (ids.isEmpty()) {
                return new CancelResult(matched, 0);
            }
            Query q = new Query(Criteria.where("_id").in(ids).and("status").is(JobStatus.PENDING));
            long cancelled = mongoTemplate.updateMulti(q, new Update().set("status", JobStatus.CANCELLED), JobDocument.class)
                    .getModifiedCount();
            return new CancelResult(matched, cancelled);
        });
    }

    private static Criteria buildCriteria(CancelQuery query) {
        List<Criteria> parts = new ArrayList<>(3);
        if (query.type() != null) {
            parts.add(Criteria.where("type").is(query.type()));
        }
        if (!isBlank(query.uniqueKey())) {
            parts.add(Criteria.where("uniqueKey").is(query.uniqueKey()));
        }
        if (!isBlank(query.lockKey())) {
            parts.add(Criteria.where("lockKey").is(query.lockKey()));
        }
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("CancelQuery must include at least one selector");
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Aggregation agg = Aggregation.newAggregation(Aggregation.group("status").count().as("count"));
        return translate("count jobs", () -> {
            Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
            for (Document row : mongoTemplate.aggregate(agg, JobDocument.class, Document.class).getMappedResults()) {
                Object status = row.get("_id");
                if (status != null) {
                    counts.put(JobStatus.valueOf(status.toString()), ((Number) row.get("count")).longValue());
                }
            }
            return counts;
        });
    }

    private static JobDocument toDocument(JobSpec<Map<String, Object>> spec, Instant scheduledFor, Instant now) {
        JobDocument doc = new JobDocument();
        doc.setType(spec.type());
        doc.setUniqueKey(blankToNull(spec.uniqueKey()));
        doc.setLockKey(blankToNull(spec.lockKey()));
        doc.setStatus(JobStatus.PENDING);
        doc.setPriority(spec.priority());
        doc.setPayload(spec.payload());
        doc.setMaxRetries(spec.maxRetries());
        doc.setCreatedAt(now);
        doc.setScheduledFor(scheduledFor);
        doc.setRepeatInterval(blankToNull(spec.repeatInterval()));
        doc.setRepeatTimezone(blankToNull(spec.repeatTimezone()));
        return doc;
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
