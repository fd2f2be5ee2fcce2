package io.clinicqueue.internal.mongo;

import com.mongodb.client.MongoClients;
import io.clinicqueue.core.CancelQuery;
import io.clinicqueue.core.CancelResult;
import io.clinicqueue.core.EnqueueResult;
import io.clinicqueue.core.Job;
import io.clinicqueue.core.JobSpec;
import io.clinicqueue.core.JobStatus;
import io.clinicqueue.core.JobType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "clinicqueue_test");
        mongoTemplate.dropCollection(JobDocument.class);
        jobStore = new MongoJobStore(mongoTemplate, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDocument.class);
    }

    @Test
    void claimDueShouldLeaseJobAndPreventDoubleClaim() {
        Instant now = now();
        String id = jobStore.save(spec(null, null, 5, now.minusSeconds(5)), now).jobId();

        List<Job> first = jobStore.claimDue(now, 1, Duration.ofSeconds(30), "worker-A");
        List<Job> second = jobStore.claimDue(now, 1, Duration.ofSeconds(30), "worker-B");

        assertEquals(1, first.size());
        Job claimed = first.get(0);
        assertEquals(id, claimed.id());
        assertEquals(JobStatus.RUNNING, claimed.status());
        assertEquals("worker-A", claimed.lockedBy());
        assertEquals(now.plusSeconds(30), claimed.leaseUntil());
        assertTrue(second.isEmpty());
    }

    @Test
    void claimDueShouldOrderByPriorityThenAge() {
        Instant now = now();
        String low = jobStore.save(spec(null, null, 8, now.minusSeconds(60)), now.minusSeconds(60)).jobId();
        String urgentNewer = jobStore.save(spec(null, null, 1, now), now.minusSeconds(10)).jobId();
        String urgentOlder = jobStore.save(spec(null, null, 1, now), now.minusSeconds(20)).jobId();
        jobStore.save(spec(null, null, 1, now.plusSeconds(600)), now);

        List<String> order = jobStore.claimDue(now, 10, Duration.ofSeconds(30), "worker-A").stream()
                .map(Job::id)
                .toList();

        assertEquals(List.of(urgentOlder, urgentNewer, low), order);
    }

    @Test
    void expiredLeaseShouldBeReclaimedAndStaleOwnerRejected() {
        Instant now = now();
        String id = jobStore.save(spec(null, null, 5, now), now).jobId();
        jobStore.claimDue(now, 1, Duration.ofSeconds(1), "worker-A");

        List<Job> reclaimed = jobStore.claimDue(now.plusSeconds(5), 1, Duration.ofSeconds(30), "worker-B");

        assertEquals(1, reclaimed.size());
        assertEquals("worker-B", reclaimed.get(0).lockedBy());
        assertFalse(jobStore.markCompleted(id, "worker-A", now.plusSeconds(6)));
        assertTrue(jobStore.markCompleted(id, "worker-B", now.plusSeconds(6)));

        Job done = jobStore.findById(id).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertNull(done.lockedBy());
        assertNull(done.leaseUntil());
    }

    @Test
    void pendingJobWithSameUniqueKeyShouldAbsorbRequest() {
        Instant now = now();
        EnqueueResult first = jobStore.save(spec("doc-1|2026-03-02|1", null, 3, now.plusSeconds(60)), now);
        EnqueueResult second = jobStore.save(spec("doc-1|2026-03-02|1", null, 1, now.plusSeconds(30)), now);
        EnqueueResult third = jobStore.save(spec("doc-1|2026-03-02|1", null, 8, now.plusSeconds(90)), now);

        assertTrue(first.created());
        assertFalse(second.created());
        assertFalse(third.created());
        assertEquals(first.jobId(), third.jobId());

        Job merged = jobStore.findById(first.jobId()).orElseThrow();
        assertEquals(1, merged.priority());
        assertEquals(now.plusSeconds(30), merged.scheduledFor());
        assertEquals(1L, mongoTemplate.count(new Query(), JobDocument.class));
    }

    @Test
    void runningJobShouldNotAbsorbNewRequest() {
        Instant now = now();
        String running = jobStore.save(spec("doc-1|2026-03-02|1", null, 3, now), now).jobId();
        jobStore.claimDue(now, 1, Duration.ofSeconds(30), "worker-A");

        EnqueueResult next = jobStore.save(spec("doc-1|2026-03-02|1", null, 3, now), now);

        assertTrue(next.created());
        assertFalse(running.equals(next.jobId()));
    }

    @Test
    void retryAndFailShouldOnlyApplyToOwnedRunningJob() {
        Instant now = now();
        String id = jobStore.save(spec(null, null, 5, now), now).jobId();
        jobStore.claimDue(now, 1, Duration.ofSeconds(30), "worker-A");

        assertTrue(jobStore.markRetry(id, "worker-A", 1, now.plusSeconds(10), "boom"));
        Job retried = jobStore.findById(id).orElseThrow();
        assertEquals(JobStatus.PENDING, retried.status());
        assertEquals(1, retried.retryCount());
        assertEquals("boom", retried.errorMessage());
        assertFalse(jobStore.markFailed(id, "worker-A", 2, now, "not running"));

        jobStore.claimDue(now.plusSeconds(10), 1, Duration.ofSeconds(30), "worker-A");
        assertTrue(jobStore.markFailed(id, "worker-A", 2, now.plusSeconds(11), "boom again"));
        Job failed = jobStore.findById(id).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(2, failed.retryCount());
        assertEquals(now.plusSeconds(11), failed.failedAt());
    }

    @Test
    void recurringJobShouldStaySingleAndRescheduleWithFreshRetries() {
        Instant now = now();
        JobSpec<Map<String, Object>> sweep = new JobSpec<>(JobType.NO_SHOW_SWEEP, "every:NO_SHOW_SWEEP", null,
                now, "15 minutes", "UTC", 5, 3, Map.of("graceMinutes", 20));

        EnqueueResult first = jobStore.saveRecurring(sweep, now);
        EnqueueResult again = jobStore.saveRecurring(sweep, now);
        assertTrue(first.created());
        assertEquals(first.jobId(), again.jobId());

        jobStore.claimDue(now, 1, Duration.ofSeconds(30), "worker-A");
        jobStore.markRetry(first.jobId(), "worker-A", 2, now, "store down");
        jobStore.claimDue(now, 1, Duration.ofSeconds(30), "worker-A");
        assertTrue(jobStore.markRescheduled(first.jobId(), "worker-A", now, now.plus(Duration.ofMinutes(15))));

        Job job = jobStore.findById(first.jobId()).orElseThrow();
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(0, job.retryCount());
        assertNull(job.errorMessage());
        assertEquals(now.plus(Duration.ofMinutes(15)), job.scheduledFor());
        assertEquals("15 minutes", job.repeatInterval());
        assertEquals(20, ((Number) job.payload().get("graceMinutes")).intValue());
    }

    @Test
    void cancelShouldOnlyTouchPendingJobs() {
        Instant now = now();
        String running = jobStore.save(spec(null, "doc-1|2026-03-02", 5, now), now).jobId();
        jobStore.claimDue(now, 1, Duration.ofSeconds(30), "worker-A");
        String pending = jobStore.save(spec(null, "doc-1|2026-03-02", 5, now.plusSeconds(60)), now).jobId();
        String other = jobStore.save(spec(null, "doc-2|2026-03-02", 5, now.plusSeconds(60)), now).jobId();

        assertEquals(0, jobStore.cancelPending(running));
        CancelResult result = jobStore.cancelPending(CancelQuery.builder().lockKey("doc-1|2026-03-02").build(), 10);

        assertEquals(2, result.matched());
        assertEquals(1, result.cancelled());
        assertEquals(JobStatus.RUNNING, jobStore.findById(running).orElseThrow().status());
        assertEquals(JobStatus.CANCELLED, jobStore.findById(pending).orElseThrow().status());
        assertEquals(JobStatus.PENDING, jobStore.findById(other).orElseThrow().status());
        assertEquals(0, jobStore.cancelPending(pending));
    }

    @Test
    void countByStatusShouldGroupJobs() {
        Instant now = now();
        jobStore.save(spec(null, null, 5, now), now);
        jobStore.save(spec(null, null, 5, now.plusSeconds(60)), now);
        jobStore.claimDue(now, 1, Duration.ofSeconds(30), "worker-A");

        Map<JobStatus, Long> counts = jobStore.countByStatus();

        assertEquals(1L, counts.get(JobStatus.PENDING));
        assertEquals(1L, counts.get(JobStatus.RUNNING));
        assertNull(counts.get(JobStatus.FAILED));
    }

    private static JobSpec<Map<String, Object>> spec(String uniqueKey, String lockKey, int priority, Instant scheduledFor) {
        return new JobSpec<>(JobType.RECALCULATE_QUEUE, uniqueKey, lockKey, scheduledFor, null, null,
                priority, 3, Map.of("doctorId", "doc-1", "serviceDay", "2026-03-02", "startFrom", 1));
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
