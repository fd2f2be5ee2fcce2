package io.clinicqueue.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clinicqueue.JobBuilder;
import io.clinicqueue.JobHandler;
import io.clinicqueue.config.ClinicQueueProperties;
import io.clinicqueue.core.CancelQuery;
import io.clinicqueue.core.CancelResult;
import io.clinicqueue.core.EnqueueResult;
import io.clinicqueue.core.Job;
import io.clinicqueue.core.JobHandlerRegistry;
import io.clinicqueue.core.JobStatus;
import io.clinicqueue.core.JobType;
import io.clinicqueue.core.Priority;
import io.clinicqueue.error.ValidationException;
import io.clinicqueue.internal.memory.InMemoryJobStore;
import io.clinicqueue.internal.memory.LocalKeyLock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultJobQueueTest {

    record Ping(String name) {
    }

    private ClinicQueueProperties props;
    private InMemoryJobStore jobStore;
    private LocalKeyLock keyLock;
    private RecordingHandler handler;
    private DefaultJobQueue queue;

    @BeforeEach
    void setUp() {
        props = new ClinicQueueProperties();
        props.setWorkerId("test-worker");
        props.setProcessEvery(Duration.ofMillis(50));
        props.setRetryBackoffBase(Duration.ofMillis(10));
        props.setRetryBackoffMax(Duration.ofMillis(100));
        props.setLockLifetime(Duration.ofSeconds(5));
        props.setLockWaitTimeout(Duration.ofMillis(200));
        jobStore = new InMemoryJobStore();
        keyLock = new LocalKeyLock();
        handler = new RecordingHandler(JobType.SEND_NOTIFICATION);
    }

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.stop();
        }
    }

    private DefaultJobQueue newQueue(JobHandler<?>... handlers) {
        queue = new DefaultJobQueue(props, jobStore, new JobHandlerRegistry(List.of(handlers)),
                new ObjectMapper().findAndRegisterModules(), keyLock, Clock.systemUTC());
        return queue;
    }

    @Test
    void moreUrgentJobsShouldRunFirst() throws Exception {
        props.setMaxConcurrency(1);
        props.setDefaultConcurrency(1);
        newQueue(handler);

        queue.enqueue(JobType.SEND_NOTIFICATION, new Ping("low"), Priority.LOW.value());
        queue.enqueue(JobType.SEND_NOTIFICATION, new Ping("critical"), Priority.CRITICAL.value());
        queue.enqueue(JobType.SEND_NOTIFICATION, new Ping("high"), Priority.HIGH.value());
        queue.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> handler.seen.size() == 3));
        assertEquals(List.of("critical", "high", "low"), handler.seen);
    }

    @Test
    void exhaustedJobShouldEndFailedAndKeepLastError() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        handler.behavior = p -> {
            throw new IllegalStateException("boom " + attempts.incrementAndGet());
        };
        newQueue(handler);

        String id = queue.create(JobType.SEND_NOTIFICATION, new Ping("x")).maxRetries(3).save().jobId();
        queue.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> status(id) == JobStatus.FAILED));
        Job failed = queue.find(id).orElseThrow();
        assertEquals(3, attempts.get());
        assertEquals(3, failed.retryCount());
        assertEquals("boom 3", failed.errorMessage());
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> handler.exhausted.get() == 1));

        Thread.sleep(200);
        assertEquals(3, attempts.get(), "failed jobs never run again");
    }

    @Test
    void nonRetryableErrorShouldFailAtOnce() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        handler.behavior = p -> {
            attempts.incrementAndGet();
            throw new ValidationException("doctor_id is required");
        };
        newQueue(handler);

        String id = queue.create(JobType.SEND_NOTIFICATION, new Ping("x")).maxRetries(5).save().jobId();
        queue.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> status(id) == JobStatus.FAILED));
        assertEquals(1, attempts.get());
        assertEquals(1, queue.find(id).orElseThrow().retryCount());
    }

    @Test
    void missingHandlerShouldFailJob() throws Exception {
        newQueue(handler);

        String id = queue.enqueue(JobType.RECALCULATE_QUEUE, new Ping("orphan"), 5).jobId();
        queue.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> status(id) == JobStatus.FAILED));
        assertTrue(queue.find(id).orElseThrow().errorMessage().contains("No JobHandler"));
    }

    @Test
    void cancelShouldOnlyAffectPendingJobs() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        handler.behavior = p -> {
            entered.countDown();
            await(release);
        };
        newQueue(handler);

        String later = queue.enqueue(JobType.SEND_NOTIFICATION, new Ping("later"), 5, Instant.now().plusSeconds(3600)).jobId();
        String running = queue.enqueue(JobType.SEND_NOTIFICATION, new Ping("now"), 5).jobId();
        queue.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        CancelResult cancelledPending = queue.cancel(later);
        CancelResult cancelledRunning = queue.cancel(running);
        release.countDown();

        assertEquals(1, cancelledPending.cancelled());
        assertEquals(1, cancelledRunning.matched());
        assertEquals(0, cancelledRunning.cancelled());
        assertEquals(JobStatus.CANCELLED, status(later));
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> status(running) == JobStatus.COMPLETED));
        assertEquals(0, queue.cancel("missing").matched());
    }

    @Test
    void cancelByLockKeyShouldSkipOtherQueues() {
        newQueue(handler);
        Instant later = Instant.now().plusSeconds(3600);
        String mine = queue.create(JobType.SEND_NOTIFICATION, new Ping("a")).lockKey("doc-1|2026-03-02").schedule(later).save().jobId();
        String other = queue.create(JobType.SEND_NOTIFICATION, new Ping("b")).lockKey("doc-2|2026-03-02").schedule(later).save().jobId();

        CancelResult result = queue.cancel(CancelQuery.builder().lockKey("doc-1|2026-03-02").build());

        assertEquals(1, result.cancelled());
        assertEquals(JobStatus.CANCELLED, status(mine));
        assertEquals(JobStatus.PENDING, status(other));
    }

    @Test
    void duplicatePendingRequestShouldCoalesce() {
        newQueue(handler);
        Instant later = Instant.now().plusSeconds(60);

        EnqueueResult first = queue.create(JobType.SEND_NOTIFICATION, new Ping("r"))
                .uniqueKey("doc-1|2026-03-02|1").priority(Priority.MEDIUM).schedule(later).save();
        EnqueueResult second = queue.create(JobType.SEND_NOTIFICATION, new Ping("r"))
                .uniqueKey("doc-1|2026-03-02|1").priority(Priority.CRITICAL).schedule(later).save();

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.jobId(), second.jobId());
        assertEquals(Priority.CRITICAL.value(), queue.find(first.jobId()).orElseThrow().priority());
        assertEquals(1, queue.stats().pending());
    }

    @Test
    void jobsSharingLockKeyShouldNeverOverlap() throws Exception {
        props.setMaxConcurrency(4);
        props.setDefaultConcurrency(4);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        handler.behavior = p -> {
            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
            sleep(30);
            inside.decrementAndGet();
        };
        newQueue(handler);

        for (int i = 0; i < 5; i++) {
            queue.create(JobType.SEND_NOTIFICATION, new Ping("r" + i)).lockKey("doc-1|2026-03-02").save();
        }
        queue.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> handler.seen.size() == 5));
        assertEquals(1, maxInside.get());
        assertEquals(List.of("r0", "r1", "r2", "r3", "r4"), handler.seen);
    }

    @Test
    void contendedLockShouldRetryLater() throws Exception {
        props.setRetryBackoffBase(Duration.ofHours(1));
        props.setRetryBackoffMax(Duration.ofHours(1));
        props.setLockWaitTimeout(Duration.ofMillis(50));
        assertTrue(keyLock.tryAcquire("doc-1|2026-03-02", "someone-else", Duration.ZERO));
        newQueue(handler);

        String id = queue.create(JobType.SEND_NOTIFICATION, new Ping("r")).lockKey("doc-1|2026-03-02").save().jobId();
        queue.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> queue.find(id).orElseThrow().retryCount() == 1));
        Job job = queue.find(id).orElseThrow();
        assertEquals(JobStatus.PENDING, job.status());
        assertTrue(job.errorMessage().contains("not acquired"));
        assertTrue(handler.seen.isEmpty());
    }

    @Test
    void recurringJobShouldSurviveExhaustion() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        RecordingHandler sweep = new RecordingHandler(JobType.NO_SHOW_SWEEP);
        sweep.behavior = p -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("store down");
        };
        newQueue(handler, sweep);

        EnqueueResult first = queue.every(JobType.NO_SHOW_SWEEP, "1 hour", new Ping("sweep"), new JobBuilder.RepeatOptions(false, "UTC"));
        EnqueueResult again = queue.every(JobType.NO_SHOW_SWEEP, "1 hour", new Ping("sweep"), new JobBuilder.RepeatOptions(false, "UTC"));
        assertEquals(first.jobId(), again.jobId());
        queue.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> {
            Job j = queue.find(first.jobId()).orElseThrow();
            return attempts.get() == 3 && j.status() == JobStatus.PENDING && j.retryCount() == 0;
        }));
        Job job = queue.find(first.jobId()).orElseThrow();
        assertTrue(job.scheduledFor().isAfter(Instant.now().plus(Duration.ofMinutes(59))));
        assertEquals(0, sweep.exhausted.get());
    }

    @Test
    void invalidRepeatSpecShouldBeRejectedUpFront() {
        newQueue(handler);

        assertThrows(IllegalArgumentException.class,
                () -> queue.every(JobType.NO_SHOW_SWEEP, "every now and then", new Ping("x"), JobBuilder.RepeatOptions.defaults()));
        assertThrows(IllegalArgumentException.class,
                () -> queue.enqueue(JobType.SEND_NOTIFICATION, new Ping("x"), 11));
    }

    @Test
    void retryDelayShouldDoubleUpToCap() {
        props.setRetryBackoffBase(Duration.ofSeconds(10));
        props.setRetryBackoffMax(Duration.ofMinutes(10));
        newQueue(handler);

        assertEquals(Duration.ofSeconds(10), queue.retryDelay(0));
        assertEquals(Duration.ofSeconds(20), queue.retryDelay(1));
        assertEquals(Duration.ofSeconds(40), queue.retryDelay(2));
        assertEquals(Duration.ofMinutes(10), queue.retryDelay(12));
    }

    @Test
    void startAndStopShouldBeIdempotent() {
        newQueue(handler);

        queue.start();
        queue.start();
        assertTrue(queue.isRunning());
        assertEquals("test-worker", queue.getWorkerId());

        queue.stop();
        queue.stop();
        assertFalse(queue.isRunning());
    }

    @Test
    void stopShouldWaitForRunningHandlerWithoutInterrupting() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        AtomicBoolean finished = new AtomicBoolean();
        handler.behavior = p -> {
            entered.countDown();
            sleep(300);
            interrupted.set(Thread.currentThread().isInterrupted());
            finished.set(true);
        };
        props.setLockLifetime(Duration.ofMillis(100));
        newQueue(handler);

        String id = queue.enqueue(JobType.SEND_NOTIFICATION, new Ping("slow"), 5).jobId();
        queue.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        queue.stop();

        assertTrue(finished.get(), "stop returns only after the handler finished");
        assertFalse(interrupted.get());
        assertEquals(JobStatus.COMPLETED, status(id));
    }

    @Test
    void jobHandedOverAfterStopShouldNotLeakSlots() throws Exception {
        props.setMaxConcurrency(1);
        props.setDefaultConcurrency(1);
        newQueue(handler);
        queue.start();
        queue.stop();

        queue.submitToWorker(claimedJob("late-1", null));
        queue.submitToWorker(claimedJob("late-2", "doc-1|2026-03-02"));

        queue.start();
        queue.enqueue(JobType.SEND_NOTIFICATION, new Ping("after-restart"), 5);
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> handler.seen.contains("after-restart")));
        assertFalse(handler.seen.contains("late"));
    }

    private static Job claimedJob(String id, String lockKey) {
        Instant now = Instant.now();
        return new Job(id, JobType.SEND_NOTIFICATION, null, lockKey, JobStatus.RUNNING, 5, Map.of("name", "late"),
                0, 3, null, now, now, now, null, null, "test-worker", now.plusSeconds(60), null, null);
    }

    private JobStatus status(String id) {
        return queue.find(id).orElseThrow().status();
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static final class RecordingHandler implements JobHandler<Ping> {
        private final JobType type;
        final List<String> seen = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger exhausted = new AtomicInteger();
        volatile Consumer<Ping> behavior = p -> {
        };

        RecordingHandler(JobType type) {
            this.type = type;
        }

        @Override
        public JobType type() {
            return type;
        }

        @Override
        public Class<Ping> payloadClass() {
            return Ping.class;
        }

        @Override
        public void execute(Ping payload) {
            behavior.accept(payload);
            seen.add(payload.name());
        }

        @Override
        public void onExhausted(Ping payload, Exception lastError) {
            exhausted.incrementAndGet();
        }
    }
}
