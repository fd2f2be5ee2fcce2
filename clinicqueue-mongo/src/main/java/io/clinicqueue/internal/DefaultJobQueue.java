package io.clinicqueue.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clinicqueue.JobBuilder;
import io.clinicqueue.JobHandler;
import io.clinicqueue.JobQueue;
import io.clinicqueue.config.ClinicQueueProperties;
import io.clinicqueue.core.CancelQuery;
import io.clinicqueue.core.CancelResult;
import io.clinicqueue.core.EnqueueResult;
import io.clinicqueue.core.Job;
import io.clinicqueue.core.JobHandlerRegistry;
import io.clinicqueue.core.JobQueueStats;
import io.clinicqueue.core.JobSpec;
import io.clinicqueue.core.JobStore;
import io.clinicqueue.core.JobType;
import io.clinicqueue.core.KeyLock;
import io.clinicqueue.error.ClinicQueueException;
import io.clinicqueue.error.LockContentionTimeoutException;
import io.clinicqueue.error.ValidationException;
import io.clinicqueue.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Store-backed job queue and runner.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Priority-ordered execution (1 = most urgent), FIFO within a priority</li>
 *   <li>Coalescing of pending jobs by unique key</li>
 *   <li>Bounded retries with exponential backoff; exhausted jobs end FAILED</li>
 *   <li>Strict one-at-a-time execution per lock key, in claim order</li>
 *   <li>Recurring jobs (interval, cron or "AT HH:mm")</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * jobQueue.start();
 *
 * jobQueue.create(JobType.RECALCULATE_QUEUE, payload)
 *         .uniqueKey("doctor-7|2026-10-18|1")
 *         .lockKey("doctor-7|2026-10-18")
 *         .priority(Priority.HIGH)
 *         .save();
 *
 * jobQueue.stop();
 * }</pre>
 */
public class DefaultJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobQueue.class);

    private static final Comparator<Claimed> DISPATCH_ORDER = Comparator
            .comparingInt((Claimed c) -> c.job().priority())
            .thenComparing(c -> c.job().createdAt())
            .thenComparingLong(Claimed::sequence);

    private final ClinicQueueProperties props;
    private final JobStore jobStore;
    private final JobHandlerRegistry jobRegistry;
    private final ObjectMapper objectMapper;
    private final KeyLock keyLock;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile ExecutorService workerPool;

    private Thread pollerThread;
    private Thread dispatcherThread;

    private final PriorityBlockingQueue<Claimed> ready = new PriorityBlockingQueue<>(64, DISPATCH_ORDER);
    private final ConcurrentHashMap<String, Boolean> enqueued = new ConcurrentHashMap<>();
    private final AtomicLong claimSequence = new AtomicLong();

    private final Semaphore refillSignal = new Semaphore(0);

    private final Semaphore globalSem;
    private final ConcurrentHashMap<JobType, Semaphore> perTypeSem = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Void>> keyChains = new ConcurrentHashMap<>();
    private int systemErrorCount = 0;

    private final String workerId;

    private record Claimed(Job job, long sequence) {
    }

    public DefaultJobQueue(ClinicQueueProperties props,
                           JobStore jobStore,
                           JobHandlerRegistry jobRegistry,
                           ObjectMapper objectMapper,
                           KeyLock keyLock,
                           Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.jobRegistry = Objects.requireNonNull(jobRegistry, "jobRegistry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.keyLock = Objects.requireNonNull(keyLock, "keyLock must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.globalSem = new Semaphore(props.getMaxConcurrency());
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    public String getWorkerId() {
        return workerId;
    }

    /**
     * Start polling and executing due jobs. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        requirePositive(props.getProcessEvery(), "clinicqueue.processEvery");
        requirePositive(props.getLockLifetime(), "clinicqueue.lockLifetime");
        requirePositive(props.getLockWaitTimeout(), "clinicqueue.lockWaitTimeout");

        log.info("clinicqueue starting with processEvery={}, lockLifetime={}, workerId={}, maxConcurrency={}, lockLimit={}, batchSize={}",
                props.getProcessEvery(),
                props.getLockLifetime(),
                workerId,
                props.getMaxConcurrency(),
                props.getLockLimit(),
                props.getBatchSize());

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("clinicqueue.worker");
                t.setDaemon(true);
                return t;
            });
        }

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("clinicqueue.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }

        if (pollerThread == null) {
            pollerThread = new Thread(this::pollerLoop);
            pollerThread.setName("clinicqueue.poller");
            pollerThread.setDaemon(true);
            pollerThread.start();
        }
        log.info("clinicqueue started successfully.");
    }

    /**
     * Stop polling and executing. Idempotent.
     *
     * <p>Handlers already running are never interrupted: this call waits until they finish. If the
     * calling thread is interrupted while waiting, it returns early and the remaining handlers
     * complete in the background.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("clinicqueue stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        ExecutorService pool = workerPool;
        workerPool = null;
        if (pool != null) {
            pool.shutdown();
            try {
                while (!pool.awaitTermination(props.getLockLifetime().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("clinicqueue still waiting for running jobs to finish workerId={}", workerId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("clinicqueue stop interrupted, running jobs finish in the background workerId={}", workerId);
            }
        }

        // claimed but never started; their leases expire and another worker picks them up
        ready.clear();
        enqueued.clear();
        keyChains.clear();
        refillSignal.drainPermits();
        log.info("clinicqueue stopped successfully.");
    }

    public boolean isRunning() {
        return started.get();
    }

    @Override
    public <T> JobBuilder<T> create(JobType type, T payload) {
        return new SimpleJobBuilder<>(type, payload, clock, props.getMaxRetryCount(),
                spec -> jobStore.save(toStoredSpec(spec), clock.instant()));
    }

    @Override
    public <T> EnqueueResult enqueue(JobType type, T payload, int priority) {
        return create(type, payload)
                .priority(priority)
                .save();
    }

    @Override
    public <T> EnqueueResult enqueue(JobType type, T payload, int priority, Instant scheduledFor) {
        return create(type, payload)
                .priority(priority)
                .schedule(scheduledFor)
                .save();
    }

    @Override
    public <T> EnqueueResult every(JobType type, String interval, T payload, JobBuilder.RepeatOptions options) {
        JobSpec<T> spec = create(type, payload)
                .uniqueKey("every:" + type.name())
                .repeatEvery(interval, options)
                .build();
        return jobStore.saveRecurring(toStoredSpec(spec), clock.instant());
    }

    @Override
    public CancelResult cancel(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        long cancelled = jobStore.cancelPending(jobId);
        if (cancelled > 0) {
            return new CancelResult(1, cancelled);
        }
        Optional<Job> job = jobStore.findById(jobId);
        job.ifPresent(j -> log.debug("clinicqueue cancel skipped id={} status={}", jobId, j.status()));
        return new CancelResult(job.isPresent() ? 1 : 0, 0);
    }

    @Override
    public CancelResult cancel(CancelQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        if (query.isEmpty()) {
            throw new IllegalArgumentException("CancelQuery must include at least one selector");
        }
        return jobStore.cancelPending(query, Integer.MAX_VALUE);
    }

    @Override
    public Optional<Job> find(String jobId) {
        return jobStore.findById(jobId);
    }

    @Override
    public JobQueueStats stats() {
        return new JobQueueStats(jobStore.countByStatus());
    }

    /**
     * Claims and dispatches one round of due jobs. The poller calls this on every tick; tests call
     * it directly.
     *
     * @return true if more due jobs may be waiting
     */
    boolean pollOnce() {
        int running = props.getMaxConcurrency() - globalSem.availablePermits();
        int inFlight = enqueued.size() + Math.max(0, running);

        int lockLimit = props.getLockLimit();
        int remaining = lockLimit <= 0 ? Integer.MAX_VALUE : Math.max(0, lockLimit - inFlight);
        if (remaining == 0) {
            return true;
        }

        int batchSize = Math.max(1, props.getBatchSize());
        boolean backlog = false;

        while (remaining > 0) {
            int take = Math.min(batchSize, remaining);
            List<Job> jobs = jobStore.claimDue(clock.instant(), take, props.getLockLifetime(), workerId);

            log.debug("clinicqueue polled jobs count={} remaining={}", jobs.size(), remaining);

            for (Job job : jobs) {
                if (enqueued.putIfAbsent(job.id(), Boolean.TRUE) == null) {
                    ready.offer(new Claimed(job, claimSequence.incrementAndGet()));
                    remaining--;
                }
            }

            if (jobs.size() < take) {
                break;
            }
            if (remaining == 0) {
                backlog = true;
            }
        }
        return backlog;
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("clinicqueue pollOnce failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= 30) {
                    log.error("clinicqueue stopped due to repeated system failures...");
                    stop();
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);

                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (backlog) {
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } else {
                    refillSignal.tryAcquire(props.getProcessEvery().toMillis(), TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                Claimed claimed = ready.take();
                enqueued.remove(claimed.job().id());
                submitToWorker(claimed.job());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("clinicqueue dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    /**
     * Waits for execution slots, then hands the job to the pool. Jobs sharing a lock key are
     * chained so each starts only after the previous one finished.
     */
    void submitToWorker(Job job) {
        Semaphore typeSem = semForType(job.type());
        globalSem.acquireUninterruptibly();
        typeSem.acquireUninterruptibly();

        AtomicBoolean released = new AtomicBoolean(false);
        Runnable releasePermits = () -> {
            if (released.compareAndSet(false, true)) {
                typeSem.release();
                globalSem.release();
                refillSignal.release();
            }
        };
        AtomicBoolean skipped = new AtomicBoolean(false);
        Runnable task = () -> {
            if (skipped.get()) {
                return;
            }
            try {
                runJob(job);
            } finally {
                releasePermits.run();
            }
        };

        // stop() may have retired the pool while this thread waited for permits
        ExecutorService pool = workerPool;
        if (pool == null || pool.isShutdown()) {
            releasePermits.run();
            log.debug("clinicqueue stopped, job left to its lease id={} type={}", job.id(), job.type());
            return;
        }

        // a rejected job is skipped but its chain link still completes, so the key is not blocked
        Executor executor = r -> {
            try {
                pool.execute(r);
            } catch (RejectedExecutionException e) {
                skipped.set(true);
                releasePermits.run();
                log.warn("clinicqueue worker pool rejected job id={} type={}", job.id(), job.type());
                r.run();
            }
        };

        String key = job.lockKey();
        if (key == null) {
            executor.execute(task);
            return;
        }

        CompletableFuture<Void> next = keyChains.compute(key, (k, tail) ->
                (tail == null ? CompletableFuture.<Void>completedFuture(null) : tail)
                        .handle((r, e) -> (Void) null)
                        .thenRunAsync(task, executor));
        next.whenComplete((r, e) -> {
            keyChains.remove(key, next);
            if (e != null) {
                releasePermits.run();
                log.warn("clinicqueue job not run id={} type={} msg={}", job.id(), job.type(), e.getMessage());
            }
        });
    }

    private void runJob(Job job) {
        JobHandler<?> handler;
        try {
            handler = jobRegistry.getRequired(job.type());
        } catch (IllegalStateException e) {
            handleFailure(job, null, new ValidationException(e.getMessage()));
            return;
        }

        Instant startedAt = clock.instant();
        log.debug("clinicqueue job started type={} id={} at={}", job.type(), job.id(), startedAt);
        try {
            executeWithKeyLock(job, handler);
        } catch (Exception e) {
            handleFailure(job, handler, e);
            return;
        }

        Instant finishedAt = clock.instant();
        log.debug("clinicqueue job succeeded type={} id={} at={}", job.type(), job.id(), finishedAt);
        try {
            Instant nextRunAt = IntervalParser.computeNextRunAt(
                    job.repeatInterval(), job.repeatTimezone(), job.scheduledFor(), finishedAt);
            boolean marked = nextRunAt == null
                    ? jobStore.markCompleted(job.id(), workerId, finishedAt)
                    : jobStore.markRescheduled(job.id(), workerId, finishedAt, nextRunAt);
            if (!marked) {
                log.warn("clinicqueue job lease lost before completion was recorded type={} id={}", job.type(), job.id());
            }
        } catch (Exception storeEx) {
            log.error("clinicqueue markCompleted failed type={} id={} msg={}", job.type(), job.id(), storeEx.getMessage(), storeEx);
        }
    }

    private void executeWithKeyLock(Job job, JobHandler<?> handler) throws Exception {
        String key = job.lockKey();
        if (key == null) {
            executeHandler(handler, job.payload());
            return;
        }

        String owner = workerId + "/" + job.id();
        if (!keyLock.tryAcquire(key, owner, props.getLockWaitTimeout())) {
            throw new LockContentionTimeoutException(key,
                    "lock " + key + " not acquired within " + props.getLockWaitTimeout());
        }
        try {
            executeHandler(handler, job.payload());
        } finally {
            keyLock.release(key, owner);
        }
    }

    private void handleFailure(Job job, JobHandler<?> handler, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        log.error("clinicqueue job failed type={} id={} msg={}", job.type(), job.id(), e.getMessage(), e);

        Instant failedAt = clock.instant();
        int nextAttempt = job.retryCount() + 1;
        boolean retryable = !(e instanceof ClinicQueueException cqe) || cqe.isRetryable();
        String errorMessage = truncate(describe(e));

        try {
            if (retryable && nextAttempt < job.maxRetries()) {
                Instant nextRunAt = failedAt.plus(retryDelay(job.retryCount()));
                jobStore.markRetry(job.id(), workerId, nextAttempt, nextRunAt, errorMessage);
                return;
            }

            if (job.isRecurring()) {
                // a recurring job keeps its schedule; only this run is given up
                Instant nextRunAt = IntervalParser.computeNextRunAt(
                        job.repeatInterval(), job.repeatTimezone(), job.scheduledFor(), failedAt);
                log.warn("clinicqueue recurring job run given up type={} id={} attempts={} nextRunAt={}",
                        job.type(), job.id(), nextAttempt, nextRunAt);
                jobStore.markRescheduled(job.id(), workerId, failedAt, nextRunAt);
                return;
            }

            log.warn("clinicqueue job reached max retries; marking failed type={} id={} attempts={} maxRetries={} retryable={}",
                    job.type(), job.id(), nextAttempt, job.maxRetries(), retryable);
            if (jobStore.markFailed(job.id(), workerId, nextAttempt, failedAt, errorMessage) && handler != null) {
                notifyExhausted(handler, job, e);
            }
        } catch (Exception storeEx) {
            log.error("clinicqueue markFailure failed type={} id={} msg={}", job.type(), job.id(), storeEx.getMessage(), storeEx);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void notifyExhausted(JobHandler<?> handler, Job job, Exception lastError) {
        JobHandler<T> h = (JobHandler<T>) handler;
        try {
            T payload = convertPayload(h, job.payload());
            h.onExhausted(payload, lastError);
        } catch (RuntimeException hookEx) {
            log.error("clinicqueue onExhausted failed type={} id={} msg={}", job.type(), job.id(), hookEx.getMessage(), hookEx);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void executeHandler(JobHandler<?> handler, Map<String, Object> rawPayload) throws Exception {
        JobHandler<T> h = (JobHandler<T>) handler;
        h.execute(convertPayload(h, rawPayload));
    }

    private <T> T convertPayload(JobHandler<T> handler, Map<String, Object> rawPayload) {
        if (rawPayload == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(rawPayload, handler.payloadClass());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid " + handler.type() + " payload: " + e.getMessage());
        }
    }

    private <T> JobSpec<Map<String, Object>> toStoredSpec(JobSpec<T> spec) {
        Map<String, Object> payload = spec.payload() == null ? null :
                objectMapper.convertValue(spec.payload(), new TypeReference<>() {
                });
        return spec.withPayload(payload);
    }

    private Semaphore semForType(JobType type) {
        return perTypeSem.computeIfAbsent(type, t -> new Semaphore(props.getDefaultConcurrency()));
    }

    /**
     * Handler retry delay. {@code previousFailures} starts from 0 (first failure).
     * Default: 10s, 20s, 40s, 80s... capped at 10 minutes.
     */
    Duration retryDelay(int previousFailures) {
        int exp = Math.max(0, Math.min(previousFailures, 20)); // avoid overflow
        long baseMs = props.getRetryBackoffBase().toMillis();
        long maxMs = props.getRetryBackoffMax().toMillis();
        return Duration.ofMillis(Math.min(baseMs * (1L << exp), maxMs));
    }

    // Exponential backoff for repeated poll-loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private String truncate(String message) {
        int max = props.getErrorMessageMaxLength();
        if (message == null || max <= 0 || message.length() <= max) {
            return message;
        }
        return message.substring(0, max);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    private String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "clinicqueue";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("clinicqueue host name unavailable, using default msg={}", e.getMessage());
        }

        String pid = String.valueOf(ProcessHandle.current().pid());

        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
