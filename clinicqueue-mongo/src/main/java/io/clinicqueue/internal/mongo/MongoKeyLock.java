package io.clinicqueue.internal.mongo;

import io.clinicqueue.core.KeyLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import static io.clinicqueue.internal.mongo.MongoStoreSupport.translate;

/**
 * Cross-process {@link KeyLock} on the {@code queue_locks} collection.
 *
 * <p>A lock is a document keyed by the lock key. It expires after {@code lifetime} so a crashed
 * holder cannot block a queue forever. Acquisition polls until {@code maxWait} runs out.
 */
public class MongoKeyLock implements KeyLock {
    private static final Logger log = LoggerFactory.getLogger(MongoKeyLock.class);

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final MongoTemplate mongoTemplate;
    private final Duration lifetime;
    private final Clock clock;

    public MongoKeyLock(MongoTemplate mongoTemplate, Duration lifetime, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean tryAcquire(String key, String owner, Duration maxWait) throws InterruptedException {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (true) {
            if (acquireOnce(key, owner)) {
                return true;
            }
            long left = deadline - System.nanoTime();
            if (left <= 0) {
                return false;
            }
            Thread.sleep(Math.min(POLL_INTERVAL.toMillis(), Math.max(1L, left / 1_000_000L)));
        }
    }

    boolean acquireOnce(String key, String owner) {
        Instant now = clock.instant();
        // free (expired) or already ours; a live lock held by someone else makes the upsert collide
        Query q = new Query(Criteria.where("_id").is(key)
                .orOperator(Criteria.where("expiresAt").lt(now), Criteria.where("owner").is(owner)));
        Update u = new Update()
                .set("owner", owner)
                .set("lockedAt", now)
                .set("expiresAt", now.plus(lifetime));
        return translate("acquire queue lock", () -> {
            try {
                mongoTemplate.upsert(q, u, QueueLockDocument.class);
                return true;
            } catch (DuplicateKeyException e) {
                log.trace("queue lock busy key={}", key);
                return false;
            }
        });
    }

    @Override
    public void release(String key, String owner) {
        Query q = new Query(Criteria.where("_id").is(key).and("owner").is(owner));
        long removed = translate("release queue lock", () -> mongoTemplate.remove(q, QueueLockDocument.class).getDeletedCount());
        if (removed == 0) {
            log.warn("queue lock was not held at release key={} owner={}", key, owner);
        }
    }
}
