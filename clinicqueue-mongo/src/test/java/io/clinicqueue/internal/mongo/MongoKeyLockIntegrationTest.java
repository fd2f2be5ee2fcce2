package io.clinicqueue.internal.mongo;

import com.mongodb.client.MongoClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoKeyLockIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final String KEY = "doc-1|2026-03-02";

    private MongoTemplate mongoTemplate;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "clinicqueue_test");
        mongoTemplate.dropCollection(QueueLockDocument.class);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(QueueLockDocument.class);
    }

    @Test
    void heldLockShouldBlockOtherOwnersUntilReleased() throws Exception {
        MongoKeyLock lock = new MongoKeyLock(mongoTemplate, Duration.ofMinutes(1), Clock.systemUTC());

        assertTrue(lock.tryAcquire(KEY, "worker-A/job-1", Duration.ZERO));
        assertFalse(lock.tryAcquire(KEY, "worker-B/job-2", Duration.ofMillis(250)));
        assertTrue(lock.tryAcquire("doc-2|2026-03-02", "worker-B/job-3", Duration.ZERO));

        lock.release(KEY, "worker-B/job-2");
        assertFalse(lock.tryAcquire(KEY, "worker-B/job-2", Duration.ZERO));

        lock.release(KEY, "worker-A/job-1");
        assertTrue(lock.tryAcquire(KEY, "worker-B/job-2", Duration.ZERO));
    }

    @Test
    void expiredLockShouldBeTakenOver() throws Exception {
        Instant t0 = Instant.parse("2026-03-02T08:00:00Z");
        MongoKeyLock crashed = new MongoKeyLock(mongoTemplate, Duration.ofSeconds(30), Clock.fixed(t0, ZoneOffset.UTC));
        MongoKeyLock later = new MongoKeyLock(mongoTemplate, Duration.ofSeconds(30),
                Clock.fixed(t0.plusSeconds(31), ZoneOffset.UTC));

        assertTrue(crashed.tryAcquire(KEY, "worker-A/job-1", Duration.ZERO));
        assertTrue(later.tryAcquire(KEY, "worker-B/job-2", Duration.ZERO));
    }
}
