package io.clinicqueue.internal.mongo;

import com.mongodb.client.MongoClients;
import io.clinicqueue.notification.NotificationPriority;
import io.clinicqueue.notification.NotificationRecord;
import io.clinicqueue.notification.NotificationStatus;
import io.clinicqueue.notification.NotificationType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoNotificationStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoNotificationStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "clinicqueue_test");
        mongoTemplate.dropCollection(NotificationDocument.class);
        store = new MongoNotificationStore(mongoTemplate, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(NotificationDocument.class);
    }

    @Test
    void sameEventKeyShouldKeepFirstRecord() {
        NotificationRecord first = store.insertIfAbsent(record("n-1", "created:a"));
        NotificationRecord second = store.insertIfAbsent(record("n-2", "created:a"));

        assertEquals("n-1", first.id());
        assertEquals("n-1", second.id());
        assertFalse(store.findById("n-2").isPresent());
    }

    @Test
    void recordsWithoutEventKeyShouldNeverCollide() {
        NotificationRecord first = store.insertIfAbsent(record("n-1", null));
        NotificationRecord second = store.insertIfAbsent(record("n-2", null));

        assertNotEquals(first.id(), second.id());
        assertEquals(NotificationStatus.PENDING, store.findById("n-2").orElseThrow().status());
    }

    @Test
    void attemptsShouldAccumulateUntilSent() {
        store.insertIfAbsent(record("n-1", "eta:a:1"));

        assertTrue(store.recordAttempt("n-1", "smtp down"));
        assertTrue(store.recordAttempt("n-1", "smtp still down"));
        assertTrue(store.markSent("n-1", NOW));

        NotificationRecord sent = store.findById("n-1").orElseThrow();
        assertEquals(NotificationStatus.SENT, sent.status());
        assertEquals(2, sent.attempts());
        assertEquals(NOW, sent.sentAt());
        assertEquals("smtp still down", sent.errorMessage());
    }

    @Test
    void settledRecordsShouldIgnoreFurtherUpdates() {
        store.insertIfAbsent(record("n-1", null));
        store.insertIfAbsent(record("n-2", null));
        assertTrue(store.markFailed("n-1", NOW, "gave up"));
        assertTrue(store.markSent("n-2", NOW));

        assertFalse(store.markSent("n-1", NOW));
        assertFalse(store.recordAttempt("n-1", "late"));
        assertFalse(store.markFailed("n-2", NOW, "late"));
        assertFalse(store.markSent("missing", NOW));

        assertEquals(NotificationStatus.FAILED, store.findById("n-1").orElseThrow().status());
        assertEquals("gave up", store.findById("n-1").orElseThrow().errorMessage());
        assertEquals(NotificationStatus.SENT, store.findById("n-2").orElseThrow().status());
    }

    @Test
    void countByStatusShouldGroupRecords() {
        store.insertIfAbsent(record("n-1", null));
        store.insertIfAbsent(record("n-2", null));
        store.insertIfAbsent(record("n-3", null));
        store.markSent("n-1", NOW);

        Map<NotificationStatus, Long> counts = store.countByStatus();

        assertEquals(2L, counts.get(NotificationStatus.PENDING));
        assertEquals(1L, counts.get(NotificationStatus.SENT));
    }

    private static NotificationRecord record(String id, String eventKey) {
        return NotificationRecord.pending(id, eventKey, NotificationType.APPOINTMENT, "pat-1",
                "Appointment booked", "See you at 10:00", NotificationPriority.NORMAL, NOW);
    }
}
