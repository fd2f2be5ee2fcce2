package io.clinicqueue.internal.mongo;

import com.mongodb.client.MongoClients;
import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.queue.DoctorDelay;
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
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoDoctorDelayStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final DoctorDay DOC_DAY = new DoctorDay("doc-1", LocalDate.of(2026, 3, 2));
    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoDoctorDelayStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "clinicqueue_test");
        mongoTemplate.dropCollection(DoctorDelayDocument.class);
        store = new MongoDoctorDelayStore(mongoTemplate, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(DoctorDelayDocument.class);
    }

    @Test
    void addShouldCreateThenAccumulate() {
        DoctorDelay first = store.add(DOC_DAY, 15, T0);
        DoctorDelay second = store.add(DOC_DAY, 10, T0.plusSeconds(600));

        assertEquals(15, first.minutes());
        assertEquals(25, second.minutes());
        assertEquals(DOC_DAY, second.doctorDay());
        assertEquals(T0.plusSeconds(600), store.find(DOC_DAY).orElseThrow().updatedAt());
        assertEquals(1L, mongoTemplate.count(new Query(), DoctorDelayDocument.class));
    }

    @Test
    void daysAndDoctorsShouldBeKeptApart() {
        store.add(DOC_DAY, 15, T0);
        store.add(new DoctorDay("doc-1", LocalDate.of(2026, 3, 3)), 5, T0);

        assertEquals(15, store.find(DOC_DAY).orElseThrow().minutes());
        assertFalse(store.find(new DoctorDay("doc-2", DOC_DAY.serviceDay())).isPresent());
    }

    @Test
    void clearShouldRemoveTheDelay() {
        store.add(DOC_DAY, 15, T0);

        assertTrue(store.clear(DOC_DAY));
        assertFalse(store.clear(DOC_DAY));
        assertFalse(store.find(DOC_DAY).isPresent());
    }
}
