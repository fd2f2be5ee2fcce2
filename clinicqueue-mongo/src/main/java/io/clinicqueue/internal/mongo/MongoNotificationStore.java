package io.clinicqueue.internal.mongo;

import io.clinicqueue.notification.NotificationRecord;
import io.clinicqueue.notification.NotificationStatus;
import io.clinicqueue.notification.NotificationStore;
import org.bson.Document;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.clinicqueue.internal.mongo.MongoStoreSupport.translate;

/**
 * MongoDB persistence for notification records. Event keys are deduplicated by a unique
 * partial index, see {@code ClinicQueueMongoIndexConfig}.
 */
public class MongoNotificationStore implements NotificationStore {

    private final MongoTemplate mongoTemplate;
    private final Duration storeTimeout;

    public MongoNotificationStore(MongoTemplate mongoTemplate, Duration storeTimeout) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.storeTimeout = Objects.requireNonNull(storeTimeout, "storeTimeout must not be null");
    }

    @Override
    public NotificationRecord insertIfAbsent(NotificationRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        return translate("insert notification", () -> {
            if (record.eventKey() != null) {
                Optional<NotificationRecord> existing = findByEventKey(record.eventKey());
                if (existing.isPresent()) {
                    return existing.get();
                }
            }
            try {
                return mongoTemplate.insert(NotificationDocument.from(record)).toRecord();
            } catch (DuplicateKeyException e) {
                if (record.eventKey() == null) {
                    throw e;
                }
                return findByEventKey(record.eventKey()).orElseThrow(() -> e);
            }
        });
    }

    private Optional<NotificationRecord> findByEventKey(String eventKey) {
        Query q = new Query(Criteria.where("eventKey").is(eventKey)).maxTime(storeTimeout);
        return Optional.ofNullable(mongoTemplate.findOne(q, NotificationDocument.class)).map(NotificationDocument::toRecord);
    }

    @Override
    public Optional<NotificationRecord> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return translate("find notification", () ->
                Optional.ofNullable(mongoTemplate.findById(id, NotificationDocument.class)).map(NotificationDocument::toRecord));
    }

    @Override
    public boolean markSent(String id, Instant sentAt) {
        return updatePending("mark notification sent", id, new Update()
                .set("status", NotificationStatus.SENT)
                .set("sentAt", sentAt));
    }

    @Override
    public boolean recordAttempt(String id, String errorMessage) {
        return updatePending("record notification attempt", id, new Update()
                .inc("attempts", 1)
                .set("errorMessage", errorMessage));
    }

    @Override
    public boolean markFailed(String id, Instant failedAt, String errorMessage) {
        return updatePending("mark notification failed", id, new Update()
                .set("status", NotificationStatus.FAILED)
                .set("failedAt", failedAt)
                .set("errorMessage", errorMessage));
    }

    private boolean updatePending(String operation, String id, Update u) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id).and("status").is(NotificationStatus.PENDING));
        return translate(operation, () -> mongoTemplate.updateFirst(q, u, NotificationDocument.class).getMatchedCount() > 0);
    }

    @Override
    public Map<NotificationStatus, Long> countByStatus() {
        Aggregation agg = Aggregation.newAggregation(Aggregation.group("status").count().as("count"));
        return translate("count notifications", () -> {
            Map<NotificationStatus, Long> counts = new EnumMap<>(NotificationStatus.class);
            for (Document row : mongoTemplate.aggregate(agg, NotificationDocument.class, Document.class).getMappedResults()) {
                Object status = row.get("_id");
                if (status != null) {
                    counts.put(NotificationStatus.valueOf(status.toString()), ((Number) row.get("count")).longValue());
                }
            }
            return counts;
        });
    }
}
