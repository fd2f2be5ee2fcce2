package io.clinicqueue.internal.mongo;

import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.queue.DoctorDelay;
import io.clinicqueue.queue.DoctorDelayStore;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import static io.clinicqueue.internal.mongo.MongoStoreSupport.translate;

/**
 * MongoDB persistence for reported doctor delays, one document per doctor and day.
 */
public class MongoDoctorDelayStore implements DoctorDelayStore {

    private final MongoTemplate mongoTemplate;
    private final Duration storeTimeout;

    public MongoDoctorDelayStore(MongoTemplate mongoTemplate, Duration storeTimeout) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.storeTimeout = Objects.requireNonNull(storeTimeout, "storeTimeout must not be null");
    }

    @Override
    public DoctorDelay add(DoctorDay doctorDay, int minutes, Instant updatedAt) {
        Objects.requireNonNull(doctorDay, "doctorDay must not be null");
        Query q = new Query(Criteria.where("_id").is(doctorDay.lockKey()));
        Update u = new Update()
                .inc("minutes", minutes)
                .set("updatedAt", updatedAt)
                .setOnInsert("doctorId", doctorDay.doctorId())
                .setOnInsert("serviceDay", doctorDay.serviceDay().toString());
        FindAndModifyOptions options = FindAndModifyOptions.options().upsert(true).returnNew(true);
        return translate("add doctor delay", () ->
                mongoTemplate.findAndModify(q, u, options, DoctorDelayDocument.class).toDelay());
    }

    @Override
    public Optional<DoctorDelay> find(DoctorDay doctorDay) {
        Objects.requireNonNull(doctorDay, "doctorDay must not be null");
        Query q = new Query(Criteria.where("_id").is(doctorDay.lockKey())).maxTime(storeTimeout);
        return translate("find doctor delay", () ->
                Optional.ofNullable(mongoTemplate.findOne(q, DoctorDelayDocument.class)).map(DoctorDelayDocument::toDelay));
    }

    @Override
    public boolean clear(DoctorDay doctorDay) {
        Objects.requireNonNull(doctorDay, "doctorDay must not be null");
        Query q = new Query(Criteria.where("_id").is(doctorDay.lockKey()));
        return translate("clear doctor delay", () ->
                mongoTemplate.remove(q, DoctorDelayDocument.class).getDeletedCount() > 0);
    }
}
