package io.clinicqueue.config;

import io.clinicqueue.internal.mongo.AppointmentDocument;
import io.clinicqueue.internal.mongo.JobDocument;
import io.clinicqueue.internal.mongo.NotificationDocument;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;

/**
 * MongoDB index definitions for the clinic queue collections.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at startup unless
 * {@code clinicqueue.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <p>{@link #jobUniqueKeyIndex()} is required for correctness: it is what makes two concurrent
 * enqueues of the same pending work merge instead of duplicating.
 *
 * <h3>Collection {@code job_queue}</h3>
 * <ul>
 *   <li><b>idx_claim</b>: { status: 1, priority: 1, createdAt: 1 }
 *       <br/>Claiming due jobs in priority order.</li>
 *   <li><b>idx_status_scheduledFor</b>: { status: 1, scheduledFor: 1 }
 *       <br/>Due-time filter of the claim query.</li>
 *   <li><b>ux_pending_type_uniqueKey</b> (unique + partial): { type: 1, uniqueKey: 1 } where
 *       status is PENDING and uniqueKey exists.</li>
 *   <li><b>idx_lockKey</b>: { lockKey: 1 }</li>
 * </ul>
 *
 * <h3>Collection {@code appointments}</h3>
 * <ul>
 *   <li><b>idx_doctor_day_status</b>: { doctorId: 1, serviceDay: 1, status: 1 }</li>
 *   <li><b>idx_status_scheduledAt</b>: { status: 1, scheduledAt: 1 } for the no-show sweep.</li>
 * </ul>
 *
 * <h3>Collection {@code notification_queue}</h3>
 * <ul>
 *   <li><b>ux_eventKey</b> (unique + partial): { eventKey: 1 } where eventKey exists.</li>
 * </ul>
 *
 * <p>{@code queue_locks} and {@code doctor_delays} are looked up by {@code _id} only.
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.job_queue.createIndex({ status: 1, priority: 1, createdAt: 1 }, { name: "idx_claim" });
 * db.job_queue.createIndex({ status: 1, scheduledFor: 1 }, { name: "idx_status_scheduledFor" });
 * db.job_queue.createIndex(
 *   { type: 1, uniqueKey: 1 },
 *   { name: "ux_pending_type_uniqueKey", unique: true,
 *     partialFilterExpression: { status: "PENDING", uniqueKey: { $exists: true } } }
 * );
 * db.job_queue.createIndex({ lockKey: 1 }, { name: "idx_lockKey" });
 * db.appointments.createIndex({ doctorId: 1, serviceDay: 1, status: 1 }, { name: "idx_doctor_day_status" });
 * db.appointments.createIndex({ status: 1, scheduledAt: 1 }, { name: "idx_status_scheduledAt" });
 * db.notification_queue.createIndex(
 *   { eventKey: 1 },
 *   { name: "ux_eventKey", unique: true, partialFilterExpression: { eventKey: { $exists: true } } }
 * );
 * </pre>
 */
public class ClinicQueueMongoIndexConfig {

    public static final String IDX_CLAIM = "idx_claim";
    public static final String IDX_STATUS_SCHEDULED_FOR = "idx_status_scheduledFor";
    public static final String UX_PENDING_TYPE_UNIQUE_KEY = "ux_pending_type_uniqueKey";
    public static final String IDX_LOCK_KEY = "idx_lockKey";
    public static final String IDX_DOCTOR_DAY_STATUS = "idx_doctor_day_status";
    public static final String IDX_STATUS_SCHEDULED_AT = "idx_status_scheduledAt";
    public static final String UX_EVENT_KEY = "ux_eventKey";

    private final MongoTemplate mongoTemplate;

    public ClinicQueueMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(jobClaimIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(jobDueIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(jobUniqueKeyIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(jobLockKeyIndex());
        mongoTemplate.indexOps(AppointmentDocument.class).ensureIndex(appointmentDoctorDayIndex());
        mongoTemplate.indexOps(AppointmentDocument.class).ensureIndex(appointmentStatusScheduledAtIndex());
        mongoTemplate.indexOps(NotificationDocument.class).ensureIndex(notificationEventKeyIndex());
    }

    public static Index jobClaimIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("priority", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CLAIM);
    }

    public static Index jobDueIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("scheduledFor", Sort.Direction.ASC)
                .named(IDX_STATUS_SCHEDULED_FOR);
    }

    /**
     * At most one pending job per (type, uniqueKey).
     */
    public static Index jobUniqueKeyIndex() {
        return new Index()
                .on("type", Sort.Direction.ASC)
                .on("uniqueKey", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(new Document("status", "PENDING")
                        .append("uniqueKey", new Document("$exists", true))))
                .named(UX_PENDING_TYPE_UNIQUE_KEY);
    }

    public static Index jobLockKeyIndex() {
        return new Index()
                .on("lockKey", Sort.Direction.ASC)
                .named(IDX_LOCK_KEY);
    }

    public static Index appointmentDoctorDayIndex() {
        return new Index()
                .on("doctorId", Sort.Direction.ASC)
                .on("serviceDay", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .named(IDX_DOCTOR_DAY_STATUS);
    }

    public static Index appointmentStatusScheduledAtIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("scheduledAt", Sort.Direction.ASC)
                .named(IDX_STATUS_SCHEDULED_AT);
    }

    public static Index notificationEventKeyIndex() {
        return new Index()
                .on("eventKey", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(new Document("eventKey", new Document("$exists", true))))
                .named(UX_EVENT_KEY);
    }
}
