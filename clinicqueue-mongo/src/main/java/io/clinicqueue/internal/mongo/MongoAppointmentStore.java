package io.clinicqueue.internal.mongo;

import io.clinicqueue.appointment.Appointment;
import io.clinicqueue.appointment.AppointmentStatus;
import io.clinicqueue.appointment.AppointmentStore;
import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.appointment.QueueAssignment;
import io.clinicqueue.error.TransientStoreException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.clinicqueue.internal.mongo.MongoStoreSupport.translate;

/**
 * MongoDB persistence for appointments (collection {@code appointments}).
 *
 * <p>Multi-document writes (reschedule, queue batches) run in a MongoDB transaction and need a
 * replica set.
 */
public class MongoAppointmentStore implements AppointmentStore {

    // longest appointment we look back for when checking overlaps
    private static final Duration MAX_DURATION = Duration.ofHours(24);

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Duration storeTimeout;

    public MongoAppointmentStore(MongoTemplate mongoTemplate, TransactionTemplate transactionTemplate, Duration storeTimeout) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
        this.storeTimeout = Objects.requireNonNull(storeTimeout, "storeTimeout must not be null");
    }

    @Override
    public Optional<Appointment> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return translate("find appointment", () ->
                Optional.ofNullable(mongoTemplate.findById(id, AppointmentDocument.class))
                        .map(AppointmentDocument::toAppointment));
    }

    @Override
    public List<Appointment> findByDoctorDay(DoctorDay doctorDay, Collection<AppointmentStatus> statuses) {
        Query q = new Query(Criteria.where("doctorId").is(doctorDay.doctorId())
                .and("serviceDay").is(doctorDay.serviceDay().toString())
                .and("status").in(names(statuses)))
                .maxTime(storeTimeout);
        return find("find appointments of doctor day", q);
    }

    @Override
    public List<Appointment> findOverlapping(String doctorId, Instant start, Instant end) {
        Query q = new Query(Criteria.where("doctorId").is(doctorId)
                .and("status").in(names(AppointmentStatus.ACTIVE))
                .and("scheduledAt").gt(start.minus(MAX_DURATION)).lt(end))
                .maxTime(storeTimeout);
        return find("find overlapping appointments", q).stream()
                .filter(a -> a.scheduledAt().plus(Duration.ofMinutes(a.durationMinutes())).isAfter(start))
                .toList();
    }

    @Override
    public List<Appointment> findScheduledBefore(Instant cutoff, int limit) {
        Query q = new Query(Criteria.where("status").is(AppointmentStatus.SCHEDULED.name())
                .and("scheduledAt").lt(cutoff)
                .and("checkedIn").ne(true))
                .with(Sort.by(Sort.Order.asc("scheduledAt")))
                .limit(limit)
                .maxTime(storeTimeout);
        return find("find overdue appointments", q);
    }

    @Override
    public Appointment insert(Appointment appointment) {
        Objects.requireNonNull(appointment.id(), "appointment id must be assigned");
        return translate("insert appointment",
                () -> mongoTemplate.insert(AppointmentDocument.from(appointment)).toAppointment());
    }

    @Override
    public boolean updateLifecycle(Appointment updated, long expectedVersion) {
        return translate("update appointment", () -> applyLifecycle(updated, expectedVersion));
    }

    @Override
    public boolean reschedule(Appointment source, long expectedVersion, Appointment replacement) {
        return translate("reschedule appointment", () -> Boolean.TRUE.equals(transactionTemplate.execute(status -> {
            if (!applyLifecycle(source, expectedVersion)) {
                return false;
            }
            mongoTemplate.insert(AppointmentDocument.from(replacement));
            return true;
        })));
    }

    @Override
    public void applyQueueAssignments(List<QueueAssignment> assignments, Instant updatedAt) {
        if (assignments.isEmpty()) {
            return;
        }
        MongoStoreSupport.run("apply queue assignments", () -> transactionTemplate.executeWithoutResult(status -> {
            for (QueueAssignment qa : assignments) {
                Query q = new Query(Criteria.where("_id").is(qa.appointmentId()).and("version").is(qa.expectedVersion()));
                Update u = new Update()
                        .set("queuePosition", qa.queuePosition())
                        .set("estimatedStartTime", qa.estimatedStartTime())
                        .set("delayMinutes", qa.delayMinutes())
                        .set("updatedAt", updatedAt);
                if (mongoTemplate.updateFirst(q, u, AppointmentDocument.class).getMatchedCount() == 0) {
                    // unchecked, so the transaction rolls back
                    throw new TransientStoreException("appointment " + qa.appointmentId()
                            + " changed since the queue was read; batch not applied");
                }
            }
        }));
    }

    private boolean applyLifecycle(Appointment updated, long expectedVersion) {
        Query q = new Query(Criteria.where("_id").is(updated.id()).and("version").is(expectedVersion));
        Update u = new Update()
                .set("status", updated.status().name())
                .set("checkedIn", updated.checkedIn())
                .set("version", updated.version())
                .set("updatedAt", updated.updatedAt());
        setOrUnset(u, "checkedInAt", updated.checkedInAt());
        setOrUnset(u, "actualStartTime", updated.actualStartTime());
        setOrUnset(u, "actualEndTime", updated.actualEndTime());
        setOrUnset(u, "cancellationReason", updated.cancellationReason());
        setOrUnset(u, "rescheduledToId", updated.rescheduledToId());
        if (!updated.isActive()) {
            u.unset("queuePosition").unset("estimatedStartTime").set("delayMinutes", 0);
        }
        return mongoTemplate.updateFirst(q, u, AppointmentDocument.class).getMatchedCount() > 0;
    }

    private List<Appointment> find(String operation, Query q) {
        return translate(operation, () -> mongoTemplate.find(q, AppointmentDocument.class).stream()
                .map(AppointmentDocument::toAppointment)
                .toList());
    }

    private static void setOrUnset(Update u, String field, Object value) {
        if (value != null) {
            u.set(field, value);
        } else {
            u.unset(field);
        }
    }

    private static List<String> names(Collection<AppointmentStatus> statuses) {
        return statuses.stream().map(AppointmentStatus::name).toList();
    }
}
