package io.clinicqueue.internal.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.ChangeStreamIterable;
import com.mongodb.client.MongoChangeStreamCursor;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.FullDocument;
import com.mongodb.client.model.changestream.UpdateDescription;
import io.clinicqueue.changefeed.AppointmentChange;
import io.clinicqueue.changefeed.AppointmentChangeFeed;
import io.clinicqueue.changefeed.AppointmentChangeListener;
import org.bson.BsonDocument;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link AppointmentChangeFeed} on MongoDB change streams. Requires a replica set.
 *
 * <p>Each subscription owns one daemon thread and one cursor. After a stream error the cursor is
 * reopened from the last resume token, so no change is skipped across short outages.
 *
 * <p>Deletes carry no document, so they cannot be matched to a doctor and are not delivered.
 * Appointments are cancelled, not deleted, in normal operation.
 */
public class MongoAppointmentChangeFeed implements AppointmentChangeFeed {
    private static final Logger log = LoggerFactory.getLogger(MongoAppointmentChangeFeed.class);

    private static final Duration MAX_AWAIT = Duration.ofSeconds(1);
    private static final Duration RESUME_BACKOFF = Duration.ofSeconds(2);

    private final MongoTemplate mongoTemplate;

    public MongoAppointmentChangeFeed(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Subscription subscribe(String doctorId, AppointmentChangeListener listener) {
        Objects.requireNonNull(doctorId, "doctorId must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        StreamSubscription subscription = new StreamSubscription(doctorId, listener);
        subscription.thread.start();
        log.info("clinicqueue change feed subscribed doctorId={}", doctorId);
        return subscription;
    }

    private ChangeStreamIterable<Document> open(String doctorId, BsonDocument resumeToken) {
        ChangeStreamIterable<Document> stream = mongoTemplate.getCollection(AppointmentDocument.COLLECTION)
                .watch(List.of(Aggregates.match(Filters.eq("fullDocument.doctorId", doctorId))))
                .fullDocument(FullDocument.UPDATE_LOOKUP)
                .maxAwaitTime(MAX_AWAIT.toMillis(), TimeUnit.MILLISECONDS);
        return resumeToken == null ? stream : stream.resumeAfter(resumeToken);
    }

    static AppointmentChange toChange(ChangeStreamDocument<Document> event) {
        AppointmentChange.Operation operation;
        switch (event.getOperationType()) {
            case INSERT -> operation = AppointmentChange.Operation.INSERT;
            case UPDATE -> operation = AppointmentChange.Operation.UPDATE;
            case REPLACE -> operation = AppointmentChange.Operation.REPLACE;
            case DELETE -> operation = AppointmentChange.Operation.DELETE;
            default -> {
                return null;
            }
        }

        Document full = event.getFullDocument();
        String id = null;
        BsonDocument key = event.getDocumentKey();
        if (key != null && key.containsKey("_id")) {
            id = key.get("_id").isString() ? key.getString("_id").getValue() : key.get("_id").toString();
        }
        String doctorId = full == null ? null : full.getString("doctorId");
        LocalDate serviceDay = full == null ? null : parseDay(full.getString("serviceDay"));

        Set<String> fields = new LinkedHashSet<>();
        UpdateDescription update = event.getUpdateDescription();
        if (operation == AppointmentChange.Operation.UPDATE && update != null) {
            if (update.getUpdatedFields() != null) {
                update.getUpdatedFields().keySet().forEach(f -> fields.add(topLevel(f)));
            }
            if (update.getRemovedFields() != null) {
                update.getRemovedFields().forEach(f -> fields.add(topLevel(f)));
            }
        }
        return new AppointmentChange(operation, id, doctorId, serviceDay, fields);
    }

    private static String topLevel(String path) {
        int dot = path.indexOf('.');
        return dot < 0 ? path : path.substring(0, dot);
    }

    private static LocalDate parseDay(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            log.warn("clinicqueue change feed unreadable serviceDay={}", raw);
            return null;
        }
    }

    private final class StreamSubscription implements Subscription {
        private final String doctorId;
        private final AppointmentChangeListener listener;
        private final Thread thread;
        private volatile boolean closed;
        private BsonDocument resumeToken;

        StreamSubscription(String doctorId, AppointmentChangeListener listener) {
            this.doctorId = doctorId;
            this.listener = listener;
            this.thread = new Thread(this::loop, "clinicqueue-changefeed-" + doctorId);
            this.thread.setDaemon(true);
        }

        private void loop() {
            while (!closed) {
                try (MongoChangeStreamCursor<ChangeStreamDocument<Document>> cursor = open(doctorId, resumeToken).cursor()) {
                    while (!closed) {
                        ChangeStreamDocument<Document> event = cursor.tryNext();
                        if (cursor.getResumeToken() != null) {
                            resumeToken = cursor.getResumeToken();
                        }
                        if (event != null) {
                            deliver(event);
                        }
                    }
                } catch (MongoException | IllegalStateException e) {
                    if (closed) {
                        return;
                    }
                    log.warn("clinicqueue change feed error doctorId={} msg={}, resuming", doctorId, e.getMessage(), e);
                    try {
                        Thread.sleep(RESUME_BACKOFF.toMillis());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                }
            }
        }

        private void deliver(ChangeStreamDocument<Document> event) {
            AppointmentChange change = toChange(event);
            if (change == null) {
                return;
            }
            try {
                listener.onChange(change);
            } catch (RuntimeException e) {
                log.warn("clinicqueue change listener failed doctorId={} appointmentId={} msg={}",
                        doctorId, change.appointmentId(), e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            closed = true;
            try {
                // the cursor returns within MAX_AWAIT and is closed on the stream thread
                thread.join(MAX_AWAIT.multipliedBy(3).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("clinicqueue change feed closed doctorId={}", doctorId);
        }
    }
}
