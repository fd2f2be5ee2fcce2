package io.clinicqueue.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One held per-(doctor, day) lock. The id is the lock key.
 */
@Document(collection = QueueLockDocument.COLLECTION)
public class QueueLockDocument {

    public static final String COLLECTION = "queue_locks";

    @Id
    private String id;

    private String owner;
    private Instant lockedAt;
    private Instant expiresAt;

    public QueueLockDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }
}
