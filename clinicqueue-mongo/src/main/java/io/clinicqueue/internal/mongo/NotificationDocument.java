package io.clinicqueue.internal.mongo;

import io.clinicqueue.notification.NotificationPriority;
import io.clinicqueue.notification.NotificationRecord;
import io.clinicqueue.notification.NotificationStatus;
import io.clinicqueue.notification.NotificationType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for notifications (collection {@code notification_queue}).
 */
@Document(collection = NotificationDocument.COLLECTION)
public class NotificationDocument {

    public static final String COLLECTION = "notification_queue";

    @Id
    private String id;
    private String eventKey;
    private NotificationType type;
    private String recipientId;
    private String title;
    private String message;
    private NotificationPriority priority;
    private NotificationStatus status;
    private int attempts;
    private String errorMessage;
    private Instant createdAt;
    private Instant sentAt;
    private Instant failedAt;

    public NotificationDocument() {
    }

    public static NotificationDocument from(NotificationRecord r) {
        NotificationDocument doc = new NotificationDocument();
        doc.id = r.id();
        doc.eventKey = r.eventKey();
        doc.type = r.type();
        doc.recipientId = r.recipientId();
        doc.title = r.title();
        doc.message = r.message();
        doc.priority = r.priority();
        doc.status = r.status();
        doc.attempts = r.attempts();
        doc.errorMessage = r.errorMessage();
        doc.createdAt = r.createdAt();
        doc.sentAt = r.sentAt();
        doc.failedAt = r.failedAt();
        return doc;
    }

    public NotificationRecord toRecord() {
        return new NotificationRecord(id, eventKey, type, recipientId, title, message, priority, status, attempts, errorMessage, createdAt, sentAt, failedAt);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEventKey() {
        return eventKey;
    }

    public void setEventKey(String eventKey) {
        this.eventKey = eventKey;
    }

    public NotificationType getType() {
        return type;
    }

    public void setType(NotificationType type) {
        this.type = type;
    }

    public String getRecipientId() {
        return recipientId;
    }

    public void setRecipientId(String recipientId) {
        this.recipientId = recipientId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public NotificationPriority getPriority() {
        return priority;
    }

    public void setPriority(NotificationPriority priority) {
        this.priority = priority;
    }

    public NotificationStatus getStatus() {
        return status;
    }

    public void setStatus(NotificationStatus status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getSentAt() {
        return sentAt;
    }

    public void setSentAt(Instant sentAt) {
        this.sentAt = sentAt;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(Instant failedAt) {
        this.failedAt = failedAt;
    }
}
