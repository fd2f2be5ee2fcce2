package io.clinicqueue.appointment;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Immutable appointment snapshot.
 * <p>
 * The queue fields ({@code queuePosition}, {@code estimatedStartTime}, {@code delayMinutes}) are
 * owned by queue recalculation. Lifecycle transitions only clear them. {@code version} is bumped
 * by every lifecycle write and left alone by queue writes.
 */
public record Appointment(
        String id,
        String doctorId,
        String patientId,
        Instant scheduledAt,
        LocalDate serviceDay,
        int durationMinutes,
        AppointmentStatus status,
        Instant checkedInAt,
        Instant actualStartTime,
        Instant actualEndTime,
        Integer queuePosition,
        Instant estimatedStartTime,
        int delayMinutes,
        String notes,
        String cancellationReason,
        String rescheduledFromId,
        String rescheduledToId,
        long version,
        Instant createdAt,
        Instant updatedAt
) {

    public Appointment {
        Objects.requireNonNull(doctorId, "doctorId must not be null");
        Objects.requireNonNull(scheduledAt, "scheduledAt must not be null");
        Objects.requireNonNull(serviceDay, "serviceDay must not be null");
        Objects.requireNonNull(status, "status must not be null");
        // older rows kept a check-in flag next to Scheduled; both spellings mean Checked-In
        if (status == AppointmentStatus.SCHEDULED && checkedInAt != null) {
            status = AppointmentStatus.CHECKED_IN;
        }
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean checkedIn() {
        return checkedInAt != null;
    }

    public DoctorDay doctorDay() {
        return new DoctorDay(doctorId, serviceDay);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String doctorId;
        private String patientId;
        private Instant scheduledAt;
        private LocalDate serviceDay;
        private int durationMinutes;
        private AppointmentStatus status = AppointmentStatus.SCHEDULED;
        private Instant checkedInAt;
        private Instant actualStartTime;
        private Instant actualEndTime;
        private Integer queuePosition;
        private Instant estimatedStartTime;
        private int delayMinutes;
        private String notes;
        private String cancellationReason;
        private String rescheduledFromId;
        private String rescheduledToId;
        private long version;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        private Builder(Appointment a) {
            this.id = a.id;
            this.doctorId = a.doctorId;
            this.patientId = a.patientId;
            this.scheduledAt = a.scheduledAt;
            this.serviceDay = a.serviceDay;
            this.durationMinutes = a.durationMinutes;
            this.status = a.status;
            this.checkedInAt = a.checkedInAt;
            this.actualStartTime = a.actualStartTime;
            this.actualEndTime = a.actualEndTime;
            this.queuePosition = a.queuePosition;
            this.estimatedStartTime = a.estimatedStartTime;
            this.delayMinutes = a.delayMinutes;
            this.notes = a.notes;
            this.cancellationReason = a.cancellationReason;
            this.rescheduledFromId = a.rescheduledFromId;
            this.rescheduledToId = a.rescheduledToId;
            this.version = a.version;
            this.createdAt = a.createdAt;
            this.updatedAt = a.updatedAt;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder doctorId(String doctorId) {
            this.doctorId = doctorId;
            return this;
        }

        public Builder patientId(String patientId) {
            this.patientId = patientId;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder serviceDay(LocalDate serviceDay) {
            this.serviceDay = serviceDay;
            return this;
        }

        public Builder durationMinutes(int durationMinutes) {
            this.durationMinutes = durationMinutes;
            return this;
        }

        public Builder status(AppointmentStatus status) {
            this.status = status;
            return this;
        }

        public Builder checkedInAt(Instant checkedInAt) {
            this.checkedInAt = checkedInAt;
            return this;
        }

        public Builder actualStartTime(Instant actualStartTime) {
            this.actualStartTime = actualStartTime;
            return this;
        }

        public Builder actualEndTime(Instant actualEndTime) {
            this.actualEndTime = actualEndTime;
            return this;
        }

        public Builder queuePosition(Integer queuePosition) {
            this.queuePosition = queuePosition;
            return this;
        }

        public Builder estimatedStartTime(Instant estimatedStartTime) {
            this.estimatedStartTime = estimatedStartTime;
            return this;
        }

        public Builder delayMinutes(int delayMinutes) {
            this.delayMinutes = delayMinutes;
            return this;
        }

        public Builder clearQueueFields() {
            this.queuePosition = null;
            this.estimatedStartTime = null;
            this.delayMinutes = 0;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder cancellationReason(String cancellationReason) {
            this.cancellationReason = cancellationReason;
            return this;
        }

        public Builder rescheduledFromId(String rescheduledFromId) {
            this.rescheduledFromId = rescheduledFromId;
            return this;
        }

        public Builder rescheduledToId(String rescheduledToId) {
            this.rescheduledToId = rescheduledToId;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Appointment build() {
            return new Appointment(
                    id, doctorId, patientId, scheduledAt, serviceDay, durationMinutes, status,
                    checkedInAt, actualStartTime, actualEndTime,
                    queuePosition, estimatedStartTime, delayMinutes,
                    notes, cancellationReason, rescheduledFromId, rescheduledToId,
                    version, createdAt, updatedAt
            );
        }
    }
}
