package io.clinicqueue.internal.mongo;

import io.clinicqueue.appointment.Appointment;
import io.clinicqueue.appointment.AppointmentStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Mongo document model for appointments.
 *
 * <p>{@code serviceDay} is stored as an ISO date string so it never shifts with the JVM zone.
 * {@code checkedIn} is the legacy flag some older rows carry next to a Scheduled status; it is
 * still written so those readers keep working.
 */
@Document(collection = AppointmentDocument.COLLECTION)
public class AppointmentDocument {

    public static final String COLLECTION = "appointments";

    @Id
    private String id;
    private String doctorId;
    private String patientId;
    private Instant scheduledAt;
    private String serviceDay;
    private int durationMinutes;
    private String status;
    private Boolean checkedIn;
    private Instant checkedInAt;
    private Instant actualStartTime;
    private Instant actualEndTime;
    private Integer queuePosition;
    private Instant estimatedStartTime;
    private Integer delayMinutes;
    private String notes;
    private String cancellationReason;
    private String rescheduledFromId;
    private String rescheduledToId;
    private long version;
    private Instant createdAt;
    private Instant updatedAt;

    public AppointmentDocument() {
    }

    public static AppointmentDocument from(Appointment a) {
        AppointmentDocument doc = new AppointmentDocument();
        doc.id = a.id();
        doc.doctorId = a.doctorId();
        doc.patientId = a.patientId();
        doc.scheduledAt = a.scheduledAt();
        doc.serviceDay = a.serviceDay().toString();
        doc.durationMinutes = a.durationMinutes();
        doc.status = a.status().name();
        doc.checkedIn = a.checkedIn();
        doc.checkedInAt = a.checkedInAt();
        doc.actualStartTime = a.actualStartTime();
        doc.actualEndTime = a.actualEndTime();
        doc.queuePosition = a.queuePosition();
        doc.estimatedStartTime = a.estimatedStartTime();
        doc.delayMinutes = a.delayMinutes();
        doc.notes = a.notes();
        doc.cancellationReason = a.cancellationReason();
        doc.rescheduledFromId = a.rescheduledFromId();
        doc.rescheduledToId = a.rescheduledToId();
        doc.version = a.version();
        doc.createdAt = a.createdAt();
        doc.updatedAt = a.updatedAt();
        return doc;
    }

    public Appointment toAppointment() {
        AppointmentStatus mapped = AppointmentStatus.fromLabel(status);
        if (mapped == AppointmentStatus.SCHEDULED && Boolean.TRUE.equals(checkedIn)) {
            mapped = AppointmentStatus.CHECKED_IN;
        }
        return Appointment.builder()
                .id(id)
                .doctorId(doctorId)
                .patientId(patientId)
                .scheduledAt(scheduledAt)
                .serviceDay(LocalDate.parse(serviceDay))
                .durationMinutes(durationMinutes)
                .status(mapped)
                .checkedInAt(checkedInAt)
                .actualStartTime(actualStartTime)
                .actualEndTime(actualEndTime)
                .queuePosition(queuePosition)
                .estimatedStartTime(estimatedStartTime)
                .delayMinutes(delayMinutes == null ? 0 : delayMinutes)
                .notes(notes)
                .cancellationReason(cancellationReason)
                .rescheduledFromId(rescheduledFromId)
                .rescheduledToId(rescheduledToId)
                .version(version)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDoctorId() {
        return doctorId;
    }

    public void setDoctorId(String doctorId) {
        this.doctorId = doctorId;
    }

    public String getPatientId() {
        return patientId;
    }

    public void setPatientId(String patientId) {
        this.patientId = patientId;
    }

    public Instant getScheduledAt() {
        return scheduledAt;
    }

    public void setScheduledAt(Instant scheduledAt) {
        this.scheduledAt = scheduledAt;
    }

    public String getServiceDay() {
        return serviceDay;
    }

    public void setServiceDay(String serviceDay) {
        this.serviceDay = serviceDay;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public void setDurationMinutes(int durationMinutes) {
        this.durationMinutes = durationMinutes;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Boolean getCheckedIn() {
        return checkedIn;
    }

    public void setCheckedIn(Boolean checkedIn) {
        this.checkedIn = checkedIn;
    }

    public Instant getCheckedInAt() {
        return checkedInAt;
    }

    public void setCheckedInAt(Instant checkedInAt) {
        this.checkedInAt = checkedInAt;
    }

    public Instant getActualStartTime() {
        return actualStartTime;
    }

    public void setActualStartTime(Instant actualStartTime) {
        this.actualStartTime = actualStartTime;
    }

    public Instant getActualEndTime() {
        return actualEndTime;
    }

    public void setActualEndTime(Instant actualEndTime) {
        this.actualEndTime = actualEndTime;
    }

    public Integer getQueuePosition() {
        return queuePosition;
    }

    public void setQueuePosition(Integer queuePosition) {
        this.queuePosition = queuePosition;
    }

    public Instant getEstimatedStartTime() {
        return estimatedStartTime;
    }

    public void setEstimatedStartTime(Instant estimatedStartTime) {
        this.estimatedStartTime = estimatedStartTime;
    }

    public Integer getDelayMinutes() {
        return delayMinutes;
    }

    public void setDelayMinutes(Integer delayMinutes) {
        this.delayMinutes = delayMinutes;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public void setCancellationReason(String cancellationReason) {
        this.cancellationReason = cancellationReason;
    }

    public String getRescheduledFromId() {
        return rescheduledFromId;
    }

    public void setRescheduledFromId(String rescheduledFromId) {
        this.rescheduledFromId = rescheduledFromId;
    }

    public String getRescheduledToId() {
        return rescheduledToId;
    }

    public void setRescheduledToId(String rescheduledToId) {
        this.rescheduledToId = rescheduledToId;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
