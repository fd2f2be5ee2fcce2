package io.clinicqueue.internal.mongo;

import io.clinicqueue.appointment.DoctorDay;
import io.clinicqueue.queue.DoctorDelay;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Reported delay of one doctor's day. The id is the day's lock key.
 */
@Document(collection = DoctorDelayDocument.COLLECTION)
public class DoctorDelayDocument {

    public static final String COLLECTION = "doctor_delays";

    @Id
    private String id;

    private String doctorId;
    private String serviceDay;
    private int minutes;
    private Instant updatedAt;

    public DoctorDelayDocument() {
    }

    public DoctorDelay toDelay() {
        return new DoctorDelay(new DoctorDay(doctorId, LocalDate.parse(serviceDay)), minutes, updatedAt);
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

    public String getServiceDay() {
        return serviceDay;
    }

    public void setServiceDay(String serviceDay) {
        this.serviceDay = serviceDay;
    }

    public int getMinutes() {
        return minutes;
    }

    public void setMinutes(int minutes) {
        this.minutes = minutes;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
