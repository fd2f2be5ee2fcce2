package io.clinicqueue.appointment;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One doctor's service day: the scope of a queue and of one recalculation.
 */
public record DoctorDay(String doctorId, LocalDate serviceDay) {

    public DoctorDay {
        Objects.requireNonNull(doctorId, "doctorId must not be null");
        Objects.requireNonNull(serviceDay, "serviceDay must not be null");
    }

    public static DoctorDay of(Appointment appointment) {
        return new DoctorDay(appointment.doctorId(), appointment.serviceDay());
    }

    /**
     * Serialization key shared by every job that reads or writes this queue.
     */
    public String lockKey() {
        return doctorId + "|" + serviceDay;
    }
}
