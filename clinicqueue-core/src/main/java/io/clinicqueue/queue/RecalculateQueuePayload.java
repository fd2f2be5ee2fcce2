package io.clinicqueue.queue;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clinicqueue.appointment.DoctorDay;

import java.time.LocalDate;

public record RecalculateQueuePayload(
        @JsonProperty("doctor_id") String doctorId,
        @JsonProperty("service_day") @JsonFormat(shape = JsonFormat.Shape.STRING) LocalDate serviceDay,
        @JsonProperty("start_from_position") Integer startFromPosition
) {

    public static RecalculateQueuePayload of(DoctorDay doctorDay) {
        return new RecalculateQueuePayload(doctorDay.doctorId(), doctorDay.serviceDay(), null);
    }

    @JsonIgnore
    public DoctorDay doctorDay() {
        return new DoctorDay(doctorId, serviceDay);
    }

    @JsonIgnore
    public int effectiveStartPosition() {
        return startFromPosition == null ? 1 : startFromPosition;
    }
}
