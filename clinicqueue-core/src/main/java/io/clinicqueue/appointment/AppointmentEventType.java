package io.clinicqueue.appointment;

public enum AppointmentEventType {
    CREATED,
    CHECKED_IN,
    STARTED,
    COMPLETED,
    CANCELLED,
    NO_SHOW,
    RESCHEDULED
}
