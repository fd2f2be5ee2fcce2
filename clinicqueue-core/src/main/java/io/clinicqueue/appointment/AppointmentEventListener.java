package io.clinicqueue.appointment;

@FunctionalInterface
public interface AppointmentEventListener {
    void onEvent(AppointmentEvent event);
}
