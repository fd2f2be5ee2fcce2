package io.clinicqueue.changefeed;

@FunctionalInterface
public interface AppointmentChangeListener {
    void onChange(AppointmentChange change);
}
