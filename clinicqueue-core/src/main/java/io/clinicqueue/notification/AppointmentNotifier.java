package io.clinicqueue.notification;

import io.clinicqueue.appointment.Appointment;
import io.clinicqueue.appointment.AppointmentEvent;
import io.clinicqueue.appointment.AppointmentEventListener;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Tells the patient about a new or moved appointment. One notification per event, keyed by the
 * appointment id and event type.
 */
public class AppointmentNotifier implements AppointmentEventListener {

    private static final DateTimeFormatter WHEN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final NotificationDispatcher dispatcher;
    private final ZoneId zone;

    public AppointmentNotifier(NotificationDispatcher dispatcher, ZoneId zone) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public void onEvent(AppointmentEvent event) {
        switch (event.type()) {
            case CREATED -> {
                Appointment a = event.appointment();
                dispatcher.notify(eventKey(a, "created"), NotificationType.APPOINTMENT, a.patientId(),
                        "Appointment scheduled",
                        "Your appointment is scheduled for " + format(a) + ".",
                        NotificationPriority.NORMAL);
            }
            case RESCHEDULED -> {
                Appointment a = event.replacement();
                dispatcher.notify(eventKey(event.appointment(), "rescheduled"), NotificationType.APPOINTMENT, a.patientId(),
                        "Appointment rescheduled",
                        "Your appointment has been moved to " + format(a) + ".",
                        NotificationPriority.HIGH);
            }
            default -> {
            }
        }
    }

    private String format(Appointment appointment) {
        return WHEN.format(appointment.scheduledAt().atZone(zone));
    }

    private static String eventKey(Appointment appointment, String kind) {
        return "appointment:" + appointment.id() + ":" + kind;
    }
}
