package io.clinicqueue.appointment;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum AppointmentStatus {
    SCHEDULED("Scheduled"),
    CHECKED_IN("Checked-In"),
    IN_PROGRESS("In-Progress"),
    COMPLETED("Completed"),
    CANCELLED("Cancelled"),
    NO_SHOW("No-Show"),
    RESCHEDULED("Rescheduled");

    /**
     * Statuses that hold a queue position and an estimated start time.
     */
    public static final Set<AppointmentStatus> ACTIVE =
            Collections.unmodifiableSet(EnumSet.of(SCHEDULED, CHECKED_IN, IN_PROGRESS));

    private final String label;

    AppointmentStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    /**
     * Rescheduled counts as terminal: the old record is kept for history and a new
     * appointment carries the visit.
     */
    public boolean isTerminal() {
        return !isActive();
    }

    public static AppointmentStatus fromLabel(String label) {
        return Arrays.stream(values())
                .filter(s -> s.label.equalsIgnoreCase(label) || s.name().equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown appointment status: " + label));
    }
}
