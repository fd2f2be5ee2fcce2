package io.clinicqueue.core;

/**
 * Named job priorities. Lower values are more urgent; raw values must stay within
 * {@link #MOST_URGENT}..{@link #LEAST_URGENT}.
 */
public enum Priority {

    CRITICAL(1),
    HIGH(2),
    MEDIUM(3),
    NORMAL(5),
    LOW(8);

    public static final int MOST_URGENT = 1;
    public static final int LEAST_URGENT = 10;

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static int checkRange(int priority) {
        if (priority < MOST_URGENT || priority > LEAST_URGENT) {
            throw new IllegalArgumentException(
                    "priority must be between " + MOST_URGENT + " and " + LEAST_URGENT + ": " + priority);
        }
        return priority;
    }
}
