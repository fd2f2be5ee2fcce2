package io.clinicqueue.core;

public enum JobType {
    RECALCULATE_QUEUE,
    SEND_NOTIFICATION,
    NO_SHOW_SWEEP
}
