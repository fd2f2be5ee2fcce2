package io.clinicqueue.error;

/**
 * Base of every failure raised by the orchestration engine.
 *
 * <p>{@link #isRetryable()} tells the job queue whether a failed job may run again.
 */
public abstract class ClinicQueueException extends RuntimeException {

    protected ClinicQueueException(String message) {
        super(message);
    }

    protected ClinicQueueException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
