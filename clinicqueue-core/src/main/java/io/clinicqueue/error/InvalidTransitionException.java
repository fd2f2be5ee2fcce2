package io.clinicqueue.error;

/**
 * Lifecycle transition not allowed from the appointment's current status.
 */
public class InvalidTransitionException extends ClinicQueueException {

    public InvalidTransitionException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
