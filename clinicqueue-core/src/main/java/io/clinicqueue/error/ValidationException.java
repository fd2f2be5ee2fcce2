package io.clinicqueue.error;

/**
 * Missing or invalid identifiers, or a scheduling conflict.
 */
public class ValidationException extends ClinicQueueException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
