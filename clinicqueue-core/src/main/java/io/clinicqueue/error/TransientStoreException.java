package io.clinicqueue.error;

/**
 * Read, write or timeout failure against the data store.
 */
public class TransientStoreException extends ClinicQueueException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
