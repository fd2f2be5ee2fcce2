package io.clinicqueue.error;

public class LockContentionTimeoutException extends ClinicQueueException {

    private final String lockKey;

    public LockContentionTimeoutException(String lockKey, String message) {
        super(message);
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
