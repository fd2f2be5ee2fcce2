package io.clinicqueue.core;

public enum JobStatus {
    PENDING(false),
    RUNNING(false),
    COMPLETED(true),
    FAILED(true),
    CANCELLED(true);

    private final boolean terminal;

    JobStatus(boolean terminal) {
        this.terminal = terminal;
    }

    /**
     * Terminal jobs are never modified again.
     */
    public boolean isTerminal() {
        return terminal;
    }
}
