package io.clinicqueue.core;

/**
 * Result of canceling jobs.
 *
 * matched   : number of jobs matched by the query, whatever their status
 * cancelled : number of pending jobs moved to CANCELLED
 */
public record CancelResult(
        long matched,
        long cancelled
) {

    public static CancelResult empty() {
        return new CancelResult(0, 0);
    }

    public boolean hasEffect() {
        return cancelled > 0;
    }
}
