package tgp.scheduler.model;

/**
 * Outcome messages an executor may post for a dispatched job.
 */
public enum ExecutionOutcome {
    STARTED,
    COMPLETED,
    FAILED
}
