package tgp.scheduler.model;

/**
 * Lifecycle state of a submitted job.
 */
public enum JobStatus {
    /** Stored, waiting for a placement pass (also re-entered after node eviction) */
    PENDING,
    /** Assigned to a node, capacity reserved, handed to the executor */
    SCHEDULED,
    /** Executor reported the job started */
    RUNNING,
    /** Executor reported success */
    COMPLETED,
    /** Infeasible, lost its node, timed out or failed on the node */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** States in which the job holds a reservation on a node. */
    public boolean holdsReservation() {
        return this == SCHEDULED || this == RUNNING;
    }
}
