package tgp.scheduler.model;

/**
 * Terminal failure cause recorded on a FAILED job.
 */
public enum FailureReason {
    NO_CAPACITY,
    SLA_UNREACHABLE,
    OVER_BUDGET,
    /** Node evicted and re-placement was infeasible or not allowed */
    NODE_LOST,
    /** Executor reported a failed run */
    EXECUTION_FAILED,
    /** No result report arrived within the configured window */
    RESULT_TIMEOUT,
    /** Placement pass aborted by an internal error, or the job was left pending */
    PLACEMENT_ERROR;

    public static FailureReason from(InfeasibleReason reason) {
        return switch (reason) {
            case NO_CAPACITY -> NO_CAPACITY;
            case SLA_UNREACHABLE -> SLA_UNREACHABLE;
            case OVER_BUDGET -> OVER_BUDGET;
        };
    }
}
