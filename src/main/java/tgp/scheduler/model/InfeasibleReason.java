package tgp.scheduler.model;

/**
 * Why a placement pass found no acceptable node.
 */
public enum InfeasibleReason {
    /** No active node has enough free capacity in every dimension */
    NO_CAPACITY,
    /** Nodes with capacity exist but none meets the latency bound or deadline */
    SLA_UNREACHABLE,
    /** Every SLA-compliant node costs more than the job's budget ceiling */
    OVER_BUDGET
}
