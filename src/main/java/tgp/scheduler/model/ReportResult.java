package tgp.scheduler.model;

/**
 * Result of applying an executor report to a job.
 */
public enum ReportResult {
    /** Transition applied */
    APPLIED,
    /** Job already COMPLETED or FAILED; report ignored */
    ALREADY_TERMINAL,
    /** Job does not exist */
    NOT_FOUND,
    /** Job is assigned to a different node (or to none) */
    WRONG_NODE,
    /** Report does not fit the job's current state, e.g. STARTED on a RUNNING job */
    INVALID_TRANSITION
}
