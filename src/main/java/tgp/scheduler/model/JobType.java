package tgp.scheduler.model;

/**
 * Workload category supplied by the submitter. Informational only.
 */
public enum JobType {
    TRAINING,
    INFERENCE,
    DATA_PROCESSING
}
