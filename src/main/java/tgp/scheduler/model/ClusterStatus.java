package tgp.scheduler.model;

/**
 * Cluster-wide counters.
 */
public record ClusterStatus(int totalNodes, int activeNodes, int totalJobs, int runningJobs) {
}
