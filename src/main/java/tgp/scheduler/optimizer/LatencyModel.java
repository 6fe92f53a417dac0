package tgp.scheduler.optimizer;

import tgp.scheduler.model.Job;
import tgp.scheduler.model.Node;

/**
 * Estimates the service latency a job would see on a given node. Used by the
 * optimizer to drop candidates that cannot meet the job's latency bound.
 */
@FunctionalInterface
public interface LatencyModel {

    /**
     * @param job  the job being placed
     * @param node snapshot of the candidate node, before the job's reservation
     * @return estimated latency in milliseconds, never negative
     */
    long estimateLatencyMs(Job job, Node node);
}
