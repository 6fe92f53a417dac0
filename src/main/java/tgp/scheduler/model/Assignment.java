package tgp.scheduler.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Binding of a job to a node, with the cost and latency computed at decision time.
 */
public record Assignment(
        String jobId,
        String nodeId,
        CostBreakdown cost,
        long estimatedLatencyMs,
        long reservationEpoch,
        Instant assignedAt) {

    public Assignment {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(cost, "cost");
    }
}
