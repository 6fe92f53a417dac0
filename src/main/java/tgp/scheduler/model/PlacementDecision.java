package tgp.scheduler.model;

import java.util.Objects;

/**
 * Outcome of one optimizer pass: either a chosen node with its cost, or an
 * infeasible reason.
 */
public record PlacementDecision(
        String nodeId,
        CostBreakdown cost,
        long estimatedLatencyMs,
        InfeasibleReason infeasibleReason) {

    public static PlacementDecision placed(String nodeId, CostBreakdown cost, long estimatedLatencyMs) {
        return new PlacementDecision(Objects.requireNonNull(nodeId), Objects.requireNonNull(cost),
                estimatedLatencyMs, null);
    }

    public static PlacementDecision infeasible(InfeasibleReason reason) {
        return new PlacementDecision(null, null, 0L, Objects.requireNonNull(reason));
    }

    public boolean isFeasible() {
        return infeasibleReason == null;
    }
}
