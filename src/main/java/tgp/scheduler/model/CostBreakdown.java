package tgp.scheduler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of the TCO formula: {@code total = compute + dataTransfer + idleOpportunity}.
 * Produced only by the cost engine.
 */
public record CostBreakdown(
        @JsonProperty("computeUsd") double computeUsd,
        @JsonProperty("dataTransferUsd") double dataTransferUsd,
        @JsonProperty("idleOpportunityUsd") double idleOpportunityUsd,
        @JsonProperty("totalUsd") double totalUsd) {

    public static CostBreakdown of(double compute, double dataTransfer, double idle) {
        return new CostBreakdown(compute, dataTransfer, idle, compute + dataTransfer + idle);
    }
}
