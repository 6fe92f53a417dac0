package tgp.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tgp.scheduler.model.CostBreakdown;
import tgp.scheduler.model.InfeasibleReason;
import tgp.scheduler.model.JobStatus;
import tgp.scheduler.model.PlacementDecision;
import tgp.scheduler.model.SubmissionResult;

/**
 * Response DTO for job submission: either the chosen node with its cost or
 * the reason no node qualified.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmitJobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("scheduled") boolean scheduled,
        @JsonProperty("assignedNode") String assignedNode,
        @JsonProperty("infeasibleReason") InfeasibleReason infeasibleReason,
        @JsonProperty("cost") CostBreakdown cost,
        @JsonProperty("estimatedLatencyMs") Long estimatedLatencyMs) {

    public static SubmitJobResponse from(SubmissionResult result) {
        PlacementDecision decision = result.decision();
        if (!decision.isFeasible()) {
            return new SubmitJobResponse(result.job().id(), result.job().status(), false, null,
                    decision.infeasibleReason(), null, null);
        }
        return new SubmitJobResponse(result.job().id(), result.job().status(), true, decision.nodeId(), null,
                decision.cost(), decision.estimatedLatencyMs());
    }
}
