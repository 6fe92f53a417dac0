package tgp.scheduler.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import tgp.scheduler.model.ExecutionOutcome;
import tgp.scheduler.model.ExecutionReport;

/**
 * Request DTO for execution reports.
 * POST /internal/v1/jobs/{jobId}/started|complete|fail
 */
public record JobReportRequest(
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("exitCode") Integer exitCode,
        @JsonProperty("output") String output,
        @JsonProperty("error") String error) {

    public void validate() {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
    }

    public ExecutionReport toReport(String jobId, ExecutionOutcome outcome) {
        return new ExecutionReport(jobId, nodeId, outcome, exitCode, output, error);
    }
}
