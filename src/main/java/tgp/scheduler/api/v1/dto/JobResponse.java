package tgp.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tgp.scheduler.model.CostBreakdown;
import tgp.scheduler.model.FailureReason;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.JobStatus;
import tgp.scheduler.model.JobType;
import tgp.scheduler.model.Resources;

import java.time.Instant;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("type") JobType type,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("resources") Resources resources,
        @JsonProperty("image") String image,
        @JsonProperty("assignedNode") String assignedNode,
        @JsonProperty("cost") CostBreakdown cost,
        @JsonProperty("estimatedLatencyMs") Long estimatedLatencyMs,
        @JsonProperty("requeueCount") int requeueCount,
        @JsonProperty("failureReason") FailureReason failureReason,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("exitCode") Integer exitCode,
        @JsonProperty("output") String output,
        @JsonProperty("submittedAt") Instant submittedAt,
        @JsonProperty("scheduledAt") Instant scheduledAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("endedAt") Instant endedAt) {

    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.type(),
                job.status(),
                job.resources(),
                job.image(),
                job.assignedNode(),
                job.cost(),
                job.estimatedLatencyMs(),
                job.requeueCount(),
                job.failureReason(),
                job.errorMessage(),
                job.exitCode(),
                job.output(),
                job.submittedAt(),
                job.scheduledAt(),
                job.startedAt(),
                job.endedAt());
    }
}
