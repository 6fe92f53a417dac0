package tgp.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.JobType;
import tgp.scheduler.model.Resources;
import tgp.scheduler.model.SlaConstraints;

import java.time.Instant;

/**
 * Request DTO for submitting a job.
 * POST /api/v1/jobs
 */
public record SubmitJobRequest(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("type") JobType type,
        @JsonProperty("cpu") Integer cpu,
        @JsonProperty("memoryGb") Integer memoryGb,
        @JsonProperty("gpuCount") Integer gpuCount,
        @JsonProperty("budgetUsd") Double budgetUsd,
        @JsonProperty("maxLatencyMs") Long maxLatencyMs,
        @JsonProperty("deadline") Instant deadline,
        @JsonProperty("estimatedDurationHours") Double estimatedDurationHours,
        @JsonProperty("estimatedDataGb") Double estimatedDataGb,
        @JsonProperty("preferredZone") String preferredZone,
        @JsonProperty("image") String image,
        @JsonProperty("command") String command) {

    public void validate() {
        if (jobId != null && jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank when given");
        }
        requireMaxLength("jobId", jobId, Job.MAX_ID_LENGTH);
        requireMaxLength("preferredZone", preferredZone, Job.MAX_ZONE_LENGTH);
        requireMaxLength("image", image, Job.MAX_IMAGE_LENGTH);
        requireMaxLength("command", command, Job.MAX_COMMAND_LENGTH);
        if (cpu == null || cpu <= 0) {
            throw new IllegalArgumentException("cpu must be positive");
        }
        if (memoryGb == null || memoryGb <= 0) {
            throw new IllegalArgumentException("memoryGb must be positive");
        }
        if (gpuCount != null && gpuCount < 0) {
            throw new IllegalArgumentException("gpuCount must be non-negative");
        }
        if (maxLatencyMs == null || maxLatencyMs <= 0) {
            throw new IllegalArgumentException("maxLatencyMs must be positive");
        }
        if (budgetUsd != null && (!Double.isFinite(budgetUsd) || budgetUsd < 0)) {
            throw new IllegalArgumentException("budgetUsd must be a non-negative number");
        }
        if (estimatedDurationHours != null
                && (!Double.isFinite(estimatedDurationHours) || estimatedDurationHours < 0)) {
            throw new IllegalArgumentException("estimatedDurationHours must be a non-negative number");
        }
        if (estimatedDataGb != null && (!Double.isFinite(estimatedDataGb) || estimatedDataGb < 0)) {
            throw new IllegalArgumentException("estimatedDataGb must be a non-negative number");
        }
    }

    private static void requireMaxLength(String name, String value, int max) {
        if (value != null && value.length() > max) {
            throw new IllegalArgumentException(name + " is longer than " + max + " characters");
        }
    }

    /**
     * @param id job id to use when the request carries none
     */
    public Job toJob(String id) {
        Job.Builder builder = Job.builder()
                .id(jobId != null ? jobId : id)
                .type(type)
                .resources(new Resources(cpu, memoryGb, gpuCount != null ? gpuCount : 0))
                .sla(new SlaConstraints(maxLatencyMs, budgetUsd, deadline))
                .estimatedDataGb(estimatedDataGb != null ? estimatedDataGb : 0.0)
                .preferredZone(preferredZone)
                .image(image != null && !image.isBlank() ? image : null)
                .command(command);
        if (estimatedDurationHours != null) {
            builder.estimatedDurationHours(estimatedDurationHours);
        }
        return builder.build();
    }
}
