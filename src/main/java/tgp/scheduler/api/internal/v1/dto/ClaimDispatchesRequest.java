package tgp.scheduler.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for pulling dispatched jobs.
 * POST /internal/v1/dispatches/claim
 */
public record ClaimDispatchesRequest(
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("maxJobs") int maxJobs) {

    public static final int MAX_PER_CLAIM = 10;

    public void validate() {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
        if (maxJobs <= 0 || maxJobs > MAX_PER_CLAIM) {
            throw new IllegalArgumentException("maxJobs must be between 1 and " + MAX_PER_CLAIM);
        }
    }
}
