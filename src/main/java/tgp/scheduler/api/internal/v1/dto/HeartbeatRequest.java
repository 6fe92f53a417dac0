package tgp.scheduler.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import tgp.scheduler.model.Resources;

/**
 * Request DTO for node heartbeat. Free capacity is optional.
 * POST /internal/v1/heartbeat
 */
public record HeartbeatRequest(
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("freeCpuCores") Integer freeCpuCores,
        @JsonProperty("freeMemoryGb") Integer freeMemoryGb,
        @JsonProperty("freeGpuCount") Integer freeGpuCount) {

    public void validate() {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
        if ((freeCpuCores != null && freeCpuCores < 0)
                || (freeMemoryGb != null && freeMemoryGb < 0)
                || (freeGpuCount != null && freeGpuCount < 0)) {
            throw new IllegalArgumentException("free capacity must be non-negative");
        }
    }

    /**
     * @return reported free capacity, or null when the worker sent none
     */
    public Resources reportedFree() {
        if (freeCpuCores == null && freeMemoryGb == null && freeGpuCount == null) {
            return null;
        }
        return new Resources(
                freeCpuCores != null ? freeCpuCores : 0,
                freeMemoryGb != null ? freeMemoryGb : 0,
                freeGpuCount != null ? freeGpuCount : 0);
    }
}
