package tgp.scheduler.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import tgp.scheduler.model.NodeSpec;
import tgp.scheduler.model.Resources;

/**
 * Request DTO for node registration.
 * POST /internal/v1/nodes/register
 */
public record RegisterNodeRequest(
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("location") String location,
        @JsonProperty("cpuCores") int cpuCores,
        @JsonProperty("memoryGb") int memoryGb,
        @JsonProperty("gpuCount") int gpuCount,
        @JsonProperty("pricePerHour") double pricePerHour,
        @JsonProperty("transferPricePerGb") Double transferPricePerGb,
        @JsonProperty("idleCostPerHour") Double idleCostPerHour,
        @JsonProperty("onPremise") boolean onPremise) {

    public void validate() {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
        if (cpuCores <= 0) {
            throw new IllegalArgumentException("cpuCores must be positive");
        }
        if (memoryGb < 0 || gpuCount < 0) {
            throw new IllegalArgumentException("memoryGb and gpuCount must be non-negative");
        }
        if (!Double.isFinite(pricePerHour) || pricePerHour < 0) {
            throw new IllegalArgumentException("pricePerHour must be a non-negative number");
        }
    }

    public NodeSpec toSpec(String fallbackHostname) {
        return new NodeSpec(
                nodeId,
                hostname != null && !hostname.isBlank() ? hostname : fallbackHostname,
                location,
                new Resources(cpuCores, memoryGb, gpuCount),
                pricePerHour,
                transferPricePerGb != null ? transferPricePerGb : 0.0,
                idleCostPerHour != null ? idleCostPerHour : 0.0,
                onPremise);
    }
}
