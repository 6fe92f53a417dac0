package tgp.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tgp.scheduler.model.Node;
import tgp.scheduler.model.NodeStatus;

import java.time.Instant;

/**
 * One entry of GET /api/v1/cluster/nodes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeResponse(
        @JsonProperty("id") String id,
        @JsonProperty("hostname") String hostname,
        @JsonProperty("location") String location,
        @JsonProperty("cpuCores") int cpuCores,
        @JsonProperty("memoryGb") int memoryGb,
        @JsonProperty("gpuCount") int gpuCount,
        @JsonProperty("reservedCpuCores") int reservedCpuCores,
        @JsonProperty("reservedMemoryGb") int reservedMemoryGb,
        @JsonProperty("reservedGpuCount") int reservedGpuCount,
        @JsonProperty("costPerHourUsd") double costPerHourUsd,
        @JsonProperty("onPremise") boolean onPremise,
        @JsonProperty("status") NodeStatus status,
        @JsonProperty("lastHeartbeat") Instant lastHeartbeat) {

    public static NodeResponse from(Node node) {
        return new NodeResponse(
                node.id(),
                node.hostname(),
                node.location(),
                node.capacity().cpuCores(),
                node.capacity().memoryGb(),
                node.capacity().gpuCount(),
                node.reserved().cpuCores(),
                node.reserved().memoryGb(),
                node.reserved().gpuCount(),
                node.pricePerHour(),
                node.onPremise(),
                node.status(),
                node.lastHeartbeat());
    }
}
