package tgp.scheduler.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for node registration. Tells the worker how often it must
 * heartbeat to stay active.
 */
public record RegisterNodeResponse(
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("heartbeatTimeoutSec") long heartbeatTimeoutSec) {
}
