package tgp.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import tgp.scheduler.model.ClusterStatus;

/**
 * GET /api/v1/cluster/status
 */
public record ClusterStatusResponse(
        @JsonProperty("totalNodes") int totalNodes,
        @JsonProperty("activeNodes") int activeNodes,
        @JsonProperty("totalJobs") int totalJobs,
        @JsonProperty("runningJobs") int runningJobs) {

    public static ClusterStatusResponse from(ClusterStatus status) {
        return new ClusterStatusResponse(status.totalNodes(), status.activeNodes(), status.totalJobs(),
                status.runningJobs());
    }
}
