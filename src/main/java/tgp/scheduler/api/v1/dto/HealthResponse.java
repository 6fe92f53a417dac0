package tgp.scheduler.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("activeNodes") Integer activeNodes,
        @JsonProperty("totalJobs") Integer totalJobs,
        @JsonProperty("runningJobs") Integer runningJobs) {

    public static HealthResponse healthy(String uptime, String version, int activeNodes, int totalJobs,
            int runningJobs) {
        return new HealthResponse("healthy", "ok", uptime, version, activeNodes, totalJobs, runningJobs);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null);
    }
}
