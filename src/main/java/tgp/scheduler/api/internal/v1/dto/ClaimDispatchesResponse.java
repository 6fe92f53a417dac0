package tgp.scheduler.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import tgp.scheduler.executor.Dispatch;

import java.util.List;

/**
 * Response DTO for dispatch claims.
 */
public record ClaimDispatchesResponse(
        @JsonProperty("dispatches") List<Dispatch> dispatches) {

    public static ClaimDispatchesResponse empty() {
        return new ClaimDispatchesResponse(List.of());
    }
}
