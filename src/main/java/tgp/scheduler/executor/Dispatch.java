package tgp.scheduler.executor;

import com.fasterxml.jackson.annotation.JsonProperty;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.Resources;

/**
 * Instruction for a node to run one job inside an isolated container.
 * The epoch is the node's reservation epoch when the job was placed.
 */
public record Dispatch(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("nodeId") String nodeId,
        @JsonProperty("limits") Resources limits,
        @JsonProperty("image") String image,
        @JsonProperty("command") String command,
        @JsonProperty("estimatedDurationHours") double estimatedDurationHours,
        @JsonProperty("reservationEpoch") long reservationEpoch) {

    public static Dispatch of(Job job, String nodeId, long reservationEpoch) {
        return new Dispatch(job.id(), nodeId, job.resources(), job.image(), job.command(),
                job.estimatedDurationHours(), reservationEpoch);
    }
}
