package tgp.scheduler.model;

import java.util.Objects;

/**
 * Message from the executor collaborator about one job on one node.
 */
public record ExecutionReport(
        String jobId,
        String nodeId,
        ExecutionOutcome outcome,
        Integer exitCode,
        String output,
        String error) {

    public ExecutionReport {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(outcome, "outcome");
    }

    public static ExecutionReport started(String jobId, String nodeId) {
        return new ExecutionReport(jobId, nodeId, ExecutionOutcome.STARTED, null, null, null);
    }

    public static ExecutionReport completed(String jobId, String nodeId, int exitCode, String output) {
        return new ExecutionReport(jobId, nodeId, ExecutionOutcome.COMPLETED, exitCode, output, null);
    }

    public static ExecutionReport failed(String jobId, String nodeId, Integer exitCode, String error) {
        return new ExecutionReport(jobId, nodeId, ExecutionOutcome.FAILED, exitCode, null, error);
    }
}
