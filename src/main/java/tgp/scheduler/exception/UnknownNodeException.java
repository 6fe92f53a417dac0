package tgp.scheduler.exception;

/**
 * Operation referenced a node id that was never registered.
 */
public class UnknownNodeException extends SchedulerException {

    private final String nodeId;

    public UnknownNodeException(String nodeId) {
        super("Unknown node: " + nodeId);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
