package tgp.scheduler.exception;

import tgp.scheduler.model.Resources;

/**
 * A reservation would push a node past its total capacity, or the node is no
 * longer active. State is left untouched.
 */
public class CapacityExceededException extends SchedulerException {

    private final String nodeId;
    private final Resources requested;

    public CapacityExceededException(String nodeId, Resources requested, String detail) {
        super("Cannot reserve " + requested + " on node " + nodeId + ": " + detail);
        this.nodeId = nodeId;
        this.requested = requested;
    }

    public String nodeId() {
        return nodeId;
    }

    public Resources requested() {
        return requested;
    }
}
