package tgp.scheduler.model;

/**
 * Liveness of a registered node.
 */
public enum NodeStatus {
    /** Heartbeats arriving on time; eligible for placement */
    ACTIVE,
    /** Heartbeat late but not yet past the eviction timeout; not eligible for placement */
    SUSPECTED,
    /** Heartbeat timed out; reservations revoked */
    EVICTED
}
