package tgp.scheduler.model;

import java.util.Objects;

/**
 * Token returned by a successful reserve. The epoch ties it to the node
 * incarnation; eviction bumps the node epoch, which invalidates older tokens.
 */
public record Reservation(String nodeId, Resources resources, long epoch) {

    public Reservation {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(resources, "resources");
    }
}
