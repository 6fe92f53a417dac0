package tgp.scheduler.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time copy of every node, ordered by node id.
 */
public record ClusterSnapshot(List<Node> nodes, Instant takenAt) {

    public ClusterSnapshot {
        nodes = nodes.stream()
                .sorted(Comparator.comparing(Node::id))
                .toList();
    }

    public Optional<Node> node(String nodeId) {
        return nodes.stream().filter(n -> n.id().equals(nodeId)).findFirst();
    }

    public List<Node> activeNodes() {
        return nodes.stream().filter(Node::isActive).toList();
    }

    public int size() {
        return nodes.size();
    }
}
