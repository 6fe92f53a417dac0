package tgp.scheduler.registry;

import tgp.scheduler.exception.CapacityExceededException;
import tgp.scheduler.exception.UnknownNodeException;
import tgp.scheduler.model.ClusterSnapshot;
import tgp.scheduler.model.Node;
import tgp.scheduler.model.NodeSpec;
import tgp.scheduler.model.NodeStatus;
import tgp.scheduler.model.Reservation;
import tgp.scheduler.model.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative in-memory set of nodes: declared capacity, reserved capacity,
 * pricing, heartbeat age and liveness.
 *
 * <p>
 * Every mutation of a node happens while holding that node's entry monitor,
 * so two concurrent reservations on the same node cannot both pass the
 * capacity check, and a snapshot never sees a half-applied update. Callers
 * only ever receive immutable {@link Node} copies.
 */
public class ClusterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ClusterRegistry.class);

    private final ConcurrentHashMap<String, NodeEntry> nodes = new ConcurrentHashMap<>();
    private final Clock clock;

    public ClusterRegistry() {
        this(Clock.systemUTC());
    }

    public ClusterRegistry(Clock clock) {
        this.clock = clock;
    }

    /** Mutable per-node state, guarded by the entry itself. */
    private static final class NodeEntry {
        final String id;
        final Instant registeredAt;
        NodeSpec spec;
        Resources reserved = Resources.ZERO;
        Resources reportedFree;
        NodeStatus status = NodeStatus.ACTIVE;
        Instant lastHeartbeat;
        long epoch;

        NodeEntry(String id, Instant registeredAt) {
            this.id = id;
            this.registeredAt = registeredAt;
        }

        Node toNode() {
            return Node.builder()
                    .id(id)
                    .hostname(spec.hostname())
                    .location(spec.location())
                    .capacity(spec.capacity())
                    .reserved(reserved)
                    .reportedFree(reportedFree)
                    .pricePerHour(spec.pricePerHour())
                    .transferPricePerGb(spec.transferPricePerGb())
                    .idleCostPerHour(spec.idleCostPerHour())
                    .onPremise(spec.onPremise())
                    .status(status)
                    .lastHeartbeat(lastHeartbeat)
                    .registeredAt(registeredAt)
                    .epoch(epoch)
                    .build();
        }
    }

    /**
     * Register a node or refresh its attributes. Idempotent by node id: current
     * reservations are kept, and the node counts as having just sent a heartbeat.
     *
     * @return the node id
     * @throws IllegalArgumentException if the spec is invalid or the new
     *                                  capacity is below what is already reserved
     */
    public String registerNode(NodeSpec spec) {
        spec.validate();
        Instant now = clock.instant();
        NodeEntry entry = nodes.computeIfAbsent(spec.id(), id -> new NodeEntry(id, now));

        synchronized (entry) {
            boolean first = entry.spec == null;
            if (!first && !spec.capacity().fits(entry.reserved)) {
                throw new IllegalArgumentException("capacity " + spec.capacity()
                        + " is below reserved " + entry.reserved + " on node " + spec.id());
            }
            NodeStatus previous = entry.status;
            entry.spec = spec;
            entry.lastHeartbeat = now;
            entry.status = NodeStatus.ACTIVE;

            if (first) {
                log.info("Registered node {} at {} ({}, ${}/h, {})", spec.id(), spec.location(),
                        spec.capacity(), spec.pricePerHour(), spec.onPremise() ? "on-prem" : "elastic");
            } else {
                log.info("Re-registered node {} (was {}, reserved {})", spec.id(), previous, entry.reserved);
            }
        }
        return spec.id();
    }

    /**
     * Record a heartbeat. A suspected or evicted node becomes active again.
     *
     * @param reportedFree free capacity as seen by the node, may be null
     * @throws UnknownNodeException if the node was never registered
     */
    public void heartbeat(String nodeId, Resources reportedFree) {
        NodeEntry entry = entry(nodeId);
        synchronized (entry) {
            entry.lastHeartbeat = clock.instant();
            if (reportedFree != null) {
                entry.reportedFree = reportedFree;
            }
            if (entry.status != NodeStatus.ACTIVE) {
                log.info("Node {} is back ({} -> ACTIVE)", nodeId, entry.status);
                entry.status = NodeStatus.ACTIVE;
            }
        }
        log.debug("Heartbeat from node {} (reported free {})", nodeId, reportedFree);
    }

    /**
     * Consistent copy of every node for the optimizer.
     */
    public ClusterSnapshot snapshot() {
        List<Node> copy = new ArrayList<>(nodes.size());
        for (NodeEntry entry : nodes.values()) {
            synchronized (entry) {
                if (entry.spec != null) {
                    copy.add(entry.toNode());
                }
            }
        }
        return new ClusterSnapshot(copy, clock.instant());
    }

    public Optional<Node> find(String nodeId) {
        NodeEntry entry = nodes.get(nodeId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return entry.spec == null ? Optional.empty() : Optional.of(entry.toNode());
        }
    }

    /**
     * Atomically add {@code request} to the node's reserved capacity.
     *
     * @return token to hand back to {@link #release(Reservation)}
     * @throws CapacityExceededException if the node is not active or any
     *                                   dimension would exceed total capacity
     * @throws UnknownNodeException      if the node was never registered
     */
    public Reservation reserve(String nodeId, Resources request) {
        NodeEntry entry = entry(nodeId);
        synchronized (entry) {
            if (entry.status != NodeStatus.ACTIVE) {
                throw new CapacityExceededException(nodeId, request, "node is " + entry.status);
            }
            Resources free = entry.spec.capacity().minus(entry.reserved);
            if (!free.fits(request)) {
                throw new CapacityExceededException(nodeId, request, "free " + free);
            }
            entry.reserved = entry.reserved.plus(request);
            log.debug("Reserved {} on node {} (now {})", request, nodeId, entry.reserved);
            return new Reservation(nodeId, request, entry.epoch);
        }
    }

    /**
     * Give back a reservation.
     *
     * @return true if capacity was restored, false if the reservation had
     *         already been revoked by eviction
     * @throws UnknownNodeException  if the node was never registered
     * @throws IllegalStateException if the release would drive reserved
     *                               capacity below zero
     */
    public boolean release(Reservation reservation) {
        NodeEntry entry = entry(reservation.nodeId());
        synchronized (entry) {
            if (reservation.epoch() != entry.epoch) {
                log.debug("Reservation {} on node {} was revoked at eviction (epoch {} -> {})",
                        reservation.resources(), reservation.nodeId(), reservation.epoch(), entry.epoch);
                return false;
            }
            if (!entry.reserved.fits(reservation.resources())) {
                log.error("Release of {} on node {} exceeds reserved {}", reservation.resources(),
                        reservation.nodeId(), entry.reserved);
                throw new IllegalStateException("release of " + reservation.resources() + " on node "
                        + reservation.nodeId() + " exceeds reserved " + entry.reserved);
            }
            entry.reserved = entry.reserved.minus(reservation.resources());
            log.debug("Released {} on node {} (now {})", reservation.resources(), reservation.nodeId(),
                    entry.reserved);
            return true;
        }
    }

    /**
     * @return false once the node has been evicted since the reservation was
     *         taken
     * @throws UnknownNodeException if the node was never registered
     */
    public boolean isCurrent(Reservation reservation) {
        NodeEntry entry = entry(reservation.nodeId());
        synchronized (entry) {
            return reservation.epoch() == entry.epoch;
        }
    }

    /**
     * Mark active nodes whose heartbeat is older than {@code after} as SUSPECTED.
     *
     * @return ids of nodes newly suspected
     */
    public List<String> markSuspected(Duration after) {
        Instant cutoff = clock.instant().minus(after);
        List<String> suspected = new ArrayList<>();
        for (NodeEntry entry : nodes.values()) {
            synchronized (entry) {
                if (entry.status == NodeStatus.ACTIVE && isOlder(entry, cutoff)) {
                    entry.status = NodeStatus.SUSPECTED;
                    suspected.add(entry.id);
                }
            }
        }
        if (!suspected.isEmpty()) {
            log.warn("Suspected nodes (no heartbeat for {}): {}", after, suspected);
        }
        return suspected;
    }

    /**
     * Evict nodes whose heartbeat is older than {@code timeout}: mark them
     * EVICTED, drop all their reservations and bump their epoch so outstanding
     * reservation tokens become stale.
     *
     * @return ids of nodes evicted by this call
     */
    public List<String> evictStale(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        List<String> evicted = new ArrayList<>();
        for (NodeEntry entry : nodes.values()) {
            synchronized (entry) {
                if (entry.status != NodeStatus.EVICTED && isOlder(entry, cutoff)) {
                    log.warn("Evicting node {} (last heartbeat {}, revoking {})", entry.id, entry.lastHeartbeat,
                            entry.reserved);
                    entry.status = NodeStatus.EVICTED;
                    entry.reserved = Resources.ZERO;
                    entry.epoch++;
                    evicted.add(entry.id);
                }
            }
        }
        evicted.sort(Comparator.naturalOrder());
        return evicted;
    }

    public int size() {
        return nodes.size();
    }

    public int countByStatus(NodeStatus status) {
        int count = 0;
        for (NodeEntry entry : nodes.values()) {
            synchronized (entry) {
                if (entry.spec != null && entry.status == status) {
                    count++;
                }
            }
        }
        return count;
    }

    private NodeEntry entry(String nodeId) {
        NodeEntry entry = nodeId == null ? null : nodes.get(nodeId);
        if (entry == null) {
            throw new UnknownNodeException(nodeId);
        }
        return entry;
    }

    private static boolean isOlder(NodeEntry entry, Instant cutoff) {
        return entry.lastHeartbeat != null && entry.lastHeartbeat.isBefore(cutoff);
    }
}
