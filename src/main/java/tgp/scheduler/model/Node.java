package tgp.scheduler.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of a registered compute node. Instances are produced by the
 * cluster registry as copies; mutating registry state never goes through this type.
 */
public final class Node {
    private final String id;
    private final String hostname;
    private final String location;
    private final Resources capacity;
    private final Resources reserved;
    private final Resources reportedFree;
    private final double pricePerHour;
    private final double transferPricePerGb;
    private final double idleCostPerHour;
    private final boolean onPremise;
    private final NodeStatus status;
    private final Instant lastHeartbeat;
    private final Instant registeredAt;
    private final long epoch;

    private Node(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.hostname = builder.hostname;
        this.location = builder.location;
        this.capacity = Objects.requireNonNull(builder.capacity, "capacity is required");
        this.reserved = builder.reserved != null ? builder.reserved : Resources.ZERO;
        this.reportedFree = builder.reportedFree;
        this.pricePerHour = builder.pricePerHour;
        this.transferPricePerGb = builder.transferPricePerGb;
        this.idleCostPerHour = builder.idleCostPerHour;
        this.onPremise = builder.onPremise;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.lastHeartbeat = builder.lastHeartbeat;
        this.registeredAt = builder.registeredAt;
        this.epoch = builder.epoch;
    }

    public String id() {
        return id;
    }

    public String hostname() {
        return hostname;
    }

    public String location() {
        return location;
    }

    public Resources capacity() {
        return capacity;
    }

    public Resources reserved() {
        return reserved;
    }

    /** Free capacity last reported by the node itself, may be null before the first heartbeat. */
    public Resources reportedFree() {
        return reportedFree;
    }

    public double pricePerHour() {
        return pricePerHour;
    }

    public double transferPricePerGb() {
        return transferPricePerGb;
    }

    public double idleCostPerHour() {
        return idleCostPerHour;
    }

    public boolean onPremise() {
        return onPremise;
    }

    public NodeStatus status() {
        return status;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public long epoch() {
        return epoch;
    }

    /** Capacity not held by any reservation. */
    public Resources free() {
        return capacity.minus(reserved);
    }

    public boolean isActive() {
        return status == NodeStatus.ACTIVE;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .hostname(hostname)
                .location(location)
                .capacity(capacity)
                .reserved(reserved)
                .reportedFree(reportedFree)
                .pricePerHour(pricePerHour)
                .transferPricePerGb(transferPricePerGb)
                .idleCostPerHour(idleCostPerHour)
                .onPremise(onPremise)
                .status(status)
                .lastHeartbeat(lastHeartbeat)
                .registeredAt(registeredAt)
                .epoch(epoch);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String hostname;
        private String location;
        private Resources capacity;
        private Resources reserved;
        private Resources reportedFree;
        private double pricePerHour;
        private double transferPricePerGb;
        private double idleCostPerHour;
        private boolean onPremise;
        private NodeStatus status = NodeStatus.ACTIVE;
        private Instant lastHeartbeat;
        private Instant registeredAt;
        private long epoch;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder capacity(Resources capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder reserved(Resources reserved) {
            this.reserved = reserved;
            return this;
        }

        public Builder reportedFree(Resources reportedFree) {
            this.reportedFree = reportedFree;
            return this;
        }

        public Builder pricePerHour(double pricePerHour) {
            this.pricePerHour = pricePerHour;
            return this;
        }

        public Builder transferPricePerGb(double transferPricePerGb) {
            this.transferPricePerGb = transferPricePerGb;
            return this;
        }

        public Builder idleCostPerHour(double idleCostPerHour) {
            this.idleCostPerHour = idleCostPerHour;
            return this;
        }

        public Builder onPremise(boolean onPremise) {
            this.onPremise = onPremise;
            return this;
        }

        public Builder status(NodeStatus status) {
            this.status = status;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Builder epoch(long epoch) {
            this.epoch = epoch;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Node node))
            return false;
        return Objects.equals(id, node.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Node{id='" + id + "', status=" + status + ", capacity=" + capacity + ", reserved=" + reserved
                + ", price=" + pricePerHour + "}";
    }
}
