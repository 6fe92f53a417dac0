package tgp.scheduler.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable job record. The submitted fields never change; lifecycle fields are
 * replaced wholesale by the store on each transition.
 */
public final class Job {
    public static final String DEFAULT_IMAGE = "alpine:latest";

    /** Column widths of the jobs table. */
    public static final int MAX_ID_LENGTH = 128;
    public static final int MAX_ZONE_LENGTH = 128;
    public static final int MAX_IMAGE_LENGTH = 512;
    public static final int MAX_COMMAND_LENGTH = 2048;

    // submitted
    private final String id;
    private final JobType type;
    private final Resources resources;
    private final SlaConstraints sla;
    private final double estimatedDurationHours;
    private final double estimatedDataGb;
    private final String preferredZone;
    private final String image;
    private final String command;
    private final Instant submittedAt;

    // lifecycle
    private final JobStatus status;
    private final String assignedNode;
    private final CostBreakdown cost;
    private final Long estimatedLatencyMs;
    private final long reservationEpoch;
    private final int requeueCount;
    private final FailureReason failureReason;
    private final String errorMessage;
    private final Integer exitCode;
    private final String output;
    private final Instant scheduledAt;
    private final Instant startedAt;
    private final Instant endedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = builder.type != null ? builder.type : JobType.INFERENCE;
        this.resources = Objects.requireNonNull(builder.resources, "resources is required");
        this.sla = Objects.requireNonNull(builder.sla, "sla is required");
        this.estimatedDurationHours = builder.estimatedDurationHours;
        this.estimatedDataGb = builder.estimatedDataGb;
        this.preferredZone = builder.preferredZone;
        this.image = builder.image != null ? builder.image : DEFAULT_IMAGE;
        this.command = builder.command;
        this.submittedAt = builder.submittedAt;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.assignedNode = builder.assignedNode;
        this.cost = builder.cost;
        this.estimatedLatencyMs = builder.estimatedLatencyMs;
        this.reservationEpoch = builder.reservationEpoch;
        this.requeueCount = builder.requeueCount;
        this.failureReason = builder.failureReason;
        this.errorMessage = builder.errorMessage;
        this.exitCode = builder.exitCode;
        this.output = builder.output;
        this.scheduledAt = builder.scheduledAt;
        this.startedAt = builder.startedAt;
        this.endedAt = builder.endedAt;
    }

    public String id() {
        return id;
    }

    public JobType type() {
        return type;
    }

    public Resources resources() {
        return resources;
    }

    public SlaConstraints sla() {
        return sla;
    }

    public double estimatedDurationHours() {
        return estimatedDurationHours;
    }

    public double estimatedDataGb() {
        return estimatedDataGb;
    }

    public String preferredZone() {
        return preferredZone;
    }

    public String image() {
        return image;
    }

    public String command() {
        return command;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public JobStatus status() {
        return status;
    }

    public String assignedNode() {
        return assignedNode;
    }

    public CostBreakdown cost() {
        return cost;
    }

    public Long estimatedLatencyMs() {
        return estimatedLatencyMs;
    }

    public long reservationEpoch() {
        return reservationEpoch;
    }

    public int requeueCount() {
        return requeueCount;
    }

    public FailureReason failureReason() {
        return failureReason;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Integer exitCode() {
        return exitCode;
    }

    public String output() {
        return output;
    }

    public Instant scheduledAt() {
        return scheduledAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant endedAt() {
        return endedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** The reservation this job holds, if it is SCHEDULED or RUNNING. */
    public Optional<Reservation> reservation() {
        if (!status.holdsReservation() || assignedNode == null) {
            return Optional.empty();
        }
        return Optional.of(new Reservation(assignedNode, resources, reservationEpoch));
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .resources(resources)
                .sla(sla)
                .estimatedDurationHours(estimatedDurationHours)
                .estimatedDataGb(estimatedDataGb)
                .preferredZone(preferredZone)
                .image(image)
                .command(command)
                .submittedAt(submittedAt)
                .status(status)
                .assignedNode(assignedNode)
                .cost(cost)
                .estimatedLatencyMs(estimatedLatencyMs)
                .reservationEpoch(reservationEpoch)
                .requeueCount(requeueCount)
                .failureReason(failureReason)
                .errorMessage(errorMessage)
                .exitCode(exitCode)
                .output(output)
                .scheduledAt(scheduledAt)
                .startedAt(startedAt)
                .endedAt(endedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private JobType type;
        private Resources resources;
        private SlaConstraints sla;
        private double estimatedDurationHours = 1.0;
        private double estimatedDataGb;
        private String preferredZone;
        private String image;
        private String command;
        private Instant submittedAt;
        private JobStatus status = JobStatus.PENDING;
        private String assignedNode;
        private CostBreakdown cost;
        private Long estimatedLatencyMs;
        private long reservationEpoch;
        private int requeueCount;
        private FailureReason failureReason;
        private String errorMessage;
        private Integer exitCode;
        private String output;
        private Instant scheduledAt;
        private Instant startedAt;
        private Instant endedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(JobType type) {
            this.type = type;
            return this;
        }

        public Builder resources(Resources resources) {
            this.resources = resources;
            return this;
        }

        public Builder sla(SlaConstraints sla) {
            this.sla = sla;
            return this;
        }

        public Builder estimatedDurationHours(double estimatedDurationHours) {
            this.estimatedDurationHours = estimatedDurationHours;
            return this;
        }

        public Builder estimatedDataGb(double estimatedDataGb) {
            this.estimatedDataGb = estimatedDataGb;
            return this;
        }

        public Builder preferredZone(String preferredZone) {
            this.preferredZone = preferredZone;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder assignedNode(String assignedNode) {
            this.assignedNode = assignedNode;
            return this;
        }

        public Builder cost(CostBreakdown cost) {
            this.cost = cost;
            return this;
        }

        public Builder estimatedLatencyMs(Long estimatedLatencyMs) {
            this.estimatedLatencyMs = estimatedLatencyMs;
            return this;
        }

        public Builder reservationEpoch(long reservationEpoch) {
            this.reservationEpoch = reservationEpoch;
            return this;
        }

        public Builder requeueCount(int requeueCount) {
            this.requeueCount = requeueCount;
            return this;
        }

        public Builder failureReason(FailureReason failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder exitCode(Integer exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder endedAt(Instant endedAt) {
            this.endedAt = endedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', status=" + status + ", node=" + assignedNode + ", resources=" + resources + "}";
    }
}
