package tgp.scheduler.service;

import tgp.scheduler.exception.UnknownNodeException;
import tgp.scheduler.model.ClusterStatus;
import tgp.scheduler.model.CostBreakdown;
import tgp.scheduler.model.ExecutionReport;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.JobStatus;
import tgp.scheduler.model.Node;
import tgp.scheduler.model.NodeSpec;
import tgp.scheduler.model.NodeStatus;
import tgp.scheduler.model.ReportResult;
import tgp.scheduler.model.Resources;
import tgp.scheduler.model.SubmissionResult;
import tgp.scheduler.registry.ClusterRegistry;
import tgp.scheduler.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for clients and workers: job submission and queries, cluster
 * views, node registration and heartbeats, and execution reports.
 */
public class SchedulerService {

    private static final Logger log = LoggerFactory.getLogger(SchedulerService.class);

    private final ClusterRegistry registry;
    private final JobRepository jobs;
    private final JobLifecycle lifecycle;
    private final Clock clock;

    public SchedulerService(ClusterRegistry registry, JobRepository jobs, JobLifecycle lifecycle, Clock clock) {
        this.registry = registry;
        this.jobs = jobs;
        this.lifecycle = lifecycle;
        this.clock = clock;
    }

    /**
     * Validate and submit a job. Always returns a definite outcome: scheduled
     * with its cost, or failed with the infeasible reason.
     *
     * @throws IllegalArgumentException                      on invalid fields
     * @throws tgp.scheduler.exception.DuplicateJobException if the id is taken
     */
    public SubmissionResult submit(Job job) {
        validate(job);
        Job pending = job.toBuilder()
                .status(JobStatus.PENDING)
                .submittedAt(clock.instant())
                .build();
        return lifecycle.submit(pending);
    }

    static void validate(Job job) {
        if (job.id().isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        requireMaxLength("job id", job.id(), Job.MAX_ID_LENGTH);
        requireMaxLength("preferred zone", job.preferredZone(), Job.MAX_ZONE_LENGTH);
        requireMaxLength("image", job.image(), Job.MAX_IMAGE_LENGTH);
        requireMaxLength("command", job.command(), Job.MAX_COMMAND_LENGTH);
        Resources r = job.resources();
        if (r.cpuCores() <= 0) {
            throw new IllegalArgumentException("cpu must be positive");
        }
        if (r.memoryGb() <= 0) {
            throw new IllegalArgumentException("memory must be positive");
        }
        if (job.sla().maxLatencyMs() <= 0) {
            throw new IllegalArgumentException("max latency must be positive");
        }
        if (job.sla().hasBudget()) {
            requireNonNegative("budget", job.sla().budgetUsd());
        }
        requireNonNegative("estimated duration", job.estimatedDurationHours());
        requireNonNegative("estimated data volume", job.estimatedDataGb());
    }

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be a non-negative number, got " + value);
        }
    }

    private static void requireMaxLength(String name, String value, int max) {
        if (value != null && value.length() > max) {
            throw new IllegalArgumentException(name + " is longer than " + max + " characters");
        }
    }

    public String generateJobId() {
        return "job-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public Optional<Job> getStatus(String jobId) {
        return jobs.findById(jobId);
    }

    /**
     * Empty when the job is unknown or has never been scheduled.
     */
    public Optional<CostBreakdown> getCost(String jobId) {
        return jobs.findById(jobId).map(Job::cost);
    }

    public List<Job> listJobs(int limit) {
        return jobs.findRecent(limit);
    }

    /**
     * Running jobs counts everything that currently holds capacity, so
     * SCHEDULED as well as RUNNING.
     */
    public ClusterStatus clusterStatus() {
        int running = jobs.countByStatus(JobStatus.SCHEDULED) + jobs.countByStatus(JobStatus.RUNNING);
        return new ClusterStatus(registry.size(), registry.countByStatus(NodeStatus.ACTIVE), jobs.count(),
                running);
    }

    public List<Node> listNodes() {
        return registry.snapshot().nodes();
    }

    public String registerNode(NodeSpec spec) {
        return registry.registerNode(spec);
    }

    /**
     * @return false if the node is unknown; the heartbeat is logged and dropped
     */
    public boolean heartbeat(String nodeId, Resources reportedFree) {
        try {
            registry.heartbeat(nodeId, reportedFree);
            return true;
        } catch (UnknownNodeException e) {
            log.warn("Ignoring heartbeat: {}", e.getMessage());
            return false;
        }
    }

    public ReportResult reportNodeResult(ExecutionReport report) {
        return lifecycle.report(report);
    }
}
