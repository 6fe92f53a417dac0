package tgp.scheduler.service;

import tgp.scheduler.config.SchedulerConfig;
import tgp.scheduler.exception.CapacityExceededException;
import tgp.scheduler.executor.Dispatch;
import tgp.scheduler.executor.JobExecutor;
import tgp.scheduler.model.Assignment;
import tgp.scheduler.model.ClusterSnapshot;
import tgp.scheduler.model.ExecutionOutcome;
import tgp.scheduler.model.ExecutionReport;
import tgp.scheduler.model.FailureReason;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.JobStatus;
import tgp.scheduler.model.InfeasibleReason;
import tgp.scheduler.model.PlacementDecision;
import tgp.scheduler.model.ReportResult;
import tgp.scheduler.model.Reservation;
import tgp.scheduler.model.SubmissionResult;
import tgp.scheduler.optimizer.Optimizer;
import tgp.scheduler.registry.ClusterRegistry;
import tgp.scheduler.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Job state machine:
 *
 * <pre>
 * PENDING -> SCHEDULED -> RUNNING -> COMPLETED | FAILED
 *              |            |
 *              +------------+--> PENDING   (assigned node evicted)
 * </pre>
 *
 * Every transition is a compare-and-set in the {@link JobRepository}; the
 * caller that wins a transition into a terminal state is the one that gives
 * the reservation back to the {@link ClusterRegistry}.
 */
public class JobLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobLifecycle.class);

    private final JobRepository jobs;
    private final ClusterRegistry registry;
    private final Optimizer optimizer;
    private final JobExecutor executor;
    private final int placementAttempts;
    private final int maxRequeues;
    private final Clock clock;

    public JobLifecycle(JobRepository jobs, ClusterRegistry registry, Optimizer optimizer, JobExecutor executor,
            SchedulerConfig config, Clock clock) {
        this.jobs = jobs;
        this.registry = registry;
        this.optimizer = optimizer;
        this.executor = executor;
        this.placementAttempts = Math.max(1, config.placementRetries());
        this.maxRequeues = config.maxRequeues();
        this.clock = clock;
    }

    /**
     * Store a validated job as PENDING and try to place it once. A job that
     * cannot be placed is stored as FAILED with the infeasible reason; one
     * whose placement pass throws is stored as FAILED with PLACEMENT_ERROR
     * before the exception propagates.
     */
    public SubmissionResult submit(Job job) {
        jobs.save(job);
        log.info("Job {} submitted ({}, sla {}ms / budget {})", job.id(), job.resources(),
                job.sla().maxLatencyMs(), job.sla().hasBudget() ? "$" + job.sla().budgetUsd() : "none");

        PlacementDecision decision;
        try {
            decision = place(job);
        } catch (RuntimeException e) {
            failAfterPlacementError(job.id(), e);
            throw e;
        }
        if (!decision.isFeasible()) {
            jobs.failPending(job.id(), FailureReason.from(decision.infeasibleReason()),
                    "infeasible: " + decision.infeasibleReason(), clock.instant());
            log.info("Job {} is infeasible: {}", job.id(), decision.infeasibleReason());
        }

        Job stored = jobs.findById(job.id())
                .orElseThrow(() -> new IllegalStateException("job vanished after submit: " + job.id()));
        if (decision.isFeasible() && stored.assignedNode() != null
                && !stored.assignedNode().equals(decision.nodeId())) {
            // re-placed after its first node was evicted mid-placement
            decision = PlacementDecision.placed(stored.assignedNode(), stored.cost(), stored.estimatedLatencyMs());
        }
        return new SubmissionResult(stored, decision);
    }

    private void failAfterPlacementError(String jobId, RuntimeException cause) {
        try {
            if (jobs.failPending(jobId, FailureReason.PLACEMENT_ERROR, "placement failed: " + cause.getMessage(),
                    clock.instant())) {
                log.error("Job {} failed during placement", jobId, cause);
            }
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Job {}: could not record placement failure, left for the pending sweep", jobId, e);
        }
    }

    /**
     * One placement pass for a PENDING job: snapshot, optimize, reserve. A lost
     * reservation race retries against a fresh snapshot, up to the configured
     * number of attempts. On success the job is SCHEDULED and dispatched; on
     * failure it is left PENDING. A node evicted between the reservation and
     * the SCHEDULED write sends the job back to PENDING for another attempt.
     */
    PlacementDecision place(Job job) {
        for (int attempt = 1; attempt <= placementAttempts; attempt++) {
            ClusterSnapshot snapshot = registry.snapshot();
            PlacementDecision decision = optimizer.place(job, snapshot);
            if (!decision.isFeasible()) {
                return decision;
            }

            Reservation reservation;
            try {
                reservation = registry.reserve(decision.nodeId(), job.resources());
            } catch (CapacityExceededException e) {
                log.debug("Job {}: attempt {}/{} lost reservation race: {}", job.id(), attempt,
                        placementAttempts, e.getMessage());
                continue;
            }

            Assignment assignment = new Assignment(job.id(), decision.nodeId(), decision.cost(),
                    decision.estimatedLatencyMs(), reservation.epoch(), clock.instant());
            boolean scheduled;
            try {
                scheduled = jobs.markScheduled(assignment);
            } catch (RuntimeException e) {
                registry.release(reservation);
                throw e;
            }
            if (!scheduled) {
                registry.release(reservation);
                throw new IllegalStateException("job " + job.id() + " left PENDING during placement");
            }

            if (!registry.isCurrent(reservation)) {
                if (!jobs.requeue(job.id(), decision.nodeId(), clock.instant())) {
                    // the eviction sweep already took the job back
                    log.info("Job {}: node {} was evicted during placement, requeued by the eviction sweep",
                            job.id(), decision.nodeId());
                    return decision;
                }
                job = jobs.findById(job.id()).orElseThrow();
                if (job.requeueCount() > maxRequeues) {
                    jobs.failPending(job.id(), FailureReason.NODE_LOST, "node " + decision.nodeId()
                            + " evicted during placement, requeue limit " + maxRequeues + " reached", clock.instant());
                    log.warn("Job {} failed: node {} evicted during placement and requeue limit reached",
                            job.id(), decision.nodeId());
                    return PlacementDecision.infeasible(InfeasibleReason.NO_CAPACITY);
                }
                log.info("Job {}: node {} was evicted during placement, retrying", job.id(), decision.nodeId());
                continue;
            }

            log.info("Job {} scheduled on node {} (total ${}, est. {}ms)", job.id(), decision.nodeId(),
                    decision.cost().totalUsd(), decision.estimatedLatencyMs());
            executor.dispatch(Dispatch.of(job, decision.nodeId(), reservation.epoch()));
            return decision;
        }

        log.warn("Job {}: gave up after {} reservation attempts", job.id(), placementAttempts);
        return PlacementDecision.infeasible(InfeasibleReason.NO_CAPACITY);
    }

    /**
     * Apply an outcome message from the executor.
     */
    public ReportResult report(ExecutionReport report) {
        Optional<Job> current = jobs.findById(report.jobId());
        if (current.isEmpty()) {
            log.warn("Report {} for unknown job {} from node {}", report.outcome(), report.jobId(),
                    report.nodeId());
            return ReportResult.NOT_FOUND;
        }
        Job job = current.get();
        ReportResult precheck = precheck(job, report);
        if (precheck != null) {
            return precheck;
        }

        Instant now = clock.instant();
        boolean won = switch (report.outcome()) {
            case STARTED -> jobs.markRunning(job.id(), report.nodeId(), now);
            case COMPLETED -> jobs.markCompleted(job.id(), report.nodeId(), report.exitCode(), report.output(), now);
            case FAILED -> jobs.markFailed(job.id(), report.nodeId(), FailureReason.EXECUTION_FAILED,
                    report.exitCode(), report.error(), now);
        };

        if (!won) {
            // someone else moved the job first; classify against the fresh row
            Job latest = jobs.findById(job.id()).orElse(job);
            ReportResult result = precheck(latest, report);
            if (result == null && report.outcome() == ExecutionOutcome.STARTED
                    && latest.status() == JobStatus.RUNNING) {
                return ReportResult.APPLIED; // duplicate STARTED
            }
            return result != null ? result : ReportResult.INVALID_TRANSITION;
        }

        switch (report.outcome()) {
            case STARTED -> log.info("Job {} running on node {}", job.id(), report.nodeId());
            case COMPLETED -> {
                log.info("Job {} completed on node {} (exit {})", job.id(), report.nodeId(), report.exitCode());
                releaseAfterTerminal(job.id());
            }
            case FAILED -> {
                log.info("Job {} failed on node {}: {}", job.id(), report.nodeId(), report.error());
                releaseAfterTerminal(job.id());
            }
        }
        return ReportResult.APPLIED;
    }

    private static ReportResult precheck(Job job, ExecutionReport report) {
        if (job.isTerminal()) {
            log.debug("Job {} already {} (ignoring {})", job.id(), job.status(), report.outcome());
            return ReportResult.ALREADY_TERMINAL;
        }
        if (job.status() == JobStatus.PENDING) {
            log.warn("Report {} for job {} which is not assigned", report.outcome(), job.id());
            return ReportResult.INVALID_TRANSITION;
        }
        if (!report.nodeId().equals(job.assignedNode())) {
            log.warn("Node {} reported {} for job {} assigned to {}", report.nodeId(), report.outcome(), job.id(),
                    job.assignedNode());
            return ReportResult.WRONG_NODE;
        }
        return null;
    }

    /**
     * Requeue every SCHEDULED or RUNNING job on the evicted nodes. Each job
     * is placed again unless it already used up its requeues, in which case
     * (or if the new placement is infeasible) it fails with NODE_LOST. The
     * nodes' reservations were already revoked by the eviction itself.
     * A job that cannot be handled is logged and skipped; the other jobs are
     * still requeued.
     */
    public void onNodesEvicted(List<String> nodeIds) {
        for (String nodeId : nodeIds) {
            executor.cancelAll(nodeId);
            List<Job> active;
            try {
                active = jobs.findActiveOnNode(nodeId);
            } catch (RuntimeException e) {
                log.error("Could not list jobs on evicted node {}", nodeId, e);
                continue;
            }
            for (Job job : active) {
                try {
                    requeueFromEvictedNode(job, nodeId);
                } catch (RuntimeException e) {
                    log.error("Job {}: requeue from evicted node {} failed", job.id(), nodeId, e);
                    failStranded(job.id(), nodeId);
                }
            }
        }
    }

    /**
     * A job whose requeue broke halfway may sit PENDING with nobody placing
     * it. Fail it now if possible, otherwise the pending sweep will.
     */
    private void failStranded(String jobId, String nodeId) {
        try {
            jobs.failPending(jobId, FailureReason.NODE_LOST, "node " + nodeId + " lost, requeue failed",
                    clock.instant());
        } catch (RuntimeException e) {
            log.error("Job {}: could not fail after requeue error", jobId, e);
        }
    }

    private void requeueFromEvictedNode(Job job, String nodeId) {
        if (!jobs.requeue(job.id(), nodeId, clock.instant())) {
            log.debug("Job {} moved on before requeue from node {}", job.id(), nodeId);
            return;
        }
        Job pending = jobs.findById(job.id()).orElseThrow();
        Instant now = clock.instant();

        if (pending.requeueCount() > maxRequeues) {
            jobs.failPending(job.id(), FailureReason.NODE_LOST,
                    "node " + nodeId + " lost, requeue limit " + maxRequeues + " reached", now);
            log.warn("Job {} failed: node {} lost and requeue limit reached", job.id(), nodeId);
            return;
        }

        log.info("Job {} requeued after node {} was evicted (requeue {}/{})", job.id(), nodeId,
                pending.requeueCount(), maxRequeues);
        PlacementDecision decision = place(pending);
        if (!decision.isFeasible()) {
            jobs.failPending(job.id(), FailureReason.NODE_LOST,
                    "node " + nodeId + " lost, re-placement infeasible: " + decision.infeasibleReason(), now);
            log.warn("Job {} failed: node {} lost and no alternative ({})", job.id(), nodeId,
                    decision.infeasibleReason());
        }
    }

    /**
     * Fail SCHEDULED or RUNNING jobs with no result within {@code timeout}
     * of being scheduled.
     *
     * @return number of jobs failed
     */
    public int failOverdue(Duration timeout) {
        Instant now = clock.instant();
        int failed = 0;
        for (Job job : jobs.findScheduledBefore(now.minus(timeout))) {
            boolean won = jobs.markFailed(job.id(), job.assignedNode(), FailureReason.RESULT_TIMEOUT, null,
                    "no result within " + timeout, now);
            if (won) {
                log.warn("Job {} on node {} timed out waiting for a result", job.id(), job.assignedNode());
                releaseAfterTerminal(job.id());
                failed++;
            }
        }
        return failed;
    }

    /**
     * Fail jobs that have been PENDING for longer than {@code olderThan}. Only
     * jobs whose placement broke off half-way stay PENDING that long.
     *
     * @return number of jobs failed
     */
    public int failStalePending(Duration olderThan) {
        Instant now = clock.instant();
        int failed = 0;
        for (Job job : jobs.findPendingBefore(now.minus(olderThan))) {
            FailureReason reason = job.requeueCount() > 0 ? FailureReason.NODE_LOST : FailureReason.PLACEMENT_ERROR;
            if (jobs.failPending(job.id(), reason, "still pending after " + olderThan, now)) {
                log.warn("Job {} failed: still pending after {} ({})", job.id(), olderThan, reason);
                failed++;
            }
        }
        return failed;
    }

    /**
     * The row is terminal and frozen once our CAS won, so its node and epoch
     * are exactly the reservation to give back.
     */
    private void releaseAfterTerminal(String jobId) {
        Job done = jobs.findById(jobId).orElseThrow();
        if (done.assignedNode() == null) {
            return;
        }
        Reservation reservation = new Reservation(done.assignedNode(), done.resources(), done.reservationEpoch());
        if (!registry.release(reservation)) {
            log.debug("Job {}: reservation on node {} was already revoked", jobId, done.assignedNode());
        }
    }
}
