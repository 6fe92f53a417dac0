package tgp.scheduler.service;

import tgp.scheduler.MutableClock;
import tgp.scheduler.SchedulerFixture;
import tgp.scheduler.config.SchedulerConfig;
import tgp.scheduler.cost.CostEngine;
import tgp.scheduler.exception.CapacityExceededException;
import tgp.scheduler.exception.InvalidCostInputException;
import tgp.scheduler.exception.JobStoreException;
import tgp.scheduler.executor.Dispatch;
import tgp.scheduler.model.Assignment;
import tgp.scheduler.model.ExecutionReport;
import tgp.scheduler.model.FailureReason;
import tgp.scheduler.model.InfeasibleReason;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.JobStatus;
import tgp.scheduler.model.ReportResult;
import tgp.scheduler.model.Reservation;
import tgp.scheduler.model.Resources;
import tgp.scheduler.model.SubmissionResult;
import tgp.scheduler.optimizer.LoadScaledLatencyModel;
import tgp.scheduler.optimizer.Optimizer;
import tgp.scheduler.registry.ClusterRegistry;
import tgp.scheduler.store.Database;
import tgp.scheduler.store.JdbcJobRepository;
import org.junit.jupiter.api.*;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobLifecycleTest {

    private SchedulerFixture f;

    @BeforeEach
    void setUp() {
        f = new SchedulerFixture();
    }

    @AfterEach
    void tearDown() {
        if (f != null) {
            f.close();
        }
    }

    private Resources reserved(String nodeId) {
        return f.registry.find(nodeId).orElseThrow().reserved();
    }

    @Test
    @DisplayName("Submission reserves capacity, stores the assignment and dispatches")
    void submitSchedulesAndDispatches() {
        f.node("n1", 4, 16, 0.10);

        SubmissionResult result = f.service.submit(SchedulerFixture.job("job-1", 1, 1));

        assertTrue(result.isScheduled());
        assertEquals(JobStatus.SCHEDULED, result.job().status());
        assertEquals("n1", result.job().assignedNode());
        assertEquals(Resources.of(1, 1, 0), reserved("n1"));

        List<Dispatch> dispatches = f.executor.claim("n1", 10);
        assertEquals(1, dispatches.size());
        assertEquals("job-1", dispatches.get(0).jobId());
        assertEquals(Resources.of(1, 1, 0), dispatches.get(0).limits());
        assertEquals(Job.DEFAULT_IMAGE, dispatches.get(0).image());
    }

    @Test
    void infeasibleSubmissionIsRecordedAsFailed() {
        f.node("n1", 2, 4, 0.10);

        SubmissionResult result = f.service.submit(SchedulerFixture.job("job-1", 8, 1));

        assertFalse(result.isScheduled());
        assertEquals(InfeasibleReason.NO_CAPACITY, result.decision().infeasibleReason());
        assertEquals(JobStatus.FAILED, result.job().status());
        assertEquals(FailureReason.NO_CAPACITY, result.job().failureReason());
        assertEquals(Resources.ZERO, reserved("n1"));
        assertEquals(0, f.executor.pendingCount("n1"));
    }

    @Test
    void startedThenCompletedReleasesCapacity() {
        f.node("n1", 4, 16, 0.10);
        f.service.submit(SchedulerFixture.job("job-1", 2, 4));

        assertEquals(ReportResult.APPLIED, f.lifecycle.report(ExecutionReport.started("job-1", "n1")));
        assertEquals(JobStatus.RUNNING, f.jobs.findById("job-1").orElseThrow().status());
        assertEquals(ReportResult.APPLIED, f.lifecycle.report(ExecutionReport.started("job-1", "n1")),
                "duplicate STARTED is harmless");

        assertEquals(ReportResult.APPLIED, f.lifecycle.report(ExecutionReport.completed("job-1", "n1", 0, "done")));

        Job job = f.jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals("done", job.output());
        assertEquals(Resources.ZERO, reserved("n1"));
    }

    @Test
    @DisplayName("Repeated terminal reports do not release capacity twice")
    void duplicateTerminalReportIsIdempotent() {
        f.node("n1", 4, 16, 0.10);
        f.service.submit(SchedulerFixture.job("job-1", 2, 4));
        f.service.submit(SchedulerFixture.job("job-2", 1, 1));

        f.lifecycle.report(ExecutionReport.completed("job-1", "n1", 0, null));

        assertEquals(ReportResult.ALREADY_TERMINAL,
                f.lifecycle.report(ExecutionReport.completed("job-1", "n1", 0, null)));
        assertEquals(ReportResult.ALREADY_TERMINAL,
                f.lifecycle.report(ExecutionReport.failed("job-1", "n1", 1, "late")));
        assertEquals(Resources.of(1, 1, 0), reserved("n1"), "job-2 still holds its share");
    }

    @Test
    void failureFromScheduledIsAccepted() {
        f.node("n1", 4, 16, 0.10);
        f.service.submit(SchedulerFixture.job("job-1", 2, 4));

        assertEquals(ReportResult.APPLIED,
                f.lifecycle.report(ExecutionReport.failed("job-1", "n1", 125, "image pull failed")));

        Job job = f.jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(FailureReason.EXECUTION_FAILED, job.failureReason());
        assertEquals(125, job.exitCode());
        assertEquals(Resources.ZERO, reserved("n1"));
    }

    @Test
    void reportsFromStrangersAreRejected() {
        f.node("n1", 4, 16, 0.10);
        f.node("n2", 4, 16, 0.20);
        f.service.submit(SchedulerFixture.job("job-1", 2, 4));

        assertEquals(ReportResult.WRONG_NODE, f.lifecycle.report(ExecutionReport.completed("job-1", "n2", 0, null)));
        assertEquals(ReportResult.NOT_FOUND, f.lifecycle.report(ExecutionReport.started("ghost", "n1")));
        assertEquals(JobStatus.SCHEDULED, f.jobs.findById("job-1").orElseThrow().status());
    }

    @Test
    void reportForInfeasibleJobIsAlreadyTerminal() {
        f.service.submit(SchedulerFixture.job("job-1", 2, 4));
        assertEquals(ReportResult.ALREADY_TERMINAL,
                f.lifecycle.report(ExecutionReport.completed("job-1", "n1", 0, null)));
    }

    @Test
    @DisplayName("Concurrent submissions never overbook a node")
    void concurrentSubmissionsRespectCapacity() throws Exception {
        f.node("n1", 8, 64, 0.10);

        int submissions = 24;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger scheduled = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < submissions; i++) {
            String id = "job-" + i;
            futures.add(pool.submit(() -> {
                start.await();
                if (f.service.submit(SchedulerFixture.job(id, 1, 1)).isScheduled()) {
                    scheduled.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(8, scheduled.get());
        assertEquals(Resources.of(8, 8, 0), reserved("n1"));
        assertEquals(8, f.jobs.countByStatus(JobStatus.SCHEDULED));
        assertEquals(submissions - 8, f.jobs.countByStatus(JobStatus.FAILED));
    }

    /**
     * Loses the first {@code losses} reservations as if another submission got there first.
     */
    private static final class RacyRegistry extends ClusterRegistry {
        private final AtomicInteger losses;

        RacyRegistry(MutableClock clock, int losses) {
            super(clock);
            this.losses = new AtomicInteger(losses);
        }

        @Override
        public Reservation reserve(String nodeId, Resources request) {
            if (losses.getAndDecrement() > 0) {
                throw new CapacityExceededException(nodeId, request, "simulated race");
            }
            return super.reserve(nodeId, request);
        }
    }

    @Test
    void lostReservationRaceRetriesAgainstFreshSnapshot() {
        f.close();
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        f = new SchedulerFixture(SchedulerConfig.defaults().withPlacementRetries(3), new RacyRegistry(clock, 2));
        f.node("n1", 4, 16, 0.10);

        SubmissionResult result = f.service.submit(SchedulerFixture.job("job-1", 1, 1));

        assertTrue(result.isScheduled());
        assertEquals(Resources.of(1, 1, 0), reserved("n1"));
    }

    @Test
    void exhaustedReservationRetriesAreNoCapacity() {
        f.close();
        MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        f = new SchedulerFixture(SchedulerConfig.defaults().withPlacementRetries(2), new RacyRegistry(clock, 5));
        f.node("n1", 4, 16, 0.10);

        SubmissionResult result = f.service.submit(SchedulerFixture.job("job-1", 1, 1));

        assertFalse(result.isScheduled());
        assertEquals(InfeasibleReason.NO_CAPACITY, result.decision().infeasibleReason());
        assertEquals(JobStatus.FAILED, f.jobs.findById("job-1").orElseThrow().status());
    }

    @Test
    void overdueJobsFailAndReleaseCapacity() {
        f.node("n1", 4, 16, 0.10);
        f.service.submit(SchedulerFixture.job("job-1", 2, 4));
        f.clock.advance(Duration.ofMinutes(30));
        f.service.submit(SchedulerFixture.job("job-2", 1, 1));

        f.clock.advance(Duration.ofMinutes(45));
        assertEquals(1, f.lifecycle.failOverdue(Duration.ofHours(1)));

        Job overdue = f.jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.FAILED, overdue.status());
        assertEquals(FailureReason.RESULT_TIMEOUT, overdue.failureReason());
        assertEquals(Resources.of(1, 1, 0), reserved("n1"));
        assertEquals(JobStatus.SCHEDULED, f.jobs.findById("job-2").orElseThrow().status());
    }

    @Test
    @DisplayName("A job failed for missing its result is never handed to a worker")
    void overdueDispatchIsNotClaimable() {
        f.node("n1", 4, 16, 0.10);
        f.service.submit(SchedulerFixture.job("job-1", 1, 1));

        f.clock.advance(Duration.ofHours(2));
        assertEquals(1, f.lifecycle.failOverdue(Duration.ofHours(1)));

        assertEquals(0, f.executor.claim("n1", 10).size());
        assertEquals(0, f.executor.pendingCount("n1"));
    }

    /**
     * Evicts {@code victim} right after handing out a reservation on it, the
     * way a node reaper running concurrently with a placement would.
     */
    private static final class EvictingRegistry extends ClusterRegistry {
        private final MutableClock clock;
        private final String victim;
        private final String survivor;
        private JobLifecycle lifecycle;
        private boolean evicted;

        EvictingRegistry(MutableClock clock, String victim, String survivor) {
            super(clock);
            this.clock = clock;
            this.victim = victim;
            this.survivor = survivor;
        }

        @Override
        public Reservation reserve(String nodeId, Resources request) {
            Reservation reservation = super.reserve(nodeId, request);
            if (!evicted && nodeId.equals(victim)) {
                evicted = true;
                clock.advance(Duration.ofSeconds(45));
                heartbeat(survivor, null);
                lifecycle.onNodesEvicted(evictStale(Duration.ofSeconds(30)));
            }
            return reservation;
        }
    }

    private EvictingRegistry evictingFixture(SchedulerConfig config) {
        f.close();
        f = new SchedulerFixture(config, clock -> new EvictingRegistry(clock, "n1", "n2"), JdbcJobRepository::new);
        EvictingRegistry registry = (EvictingRegistry) f.registry;
        registry.lifecycle = f.lifecycle;
        f.node("n1", 4, 16, 0.10);
        f.node("n2", 4, 16, 0.20);
        return registry;
    }

    @Test
    @DisplayName("Eviction between reservation and scheduling re-places the job on a live node")
    void evictionDuringPlacementRePlaces() {
        evictingFixture(SchedulerConfig.defaults());

        SubmissionResult result = f.service.submit(SchedulerFixture.job("job-1", 1, 1));

        assertTrue(result.isScheduled());
        assertEquals("n2", result.decision().nodeId());
        Job job = f.jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.SCHEDULED, job.status());
        assertEquals("n2", job.assignedNode());
        assertEquals(1, job.requeueCount());
        assertEquals(Resources.ZERO, reserved("n1"));
        assertEquals(Resources.of(1, 1, 0), reserved("n2"));
        assertTrue(f.executor.claim("n1", 10).isEmpty());
        assertEquals(List.of("job-1"), f.executor.claim("n2", 10).stream().map(Dispatch::jobId).toList());
    }

    @Test
    void evictionDuringPlacementWithoutRequeuesFailsNodeLost() {
        evictingFixture(SchedulerConfig.defaults().withMaxRequeues(0));

        SubmissionResult result = f.service.submit(SchedulerFixture.job("job-1", 1, 1));

        assertFalse(result.isScheduled());
        Job job = f.jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(FailureReason.NODE_LOST, job.failureReason());
        assertEquals(Resources.ZERO, reserved("n1"));
        assertEquals(Resources.ZERO, reserved("n2"));
        assertTrue(f.executor.claim("n1", 10).isEmpty());
    }

    /**
     * Fails {@code markScheduled} a set number of times.
     */
    private static final class FailingScheduleRepository extends JdbcJobRepository {
        private final AtomicInteger failures;

        FailingScheduleRepository(Database db, int failures) {
            super(db);
            this.failures = new AtomicInteger(failures);
        }

        @Override
        public boolean markScheduled(Assignment assignment) {
            if (failures.getAndDecrement() > 0) {
                throw new JobStoreException("Failed to schedule job: " + assignment.jobId(),
                        new SQLException("value too long for column assigned_node"));
            }
            return super.markScheduled(assignment);
        }
    }

    @Test
    @DisplayName("A store failure while scheduling releases the reservation and fails the job")
    void storeFailureDuringPlacementReleasesReservation() {
        f.close();
        f = new SchedulerFixture(SchedulerConfig.defaults(), ClusterRegistry::new,
                db -> new FailingScheduleRepository(db, 1));
        f.node("n1", 4, 16, 0.10);

        assertThrows(JobStoreException.class, () -> f.service.submit(SchedulerFixture.job("job-1", 2, 2)));

        assertEquals(Resources.ZERO, reserved("n1"));
        Job job = f.jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(FailureReason.PLACEMENT_ERROR, job.failureReason());
        assertEquals(0, f.executor.pendingCount("n1"));

        assertTrue(f.service.submit(SchedulerFixture.job("job-2", 4, 16)).isScheduled(),
                "the whole node is free again");
    }

    @Test
    void costErrorDuringPlacementFailsTheJob() {
        f.node("n1", 4, 16, 0.10);
        Optimizer broken = new Optimizer(new CostEngine(), LoadScaledLatencyModel.from(f.config), -1.0);
        JobLifecycle lifecycle = new JobLifecycle(f.jobs, f.registry, broken, f.executor, f.config, f.clock);

        Job job1 = SchedulerFixture.job("job-1", 1, 1).toBuilder().submittedAt(f.clock.instant()).build();

        assertThrows(InvalidCostInputException.class, () -> lifecycle.submit(job1));

        Job job = f.jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(FailureReason.PLACEMENT_ERROR, job.failureReason());
        assertEquals(Resources.ZERO, reserved("n1"));
    }

    @Test
    @DisplayName("One job failing to requeue does not stop the others")
    void evictionKeepsGoingPastAFailingJob() {
        FailingScheduleRepository[] repository = new FailingScheduleRepository[1];
        f.close();
        f = new SchedulerFixture(SchedulerConfig.defaults(), ClusterRegistry::new,
                db -> repository[0] = new FailingScheduleRepository(db, 0));
        f.node("n1", 4, 16, 0.10);
        f.node("n2", 4, 16, 0.20);
        f.service.submit(SchedulerFixture.job("job-1", 1, 1));
        f.service.submit(SchedulerFixture.job("job-2", 1, 1));
        assertEquals(Resources.of(2, 2, 0), reserved("n1"));

        repository[0].failures.set(1);
        f.clock.advance(Duration.ofSeconds(45));
        f.registry.heartbeat("n2", null);
        f.lifecycle.onNodesEvicted(f.registry.evictStale(Duration.ofSeconds(30)));

        assertEquals(1, f.jobs.countByStatus(JobStatus.SCHEDULED));
        assertEquals(1, f.jobs.countByStatus(JobStatus.FAILED));
        assertEquals(0, f.jobs.countByStatus(JobStatus.PENDING));
        Job failed = f.jobs.findByStatus(JobStatus.FAILED).get(0);
        assertEquals(FailureReason.NODE_LOST, failed.failureReason());
        Job moved = f.jobs.findByStatus(JobStatus.SCHEDULED).get(0);
        assertEquals("n2", moved.assignedNode());
        assertEquals(Resources.of(1, 1, 0), reserved("n2"));
    }

    @Test
    void stalePendingJobsAreFailed() {
        f.node("n1", 4, 16, 0.10);
        f.jobs.save(SchedulerFixture.job("stuck", 1, 1).toBuilder().submittedAt(f.clock.instant()).build());
        f.service.submit(SchedulerFixture.job("placed", 1, 1));

        f.clock.advance(Duration.ofMinutes(2));
        f.jobs.save(SchedulerFixture.job("fresh", 1, 1).toBuilder().submittedAt(f.clock.instant()).build());

        assertEquals(1, f.lifecycle.failStalePending(Duration.ofMinutes(1)));

        Job stuck = f.jobs.findById("stuck").orElseThrow();
        assertEquals(JobStatus.FAILED, stuck.status());
        assertEquals(FailureReason.PLACEMENT_ERROR, stuck.failureReason());
        assertEquals(JobStatus.PENDING, f.jobs.findById("fresh").orElseThrow().status());
        assertEquals(JobStatus.SCHEDULED, f.jobs.findById("placed").orElseThrow().status());
        assertEquals(0, f.lifecycle.failStalePending(Duration.ofMinutes(1)));
    }
}
