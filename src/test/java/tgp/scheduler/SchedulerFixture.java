package tgp.scheduler;

import tgp.scheduler.config.SchedulerConfig;
import tgp.scheduler.cost.CostEngine;
import tgp.scheduler.executor.QueueingJobExecutor;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.NodeSpec;
import tgp.scheduler.model.Resources;
import tgp.scheduler.model.SlaConstraints;
import tgp.scheduler.optimizer.LoadScaledLatencyModel;
import tgp.scheduler.optimizer.Optimizer;
import tgp.scheduler.registry.ClusterRegistry;
import tgp.scheduler.service.JobLifecycle;
import tgp.scheduler.service.SchedulerService;
import tgp.scheduler.store.Database;
import tgp.scheduler.store.JdbcJobRepository;

import java.util.function.Function;

/**
 * Scheduler core wired on a fresh in-memory database and a manual clock.
 */
public final class SchedulerFixture implements AutoCloseable {

    public final SchedulerConfig config;
    public final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    public final Database db;
    public final JdbcJobRepository jobs;
    public final ClusterRegistry registry;
    public final QueueingJobExecutor executor;
    public final JobLifecycle lifecycle;
    public final SchedulerService service;

    public SchedulerFixture() {
        this(SchedulerConfig.defaults());
    }

    public SchedulerFixture(SchedulerConfig base) {
        this(base, null);
    }

    /**
     * @param registry registry to use, or null for a plain one on the fixture clock
     */
    public SchedulerFixture(SchedulerConfig base, ClusterRegistry registry) {
        this(base, clock -> registry != null ? registry : new ClusterRegistry(clock), JdbcJobRepository::new);
    }

    /**
     * @param registryFactory   builds the registry on the fixture clock
     * @param repositoryFactory builds the job repository on the fixture database
     */
    public SchedulerFixture(SchedulerConfig base, Function<MutableClock, ClusterRegistry> registryFactory,
            Function<Database, JdbcJobRepository> repositoryFactory) {
        this.config = base.withDatabaseUrl("jdbc:h2:mem:test-sched-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        this.db = new Database(config);
        this.jobs = repositoryFactory.apply(db);
        this.registry = registryFactory.apply(clock);
        this.executor = new QueueingJobExecutor(
                d -> jobs.isAwaitingStart(d.jobId(), d.nodeId(), d.reservationEpoch()));
        Optimizer optimizer = new Optimizer(new CostEngine(), LoadScaledLatencyModel.from(config),
                config.utilizationFactor());
        this.lifecycle = new JobLifecycle(jobs, this.registry, optimizer, executor, config, clock);
        this.service = new SchedulerService(this.registry, jobs, lifecycle, clock);
    }

    public void node(String id, int cpu, int memoryGb, double pricePerHour) {
        registry.registerNode(NodeSpec.simple(id, "zone-a", Resources.of(cpu, memoryGb, 0), pricePerHour));
    }

    public static Job job(String id, int cpu, int memoryGb) {
        return Job.builder()
                .id(id)
                .resources(Resources.of(cpu, memoryGb, 0))
                .sla(new SlaConstraints(1_000, null, null))
                .estimatedDurationHours(1.0)
                .build();
    }

    @Override
    public void close() {
        db.close();
    }
}
