package tgp.scheduler.config;

import tgp.scheduler.api.internal.v1.DispatchController;
import tgp.scheduler.api.internal.v1.NodeController;
import tgp.scheduler.api.v1.ClusterController;
import tgp.scheduler.api.v1.HealthController;
import tgp.scheduler.api.v1.JobController;
import tgp.scheduler.cost.CostEngine;
import tgp.scheduler.executor.QueueingJobExecutor;
import tgp.scheduler.optimizer.LoadScaledLatencyModel;
import tgp.scheduler.optimizer.Optimizer;
import tgp.scheduler.registry.ClusterRegistry;
import tgp.scheduler.repository.JobRepository;
import tgp.scheduler.scheduler.BackgroundScheduler;
import tgp.scheduler.scheduler.JobReaper;
import tgp.scheduler.scheduler.NodeReaper;
import tgp.scheduler.server.RouterHandler;
import tgp.scheduler.server.SchedulerHttpServer;
import tgp.scheduler.service.JobLifecycle;
import tgp.scheduler.service.SchedulerService;
import tgp.scheduler.store.Database;
import tgp.scheduler.store.JdbcJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(SchedulerConfig.load());
 * deps.httpServer().start();
 * deps.startScheduler(); // start background tasks
 * // ... serve ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final Clock clock;
    private final Database database;
    private final JobRepository jobRepository;
    private final ClusterRegistry clusterRegistry;
    private final Optimizer optimizer;
    private final QueueingJobExecutor executor;
    private final JobLifecycle jobLifecycle;
    private final SchedulerService schedulerService;

    // Controllers
    private final HealthController healthController;
    private final JobController jobController;
    private final ClusterController clusterController;
    private final NodeController nodeController;
    private final DispatchController dispatchController;

    // Background tasks
    private final NodeReaper nodeReaper;
    private final JobReaper jobReaper;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private SchedulerHttpServer httpServer;
    private BackgroundScheduler scheduler;

    private Dependencies(SchedulerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.jobRepository = new JdbcJobRepository(database);
        this.clusterRegistry = new ClusterRegistry(clock);

        // Placement
        this.optimizer = new Optimizer(new CostEngine(), LoadScaledLatencyModel.from(config),
                config.utilizationFactor());
        this.executor = new QueueingJobExecutor(
                d -> jobRepository.isAwaitingStart(d.jobId(), d.nodeId(), d.reservationEpoch()));

        // Services
        this.jobLifecycle = new JobLifecycle(jobRepository, clusterRegistry, optimizer, executor, config, clock);
        this.schedulerService = new SchedulerService(clusterRegistry, jobRepository, jobLifecycle, clock);

        // Controllers (public API)
        this.healthController = new HealthController(database, schedulerService);
        this.jobController = new JobController(schedulerService);
        this.clusterController = new ClusterController(schedulerService);

        // Controllers (internal API)
        this.nodeController = new NodeController(schedulerService, config);
        this.dispatchController = new DispatchController(schedulerService, executor);

        this.nodeReaper = new NodeReaper(clusterRegistry, jobLifecycle, config);
        this.jobReaper = new JobReaper(jobLifecycle, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(SchedulerConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    /**
     * Create dependencies on a caller-supplied clock, for tests that age
     * heartbeats and results without sleeping.
     */
    public static Dependencies create(SchedulerConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    // Getters
    public SchedulerConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public ClusterRegistry clusterRegistry() {
        return clusterRegistry;
    }

    public Optimizer optimizer() {
        return optimizer;
    }

    public QueueingJobExecutor executor() {
        return executor;
    }

    public JobLifecycle jobLifecycle() {
        return jobLifecycle;
    }

    public SchedulerService schedulerService() {
        return schedulerService;
    }

    public NodeReaper nodeReaper() {
        return nodeReaper;
    }

    public JobReaper jobReaper() {
        return jobReaper;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(jobController)
                    .registerController(clusterController)
                    .registerController(nodeController)
                    .registerController(dispatchController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * HTTP server bound to the configured host and port (not started).
     */
    public synchronized SchedulerHttpServer httpServer() {
        if (httpServer == null) {
            httpServer = new SchedulerHttpServer(config.serverHost(), config.serverPort(), routerHandler());
        }
        return httpServer;
    }

    public synchronized BackgroundScheduler scheduler() {
        if (scheduler == null) {
            scheduler = new BackgroundScheduler(nodeReaper, jobReaper, config);
        }
        return scheduler;
    }

    /**
     * Start the node and job reapers. Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        if (httpServer != null) {
            try {
                httpServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
