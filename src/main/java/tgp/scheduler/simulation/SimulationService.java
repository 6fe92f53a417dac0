package tgp.scheduler.simulation;

import tgp.scheduler.executor.QueueingJobExecutor;
import tgp.scheduler.model.NodeSpec;
import tgp.scheduler.model.Resources;
import tgp.scheduler.service.SchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Service managing simulated node workers that stand in for the container
 * sandbox. Call start() to spawn workers, stop() to shut them all down.
 */
public final class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private static final String[] ZONES = { "zone-a", "zone-b" };

    private final SchedulerService schedulerService;
    private final QueueingJobExecutor executor;

    private ExecutorService workerPool;
    private final List<String> nodeIds = new ArrayList<>();
    private volatile boolean running;

    public SimulationService(SchedulerService schedulerService, QueueingJobExecutor executor) {
        this.schedulerService = schedulerService;
        this.executor = executor;
    }

    /**
     * Start N workers with a default node shape: 8 CPU, 32 GB, no GPU, priced
     * from $0.40/h upward so the optimizer has a cheapest choice.
     */
    public void start(int workers, int delayMinMs, int delayMaxMs, double failRate) {
        List<NodeSpec> specs = new ArrayList<>();
        for (int i = 1; i <= workers; i++) {
            specs.add(new NodeSpec("sim-" + i, "127.0.0.1", ZONES[i % ZONES.length],
                    Resources.of(8, 32, 0), 0.40 + 0.10 * (i - 1), 0.0, 0.0, i % 2 == 0));
        }
        start(specs, delayMinMs, delayMaxMs, failRate);
    }

    /**
     * Start one worker per node spec. Nodes are registered before this
     * returns, so submissions right after start() see them.
     */
    public synchronized void start(List<NodeSpec> specs, int delayMinMs, int delayMaxMs, double failRate) {
        if (running) {
            log.warn("Simulation already running");
            return;
        }

        nodeIds.clear();
        workerPool = Executors.newFixedThreadPool(Math.max(1, specs.size()), r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });

        for (NodeSpec spec : specs) {
            schedulerService.registerNode(spec);
            nodeIds.add(spec.id());
            workerPool.submit(new SimulatedWorker(spec, schedulerService, executor, delayMinMs, delayMaxMs,
                    failRate));
        }

        running = true;
        log.info("Simulation started: {} workers, delay {}..{}ms, failRate {}",
                specs.size(), delayMinMs, delayMaxMs, failRate);
    }

    /**
     * Stop all simulated workers. Their nodes stop heartbeating and are aged
     * out by the node reaper like any other silent node.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        if (workerPool != null) {
            workerPool.shutdownNow();
            try {
                workerPool.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            workerPool = null;
        }

        log.info("Simulation stopped ({} nodes left to the reaper)", nodeIds.size());
        nodeIds.clear();
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized List<String> nodeIds() {
        return List.copyOf(nodeIds);
    }
}
