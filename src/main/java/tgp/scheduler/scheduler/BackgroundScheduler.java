package tgp.scheduler.scheduler;

import tgp.scheduler.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the node and job reapers on one daemon thread, so they never race
 * each other.
 */
public class BackgroundScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundScheduler.class);

    private final ScheduledExecutorService executor;
    private final NodeReaper nodeReaper;
    private final JobReaper jobReaper;
    private final SchedulerConfig config;

    private volatile boolean running = false;

    public BackgroundScheduler(NodeReaper nodeReaper, JobReaper jobReaper, SchedulerConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tgp-reaper");
            t.setDaemon(true);
            return t;
        });
        this.nodeReaper = nodeReaper;
        this.jobReaper = jobReaper;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Background scheduler already running");
            return;
        }
        running = true;

        schedule("node-reaper", nodeReaper, config.nodeReaperInterval());
        schedule("job-reaper", jobReaper, config.jobReaperInterval());

        log.info("Background scheduler started");
    }

    private void schedule(String name, Runnable task, Duration interval) {
        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(wrapRunnable(name, task), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("{} scheduled every {}ms", name, intervalMs);
    }

    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Background scheduler forcefully stopped");
            } else {
                log.info("Background scheduler stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * A throwing run must not cancel the periodic schedule.
     */
    private static Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
