package tgp;

import tgp.scheduler.config.Dependencies;
import tgp.scheduler.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Scheduler entry point.
 *
 * Loads configuration, starts the HTTP server and the background reapers,
 * and shuts them down from a JVM shutdown hook.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        SchedulerConfig config = SchedulerConfig.load();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping scheduler...");
            deps.close();
            stopped.countDown();
        }, "tgp-shutdown"));

        try {
            log.info("Starting scheduler on {}:{}...", config.serverHost(), config.serverPort());
            deps.httpServer().start();
            deps.startScheduler();
        } catch (InterruptedException | RuntimeException e) {
            log.error("Failed to start scheduler", e);
            deps.close();
            System.exit(1);
        }

        stopped.await();
    }
}
