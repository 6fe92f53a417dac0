package tgp.scheduler.simulation;

import tgp.scheduler.executor.Dispatch;
import tgp.scheduler.executor.QueueingJobExecutor;
import tgp.scheduler.model.ExecutionReport;
import tgp.scheduler.model.NodeSpec;
import tgp.scheduler.model.ReportResult;
import tgp.scheduler.service.SchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A single simulated node worker.
 * Registers, then loops: claim -> started -> sleep -> complete/fail -> heartbeat.
 * Stops cleanly on Thread.interrupt().
 */
public final class SimulatedWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SimulatedWorker.class);

    private final NodeSpec spec;
    private final SchedulerService schedulerService;
    private final QueueingJobExecutor executor;
    private final int delayMinMs;
    private final int delayMaxMs;
    private final double failRate;

    public SimulatedWorker(NodeSpec spec,
            SchedulerService schedulerService,
            QueueingJobExecutor executor,
            int delayMinMs,
            int delayMaxMs,
            double failRate) {
        this.spec = spec;
        this.schedulerService = schedulerService;
        this.executor = executor;
        this.delayMinMs = delayMinMs;
        this.delayMaxMs = delayMaxMs;
        this.failRate = failRate;
    }

    public String nodeId() {
        return spec.id();
    }

    @Override
    public void run() {
        Thread.currentThread().setName("sim-worker-" + spec.id());

        schedulerService.registerNode(spec);
        log.info("Sim worker {} started", spec.id());

        while (!Thread.currentThread().isInterrupted()) {
            try {
                List<Dispatch> claimed = executor.claim(spec.id(), 1);

                if (claimed.isEmpty()) {
                    Thread.sleep(100);
                    sendHeartbeat();
                    continue;
                }

                Dispatch dispatch = claimed.get(0);
                schedulerService.reportNodeResult(ExecutionReport.started(dispatch.jobId(), spec.id()));

                int delay = delayMinMs >= delayMaxMs ? delayMinMs
                        : ThreadLocalRandom.current().nextInt(delayMinMs, delayMaxMs);
                Thread.sleep(delay);

                boolean shouldFail = failRate > 0 && ThreadLocalRandom.current().nextDouble() < failRate;
                ReportResult res;
                if (shouldFail) {
                    res = schedulerService.reportNodeResult(
                            ExecutionReport.failed(dispatch.jobId(), spec.id(), 1, "Simulated failure"));
                } else {
                    String output = String.format("{\"sim\":true,\"image\":\"%s\",\"ms\":%d}", dispatch.image(), delay);
                    res = schedulerService.reportNodeResult(
                            ExecutionReport.completed(dispatch.jobId(), spec.id(), 0, output));
                }
                log.debug("Sim {} finished job {} -> {}", spec.id(), dispatch.jobId(), res);

                sendHeartbeat();

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.warn("Sim worker {} error: {}", spec.id(), e.getMessage());
                try {
                    Thread.sleep(500);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("Sim worker {} stopped", spec.id());
    }

    private void sendHeartbeat() {
        if (!schedulerService.heartbeat(spec.id(), null)) {
            // evicted and forgotten; come back as a fresh node
            schedulerService.registerNode(spec);
        }
    }
}
