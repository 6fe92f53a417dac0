package tgp.scheduler.optimizer;

import tgp.scheduler.config.SchedulerConfig;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.Node;
import tgp.scheduler.model.Resources;

/**
 * Default latency policy:
 *
 * <pre>
 * latency = base
 *         + loadPenalty * utilizationAfterPlacement
 *         + (preferred zone set and different ? zonePenalty : 0)
 *         + (elastic node ? coldStartPenalty : 0)
 * </pre>
 *
 * Utilization is the busiest dimension's reserved/total ratio once the job's
 * request is added.
 */
public final class LoadScaledLatencyModel implements LatencyModel {

    private final long baseMs;
    private final long loadPenaltyMs;
    private final long zonePenaltyMs;
    private final long coldStartPenaltyMs;

    public LoadScaledLatencyModel(long baseMs, long loadPenaltyMs, long zonePenaltyMs, long coldStartPenaltyMs) {
        if (baseMs < 0 || loadPenaltyMs < 0 || zonePenaltyMs < 0 || coldStartPenaltyMs < 0) {
            throw new IllegalArgumentException("latency model parameters must be non-negative");
        }
        this.baseMs = baseMs;
        this.loadPenaltyMs = loadPenaltyMs;
        this.zonePenaltyMs = zonePenaltyMs;
        this.coldStartPenaltyMs = coldStartPenaltyMs;
    }

    public static LoadScaledLatencyModel from(SchedulerConfig config) {
        return new LoadScaledLatencyModel(config.baseLatencyMs(), config.loadPenaltyMs(),
                config.zonePenaltyMs(), config.coldStartPenaltyMs());
    }

    @Override
    public long estimateLatencyMs(Job job, Node node) {
        double utilization = Resources.utilization(node.reserved().plus(job.resources()), node.capacity());
        long latency = baseMs + Math.round(loadPenaltyMs * utilization);

        String zone = job.preferredZone();
        if (zone != null && !zone.isBlank() && !zone.equalsIgnoreCase(node.location())) {
            latency += zonePenaltyMs;
        }
        if (!node.onPremise()) {
            latency += coldStartPenaltyMs;
        }
        return latency;
    }

    @Override
    public String toString() {
        return "LoadScaledLatencyModel{base=" + baseMs + "ms, load=" + loadPenaltyMs + "ms, zone="
                + zonePenaltyMs + "ms, coldStart=" + coldStartPenaltyMs + "ms}";
    }
}
