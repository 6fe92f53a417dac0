package tgp.scheduler.scheduler;

import tgp.scheduler.config.SchedulerConfig;
import tgp.scheduler.registry.ClusterRegistry;
import tgp.scheduler.service.JobLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Background task that ages out silent nodes.
 *
 * <ol>
 * <li>nodes quiet for longer than the suspect threshold become SUSPECTED
 * (no longer offered to the optimizer)</li>
 * <li>nodes quiet for longer than the heartbeat timeout are evicted, their
 * reservations revoked, and their jobs requeued</li>
 * </ol>
 */
public class NodeReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(NodeReaper.class);

    private final ClusterRegistry registry;
    private final JobLifecycle lifecycle;
    private final SchedulerConfig config;

    public NodeReaper(ClusterRegistry registry, JobLifecycle lifecycle, SchedulerConfig config) {
        this.registry = registry;
        this.lifecycle = lifecycle;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapStaleNodes();
        } catch (Exception e) {
            log.error("Node reaper error", e);
        }
    }

    /**
     * @return ids of nodes evicted by this pass
     */
    public List<String> reapStaleNodes() {
        registry.markSuspected(config.suspectAfter());

        List<String> evicted = registry.evictStale(config.heartbeatTimeout());
        if (evicted.isEmpty()) {
            log.debug("No stale nodes found");
            return evicted;
        }

        log.info("Node reaper: evicted {}", evicted);
        lifecycle.onNodesEvicted(evicted);
        return evicted;
    }
}
