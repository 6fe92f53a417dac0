package tgp.scheduler.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Predicate;

/**
 * Parks dispatches per node until that node's worker pulls them.
 *
 * <p>
 * A dispatch can outlive its job's assignment (result timeout, eviction
 * racing a placement). Claims check each dispatch against
 * {@code deliverable} and drop the ones that no longer hold.
 */
public class QueueingJobExecutor implements JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueueingJobExecutor.class);

    private final ConcurrentHashMap<String, Queue<Dispatch>> pending = new ConcurrentHashMap<>();
    private final Predicate<Dispatch> deliverable;

    public QueueingJobExecutor() {
        this(dispatch -> true);
    }

    public QueueingJobExecutor(Predicate<Dispatch> deliverable) {
        this.deliverable = deliverable;
    }

    @Override
    public void dispatch(Dispatch dispatch) {
        pending.computeIfAbsent(dispatch.nodeId(), id -> new ConcurrentLinkedQueue<>()).add(dispatch);
        log.debug("Queued job {} for node {}", dispatch.jobId(), dispatch.nodeId());
    }

    /**
     * Take up to {@code max} deliverable dispatches for the node, oldest first.
     */
    public List<Dispatch> claim(String nodeId, int max) {
        Queue<Dispatch> queue = pending.get(nodeId);
        List<Dispatch> claimed = new ArrayList<>();
        if (queue == null) {
            return claimed;
        }
        Dispatch next;
        while (claimed.size() < max && (next = queue.poll()) != null) {
            if (deliverable.test(next)) {
                claimed.add(next);
            } else {
                log.info("Dropped stale dispatch of job {} for node {}", next.jobId(), nodeId);
            }
        }
        if (!claimed.isEmpty()) {
            log.debug("Node {} claimed {} dispatches", nodeId, claimed.size());
        }
        return claimed;
    }

    @Override
    public int cancelAll(String nodeId) {
        Queue<Dispatch> queue = pending.remove(nodeId);
        int dropped = queue == null ? 0 : queue.size();
        if (dropped > 0) {
            log.info("Dropped {} undelivered dispatches for node {}", dropped, nodeId);
        }
        return dropped;
    }

    public int pendingCount(String nodeId) {
        Queue<Dispatch> queue = pending.get(nodeId);
        return queue == null ? 0 : queue.size();
    }
}
