package tgp.scheduler.executor;

import tgp.scheduler.model.Resources;
import org.junit.jupiter.api.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QueueingJobExecutorTest {

    private final QueueingJobExecutor executor = new QueueingJobExecutor();

    private static Dispatch dispatch(String jobId, String nodeId) {
        return new Dispatch(jobId, nodeId, Resources.of(1, 1, 0), "alpine:latest", null, 1.0, 0L);
    }

    @Test
    void claimsOldestFirstUpToMax() {
        executor.dispatch(dispatch("a", "n1"));
        executor.dispatch(dispatch("b", "n1"));
        executor.dispatch(dispatch("c", "n1"));
        executor.dispatch(dispatch("x", "n2"));

        List<Dispatch> first = executor.claim("n1", 2);
        assertEquals(List.of("a", "b"), first.stream().map(Dispatch::jobId).toList());
        assertEquals(1, executor.pendingCount("n1"));
        assertEquals(1, executor.pendingCount("n2"));
        assertEquals("c", executor.claim("n1", 5).get(0).jobId());
        assertTrue(executor.claim("n1", 5).isEmpty());
    }

    @Test
    void claimForUnknownNodeIsEmpty() {
        assertTrue(executor.claim("nobody", 3).isEmpty());
    }

    @Test
    void cancelAllDropsNodeQueue() {
        executor.dispatch(dispatch("a", "n1"));
        executor.dispatch(dispatch("b", "n1"));

        assertEquals(2, executor.cancelAll("n1"));
        assertEquals(0, executor.pendingCount("n1"));
        assertEquals(0, executor.cancelAll("n1"));
    }

    @Test
    @DisplayName("Claim skips dispatches that are no longer deliverable")
    void claimDropsUndeliverable() {
        Set<String> live = new HashSet<>(Set.of("a", "c"));
        QueueingJobExecutor filtering = new QueueingJobExecutor(d -> live.contains(d.jobId()));
        filtering.dispatch(dispatch("a", "n1"));
        filtering.dispatch(dispatch("b", "n1"));
        filtering.dispatch(dispatch("c", "n1"));
        filtering.dispatch(dispatch("d", "n1"));

        assertEquals(List.of("a", "c"), filtering.claim("n1", 2).stream().map(Dispatch::jobId).toList());
        assertEquals(1, filtering.pendingCount("n1"));
        assertTrue(filtering.claim("n1", 5).isEmpty(), "d is dropped, not returned");
        assertEquals(0, filtering.pendingCount("n1"));
    }
}
