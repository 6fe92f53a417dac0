package tgp.scheduler.repository;

import tgp.scheduler.model.Assignment;
import tgp.scheduler.model.FailureReason;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for job records.
 *
 * <p>
 * Every {@code mark*} and {@link #requeue} call is a compare-and-set on the
 * current status (and, where a node is given, on the assigned node): it
 * returns {@code false} without changing anything when the row is no longer
 * in the expected state. Two callers racing for the same transition therefore
 * see exactly one winner.
 */
public interface JobRepository {

    /**
     * Insert a new job.
     *
     * @throws tgp.scheduler.exception.DuplicateJobException if the id is taken
     */
    void save(Job job);

    Optional<Job> findById(String jobId);

    /**
     * Most recently submitted first.
     */
    List<Job> findRecent(int limit);

    List<Job> findByStatus(JobStatus status);

    /**
     * SCHEDULED or RUNNING jobs assigned to the node.
     */
    List<Job> findActiveOnNode(String nodeId);

    /**
     * SCHEDULED or RUNNING jobs scheduled before the given instant.
     */
    List<Job> findScheduledBefore(Instant cutoff);

    /**
     * PENDING jobs that entered PENDING (submission or requeue) before the
     * given instant.
     */
    List<Job> findPendingBefore(Instant cutoff);

    /**
     * PENDING to SCHEDULED, recording the assignment.
     */
    boolean markScheduled(Assignment assignment);

    /**
     * SCHEDULED to RUNNING, only for the assigned node.
     */
    boolean markRunning(String jobId, String nodeId, Instant startedAt);

    /**
     * SCHEDULED or RUNNING to COMPLETED, only for the assigned node.
     */
    boolean markCompleted(String jobId, String nodeId, Integer exitCode, String output, Instant endedAt);

    /**
     * SCHEDULED or RUNNING to FAILED, only for the assigned node.
     */
    boolean markFailed(String jobId, String nodeId, FailureReason reason, Integer exitCode, String error,
            Instant endedAt);

    /**
     * PENDING to FAILED, for jobs that could not be placed.
     */
    boolean failPending(String jobId, FailureReason reason, String error, Instant endedAt);

    /**
     * SCHEDULED or RUNNING on {@code nodeId} back to PENDING. Clears the
     * assignment, increments the requeue count and restarts the pending clock
     * at {@code requeuedAt}.
     */
    boolean requeue(String jobId, String nodeId, Instant requeuedAt);

    /**
     * True while the job is SCHEDULED on the node under the given
     * reservation epoch, i.e. a dispatch for it may still be started.
     */
    default boolean isAwaitingStart(String jobId, String nodeId, long reservationEpoch) {
        return findById(jobId)
                .filter(job -> job.status() == JobStatus.SCHEDULED)
                .filter(job -> nodeId.equals(job.assignedNode()) && job.reservationEpoch() == reservationEpoch)
                .isPresent();
    }

    int count();

    int countByStatus(JobStatus status);
}
