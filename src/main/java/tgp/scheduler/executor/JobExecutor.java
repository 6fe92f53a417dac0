package tgp.scheduler.executor;

/**
 * Hands scheduled jobs to whatever actually runs them. Outcomes come back
 * asynchronously as {@link tgp.scheduler.model.ExecutionReport}s.
 */
public interface JobExecutor {

    /**
     * Must not block on the job's execution.
     */
    void dispatch(Dispatch dispatch);

    /**
     * Forget undelivered dispatches for a node that left the cluster.
     *
     * @return number of dispatches dropped
     */
    default int cancelAll(String nodeId) {
        return 0;
    }
}
