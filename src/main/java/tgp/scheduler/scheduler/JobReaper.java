package tgp.scheduler.scheduler;

import tgp.scheduler.config.SchedulerConfig;
import tgp.scheduler.service.JobLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that fails jobs whose executor never reported a result.
 *
 * Results can go missing if a worker crashes after claiming a dispatch while
 * its node keeps heartbeating, or if the final report is lost in transit.
 * Such jobs become FAILED(RESULT_TIMEOUT) and their capacity is released.
 *
 * It also fails jobs stuck in PENDING, which happens only when a placement
 * or requeue broke off after the job was stored.
 */
public class JobReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);

    private final JobLifecycle lifecycle;
    private final SchedulerConfig config;

    public JobReaper(JobLifecycle lifecycle, SchedulerConfig config) {
        this.lifecycle = lifecycle;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapOverdueJobs();
        } catch (Exception e) {
            log.error("Job reaper error", e);
        }
        try {
            reapStalePendingJobs();
        } catch (Exception e) {
            log.error("Pending job sweep error", e);
        }
    }

    /**
     * @return number of jobs failed
     */
    public int reapOverdueJobs() {
        int failed = lifecycle.failOverdue(config.resultTimeout());
        if (failed > 0) {
            log.info("Job reaper: {} jobs timed out", failed);
        } else {
            log.debug("No overdue jobs found");
        }
        return failed;
    }

    /**
     * @return number of jobs failed
     */
    public int reapStalePendingJobs() {
        int failed = lifecycle.failStalePending(config.pendingTimeout());
        if (failed > 0) {
            log.info("Job reaper: {} jobs stuck in PENDING failed", failed);
        }
        return failed;
    }
}
