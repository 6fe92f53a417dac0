package tgp.scheduler.exception;

public class DuplicateJobException extends SchedulerException {

    public DuplicateJobException(String jobId) {
        super("Job already exists: " + jobId);
    }
}
