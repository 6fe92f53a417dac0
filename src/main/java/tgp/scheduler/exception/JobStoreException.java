package tgp.scheduler.exception;

/**
 * The job store could not be read or written.
 */
public class JobStoreException extends SchedulerException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
