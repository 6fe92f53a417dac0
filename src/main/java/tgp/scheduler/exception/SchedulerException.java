package tgp.scheduler.exception;

/**
 * Base type for domain failures raised by the scheduler core.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
