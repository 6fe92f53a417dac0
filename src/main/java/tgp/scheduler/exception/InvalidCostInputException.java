package tgp.scheduler.exception;

/**
 * A cost formula input was negative, NaN or infinite.
 */
public class InvalidCostInputException extends SchedulerException {

    private final String parameter;
    private final double value;

    public InvalidCostInputException(String parameter, double value) {
        super("Invalid cost input " + parameter + "=" + value + " (must be finite and non-negative)");
        this.parameter = parameter;
        this.value = value;
    }

    public String parameter() {
        return parameter;
    }

    public double value() {
        return value;
    }
}
