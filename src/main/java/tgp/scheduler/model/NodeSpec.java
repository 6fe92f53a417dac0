package tgp.scheduler.model;

/**
 * Declared attributes of a node, sent on registration.
 *
 * @param id                 stable node identity; registration is idempotent by this id
 * @param hostname           informational
 * @param location           zone tag used by the latency model
 * @param capacity           total CPU/memory/GPU
 * @param pricePerHour       compute price in USD per hour
 * @param transferPricePerGb data transfer price in USD per GB
 * @param idleCostPerHour    opportunity cost of idle capacity in USD per hour
 * @param onPremise          true for owned hardware, false for elastic cloud capacity
 */
public record NodeSpec(
        String id,
        String hostname,
        String location,
        Resources capacity,
        double pricePerHour,
        double transferPricePerGb,
        double idleCostPerHour,
        boolean onPremise) {

    /** Node ids are stored as a job's assigned node. */
    public static final int MAX_ID_LENGTH = Job.MAX_ID_LENGTH;
    public static final int MAX_LOCATION_LENGTH = 128;

    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("node id is required");
        }
        if (id.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException("node id is longer than " + MAX_ID_LENGTH + " characters");
        }
        if (location != null && location.length() > MAX_LOCATION_LENGTH) {
            throw new IllegalArgumentException("location is longer than " + MAX_LOCATION_LENGTH + " characters");
        }
        if (capacity == null) {
            throw new IllegalArgumentException("capacity is required");
        }
        if (capacity.cpuCores() <= 0) {
            throw new IllegalArgumentException("cpu capacity must be positive");
        }
        requireNonNegative("pricePerHour", pricePerHour);
        requireNonNegative("transferPricePerGb", transferPricePerGb);
        requireNonNegative("idleCostPerHour", idleCostPerHour);
    }

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be a non-negative number");
        }
    }

    /** Cloud node with no transfer or idle pricing. */
    public static NodeSpec simple(String id, String location, Resources capacity, double pricePerHour) {
        return new NodeSpec(id, id, location, capacity, pricePerHour, 0.0, 0.0, false);
    }
}
