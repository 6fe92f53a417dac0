package tgp.scheduler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resource vector used for node capacity, reservations and job requests.
 */
public record Resources(
        @JsonProperty("cpuCores") int cpuCores,
        @JsonProperty("memoryGb") int memoryGb,
        @JsonProperty("gpuCount") int gpuCount) {

    public static final Resources ZERO = new Resources(0, 0, 0);

    public Resources {
        if (cpuCores < 0 || memoryGb < 0 || gpuCount < 0) {
            throw new IllegalArgumentException(
                    "resources must be non-negative: cpu=" + cpuCores + ", mem=" + memoryGb + ", gpu=" + gpuCount);
        }
    }

    public static Resources of(int cpuCores, int memoryGb, int gpuCount) {
        return new Resources(cpuCores, memoryGb, gpuCount);
    }

    public Resources plus(Resources other) {
        return new Resources(cpuCores + other.cpuCores, memoryGb + other.memoryGb, gpuCount + other.gpuCount);
    }

    /** Throws if any dimension would go negative. */
    public Resources minus(Resources other) {
        return new Resources(cpuCores - other.cpuCores, memoryGb - other.memoryGb, gpuCount - other.gpuCount);
    }

    /** True when every dimension of {@code request} fits into this vector. */
    public boolean fits(Resources request) {
        return request.cpuCores <= cpuCores
                && request.memoryGb <= memoryGb
                && request.gpuCount <= gpuCount;
    }

    public boolean isZero() {
        return cpuCores == 0 && memoryGb == 0 && gpuCount == 0;
    }

    /**
     * Highest used/total ratio over the dimensions this capacity actually has.
     */
    public static double utilization(Resources used, Resources capacity) {
        double max = 0.0;
        if (capacity.cpuCores > 0) {
            max = Math.max(max, (double) used.cpuCores / capacity.cpuCores);
        }
        if (capacity.memoryGb > 0) {
            max = Math.max(max, (double) used.memoryGb / capacity.memoryGb);
        }
        if (capacity.gpuCount > 0) {
            max = Math.max(max, (double) used.gpuCount / capacity.gpuCount);
        }
        return Math.min(max, 1.0);
    }

    @Override
    public String toString() {
        return cpuCores + "cpu/" + memoryGb + "GB/" + gpuCount + "gpu";
    }
}
