package tgp.scheduler.model;

import java.time.Instant;

/**
 * Per-job service-level constraints a placement must satisfy.
 *
 * @param maxLatencyMs upper bound on the estimated start latency
 * @param budgetUsd    ceiling on the total cost, {@code null} for unlimited
 * @param deadline     latest acceptable completion time, {@code null} for none
 */
public record SlaConstraints(long maxLatencyMs, Double budgetUsd, Instant deadline) {

    public boolean hasBudget() {
        return budgetUsd != null;
    }

    public boolean hasDeadline() {
        return deadline != null;
    }
}
