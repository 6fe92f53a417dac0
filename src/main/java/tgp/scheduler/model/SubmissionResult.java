package tgp.scheduler.model;

/**
 * Definitive answer to a submission: the stored job plus the placement decision
 * that produced its state.
 */
public record SubmissionResult(Job job, PlacementDecision decision) {

    public boolean isScheduled() {
        return decision.isFeasible();
    }
}
