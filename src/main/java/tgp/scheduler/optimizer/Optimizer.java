package tgp.scheduler.optimizer;

import tgp.scheduler.cost.CostEngine;
import tgp.scheduler.model.ClusterSnapshot;
import tgp.scheduler.model.CostBreakdown;
import tgp.scheduler.model.InfeasibleReason;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.Node;
import tgp.scheduler.model.PlacementDecision;
import tgp.scheduler.model.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy single-job placement against one cluster snapshot.
 *
 * <ol>
 * <li>keep active nodes whose free capacity covers the request</li>
 * <li>drop nodes whose estimated latency breaks the latency bound or deadline</li>
 * <li>price the rest with {@link CostEngine}</li>
 * <li>drop nodes over the job's budget</li>
 * <li>pick the lowest total, ties going to the lexicographically smaller node id</li>
 * </ol>
 *
 * Holds no registry lock; the caller's reserve call decides whether the
 * chosen node is still free.
 */
public class Optimizer {

    private static final Logger log = LoggerFactory.getLogger(Optimizer.class);

    private static final Comparator<Candidate> CHEAPEST = Comparator
            .comparingDouble((Candidate c) -> c.cost().totalUsd())
            .thenComparing(c -> c.node().id());

    private final CostEngine costEngine;
    private final LatencyModel latencyModel;
    private final double utilizationFactor;

    public Optimizer(CostEngine costEngine, LatencyModel latencyModel, double utilizationFactor) {
        this.costEngine = costEngine;
        this.latencyModel = latencyModel;
        this.utilizationFactor = utilizationFactor;
    }

    private record Candidate(Node node, long latencyMs, CostBreakdown cost) {
    }

    public PlacementDecision place(Job job, ClusterSnapshot snapshot) {
        // 1. capacity and liveness
        List<Node> fitting = new ArrayList<>();
        for (Node node : snapshot.nodes()) {
            if (node.isActive() && node.free().fits(job.resources())) {
                fitting.add(node);
            } else {
                log.debug("Job {}: node {} skipped ({}, free {})", job.id(), node.id(), node.status(), node.free());
            }
        }
        if (fitting.isEmpty()) {
            log.debug("Job {}: no node can fit {}", job.id(), job.resources());
            return PlacementDecision.infeasible(InfeasibleReason.NO_CAPACITY);
        }

        // 2. latency bound and deadline
        List<Node> reachable = new ArrayList<>();
        List<Long> latencies = new ArrayList<>();
        for (Node node : fitting) {
            long latency = latencyModel.estimateLatencyMs(job, node);
            if (latency > job.sla().maxLatencyMs()) {
                log.debug("Job {}: node {} latency {}ms exceeds bound {}ms", job.id(), node.id(), latency,
                        job.sla().maxLatencyMs());
                continue;
            }
            if (missesDeadline(job, latency, snapshot.takenAt())) {
                log.debug("Job {}: node {} cannot finish before deadline {}", job.id(), node.id(),
                        job.sla().deadline());
                continue;
            }
            reachable.add(node);
            latencies.add(latency);
        }
        if (reachable.isEmpty()) {
            return PlacementDecision.infeasible(InfeasibleReason.SLA_UNREACHABLE);
        }

        // 3 + 4. price and budget
        List<Candidate> affordable = new ArrayList<>();
        for (int i = 0; i < reachable.size(); i++) {
            Node node = reachable.get(i);
            CostBreakdown cost = price(job, node);
            if (job.sla().hasBudget() && cost.totalUsd() > job.sla().budgetUsd()) {
                log.debug("Job {}: node {} costs ${} over budget ${}", job.id(), node.id(), cost.totalUsd(),
                        job.sla().budgetUsd());
                continue;
            }
            affordable.add(new Candidate(node, latencies.get(i), cost));
        }
        if (affordable.isEmpty()) {
            return PlacementDecision.infeasible(InfeasibleReason.OVER_BUDGET);
        }

        // 5. cheapest, then lexicographic id
        Candidate best = affordable.stream().min(CHEAPEST).orElseThrow();
        log.debug("Job {}: chose node {} at ${} ({}ms) out of {} candidates", job.id(), best.node().id(),
                best.cost().totalUsd(), best.latencyMs(), affordable.size());
        return PlacementDecision.placed(best.node().id(), best.cost(), best.latencyMs());
    }

    /**
     * Cost of running {@code job} on {@code node}. Idle hours are the job's
     * duration scaled by the share of the node left unreserved once the job is placed.
     */
    CostBreakdown price(Job job, Node node) {
        double duration = job.estimatedDurationHours();
        double utilizationAfter = Resources.utilization(node.reserved().plus(job.resources()), node.capacity());
        double idleHours = duration * (1.0 - utilizationAfter);

        return costEngine.evaluate(
                node.pricePerHour(),
                duration,
                utilizationFactor,
                job.estimatedDataGb(),
                node.transferPricePerGb(),
                idleHours,
                node.idleCostPerHour());
    }

    private static boolean missesDeadline(Job job, long latencyMs, Instant now) {
        if (!job.sla().hasDeadline()) {
            return false;
        }
        long durationMs = Math.round(job.estimatedDurationHours() * Duration.ofHours(1).toMillis());
        Instant finish = now.plusMillis(latencyMs).plusMillis(durationMs);
        return finish.isAfter(job.sla().deadline());
    }
}
