package tgp.scheduler.optimizer;

import tgp.scheduler.cost.CostEngine;
import tgp.scheduler.model.ClusterSnapshot;
import tgp.scheduler.model.CostBreakdown;
import tgp.scheduler.model.InfeasibleReason;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.Node;
import tgp.scheduler.model.NodeStatus;
import tgp.scheduler.model.PlacementDecision;
import tgp.scheduler.model.Resources;
import tgp.scheduler.model.SlaConstraints;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OptimizerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final CostEngine costEngine = new CostEngine();
    private final Optimizer optimizer = new Optimizer(costEngine, new LoadScaledLatencyModel(50, 100, 40, 0), 1.0);

    private static Node.Builder node(String id, int cpu, int mem, double price) {
        return Node.builder()
                .id(id)
                .location("zone-a")
                .capacity(Resources.of(cpu, mem, 0))
                .pricePerHour(price)
                .onPremise(true);
    }

    private static Job.Builder job(int cpu, int mem) {
        return Job.builder()
                .id("job-1")
                .resources(Resources.of(cpu, mem, 0))
                .sla(new SlaConstraints(1_000, null, null))
                .estimatedDurationHours(1.0);
    }

    private static ClusterSnapshot snapshot(Node... nodes) {
        return new ClusterSnapshot(List.of(nodes), NOW);
    }

    @Test
    @DisplayName("1 CPU / 1 GB for one hour on a $0.10/h node costs exactly $0.10")
    void singleNodeComputeCost() {
        PlacementDecision decision = optimizer.place(job(1, 1).build(), snapshot(node("n1", 4, 16, 0.10).build()));

        assertTrue(decision.isFeasible());
        assertEquals("n1", decision.nodeId());
        assertEquals(0.10, decision.cost().computeUsd(), 1e-12);
        assertEquals(0.0, decision.cost().dataTransferUsd());
        assertEquals(0.0, decision.cost().idleOpportunityUsd());
        assertEquals(0.10, decision.cost().totalUsd(), 1e-12);
    }

    @Test
    @DisplayName("A request larger than every node's free capacity is NO_CAPACITY")
    void noCapacity() {
        PlacementDecision decision = optimizer.place(job(16, 1).build(),
                snapshot(node("n1", 8, 64, 0.1).build(), node("n2", 16, 64, 0.1).reserved(Resources.of(1, 0, 0)).build()));

        assertFalse(decision.isFeasible());
        assertEquals(InfeasibleReason.NO_CAPACITY, decision.infeasibleReason());
    }

    @Test
    void emptyClusterIsNoCapacity() {
        assertEquals(InfeasibleReason.NO_CAPACITY, optimizer.place(job(1, 1).build(), snapshot()).infeasibleReason());
    }

    @Test
    void inactiveNodesAreSkipped() {
        PlacementDecision decision = optimizer.place(job(1, 1).build(), snapshot(
                node("a-cheap", 8, 8, 0.01).status(NodeStatus.SUSPECTED).build(),
                node("b-evicted", 8, 8, 0.01).status(NodeStatus.EVICTED).build(),
                node("c-active", 8, 8, 1.0).build()));

        assertEquals("c-active", decision.nodeId());
    }

    @Test
    void partiallyReservedNodeIsOnlyChosenIfFreeCapacityFits() {
        Node busyCheap = node("a", 8, 32, 0.05).reserved(Resources.of(6, 8, 0)).build();
        Node idlePricey = node("b", 8, 32, 0.50).build();

        assertEquals("b", optimizer.place(job(4, 4).build(), snapshot(busyCheap, idlePricey)).nodeId());
        assertEquals("a", optimizer.place(job(2, 4).build(), snapshot(busyCheap, idlePricey)).nodeId());
    }

    @Test
    @DisplayName("The pricier node wins when the cheap node misses the latency bound")
    void latencyBoundBeatsPrice() {
        LatencyModel latency = (job, node) -> node.id().equals("cheap") ? 500 : 50;
        Optimizer opt = new Optimizer(costEngine, latency, 1.0);
        Job job = job(1, 1).sla(new SlaConstraints(100, null, null)).build();

        PlacementDecision decision = opt.place(job, snapshot(node("cheap", 8, 8, 0.10).build(),
                node("pricey", 8, 8, 2.00).build()));

        assertEquals("pricey", decision.nodeId());
        assertEquals(50, decision.estimatedLatencyMs());
        assertEquals(2.0, decision.cost().totalUsd(), 1e-12);
    }

    @Test
    void latencyBoundRejectingEveryNodeIsSlaUnreachable() {
        Job job = job(1, 1).sla(new SlaConstraints(10, null, null)).build();
        assertEquals(InfeasibleReason.SLA_UNREACHABLE,
                optimizer.place(job, snapshot(node("n1", 8, 8, 0.1).build())).infeasibleReason());
    }

    @Test
    void zoneMismatchAddsLatency() {
        Job job = job(1, 1).preferredZone("zone-b").sla(new SlaConstraints(120, null, null)).build();
        Node far = node("a-far", 4, 4, 0.1).build();
        Node near = node("b-near", 4, 4, 0.2).location("zone-b").build();

        // far: 50 + 25 + 40 = 115 still fits, and it is cheaper
        assertEquals("a-far", optimizer.place(job, snapshot(far, near)).nodeId());

        Job strict = job(1, 1).preferredZone("zone-b").sla(new SlaConstraints(100, null, null)).build();
        assertEquals("b-near", optimizer.place(strict, snapshot(far, near)).nodeId());
    }

    @Test
    void deadlineThatCannotBeMetIsSlaUnreachable() {
        Job job = job(1, 1).estimatedDurationHours(1.0)
                .sla(new SlaConstraints(1_000, null, NOW.plus(Duration.ofMinutes(30))))
                .build();
        assertEquals(InfeasibleReason.SLA_UNREACHABLE,
                optimizer.place(job, snapshot(node("n1", 8, 8, 0.1).build())).infeasibleReason());

        Job relaxed = job(1, 1).estimatedDurationHours(1.0)
                .sla(new SlaConstraints(1_000, null, NOW.plus(Duration.ofHours(2))))
                .build();
        assertTrue(optimizer.place(relaxed, snapshot(node("n1", 8, 8, 0.1).build())).isFeasible());
    }

    @Test
    void budgetBelowEveryCandidateIsOverBudget() {
        Job job = job(1, 1).estimatedDurationHours(2.0).sla(new SlaConstraints(1_000, 1.5, null)).build();

        PlacementDecision decision = optimizer.place(job, snapshot(node("n1", 8, 8, 1.0).build(),
                node("n2", 8, 8, 3.0).build()));

        assertEquals(InfeasibleReason.OVER_BUDGET, decision.infeasibleReason());
    }

    @Test
    void budgetEqualToCostIsAccepted() {
        Job job = job(1, 1).estimatedDurationHours(2.0).sla(new SlaConstraints(1_000, 2.0, null)).build();
        assertEquals("n1", optimizer.place(job, snapshot(node("n1", 8, 8, 1.0).build())).nodeId());
    }

    @Test
    @DisplayName("Equal cost ties go to the lexicographically smaller node id, every time")
    void tieBreakIsLexicographic() {
        ClusterSnapshot snap = snapshot(node("node-b", 8, 8, 0.5).build(), node("node-a", 8, 8, 0.5).build(),
                node("node-c", 8, 8, 0.5).build());

        for (int i = 0; i < 20; i++) {
            assertEquals("node-a", optimizer.place(job(1, 1).build(), snap).nodeId());
        }
    }

    @Test
    void idleOpportunityUsesUnreservedShareAfterPlacement() {
        Node onPrem = node("n1", 4, 16, 1.0).idleCostPerHour(0.2).build();
        Job job = job(1, 1).estimatedDurationHours(2.0).build();

        CostBreakdown cost = optimizer.price(job, onPrem);

        // utilization after placement = max(1/4, 1/16) = 0.25; idle hours = 2 * 0.75
        assertEquals(2.0, cost.computeUsd(), 1e-12);
        assertEquals(1.5 * 0.2, cost.idleOpportunityUsd(), 1e-12);
    }

    @Test
    void dataTransferUsesNodePrice() {
        Node node = node("n1", 4, 16, 0.0).transferPricePerGb(0.09).build();
        Job job = job(1, 1).estimatedDataGb(100).build();

        assertEquals(9.0, optimizer.price(job, node).dataTransferUsd(), 1e-9);
    }

    @Test
    void idleCostCanFlipTheChoice() {
        // on-prem is cheaper per hour but a lightly used big box carries idle cost
        Node bigOnPrem = node("a-onprem", 64, 256, 0.30).idleCostPerHour(0.50).build();
        Node cloud = node("b-cloud", 4, 16, 0.40).onPremise(false).build();

        assertEquals("b-cloud", optimizer.place(job(1, 1).build(), snapshot(bigOnPrem, cloud)).nodeId());
    }

    @Test
    void chosenNodeAlwaysFitsAndMeetsLatency() {
        Node[] nodes = new Node[10];
        for (int i = 0; i < nodes.length; i++) {
            nodes[i] = node("n" + i, 2 + i, 4 + 2 * i, 0.1 * (10 - i)).reserved(Resources.of(i % 3, i % 4, 0)).build();
        }
        ClusterSnapshot snap = snapshot(nodes);
        for (int cpu = 1; cpu <= 12; cpu++) {
            Job job = job(cpu, cpu).sla(new SlaConstraints(130, null, null)).build();
            PlacementDecision decision = optimizer.place(job, snap);
            if (decision.isFeasible()) {
                Node chosen = snap.node(decision.nodeId()).orElseThrow();
                assertTrue(chosen.free().fits(job.resources()));
                assertTrue(decision.estimatedLatencyMs() <= 130);
            }
        }
    }
}
