package com.flow.x.solver;

import com.flow.x.dto.SolverStats;
import com.flow.x.exceptions.BadRequestException;
import com.flow.x.exceptions.FlowInvariantViolationException;
import com.flow.x.models.FlowEdge;
import com.flow.x.models.FlowNetwork;
import com.flow.x.models.FlowNode;
import com.flow.x.processors.ActiveNodeQueue;
import com.flow.x.utils.graph.FlowInvariants;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * One run of the generic push-relabel (preflow-push) maximum-flow algorithm with FIFO selection
 * of active nodes.
 *
 * <p>Core invariants:
 * <ul>
 *   <li>The network holds a <b>preflow</b>: nodes other than source and sink may hold positive
 *       excess (inflow minus outflow), never negative excess.</li>
 *   <li>Pushes only use <b>admissible</b> edges (u -> v): residual capacity &gt; 0 and
 *       {@code height(u) == height(v) + 1}.</li>
 *   <li>A node without an admissible edge is <b>relabeled</b> to
 *       {@code 1 + min{ height(v) | (u -> v) has residual capacity }}, which keeps every residual
 *       edge valid ({@code height(u) <= height(v) + 1}).</li>
 *   <li>{@code height(source) == n} and {@code height(sink) == 0} for the whole run.</li>
 * </ul>
 *
 * <p>Each dequeued node gets exactly one push or one relabel and goes to the back of the queue while
 * it still holds excess. The scan for admissible edges resumes at the node's current arc, which only
 * returns to the start when a scan runs off the end of the adjacency. Bound: O(V^3).
 *
 * <p>A relabel that finds no residual edge at all marks the node as a dead end: its height becomes
 * {@code 2n}, above every height a valid labelling reaches, and it is not enqueued again.
 * A node with positive excess always keeps the twin of an edge that delivered flow to it, so this
 * only happens when an invariant is already broken.
 *
 * <p>Instances are single use and not thread-safe.
 */
@Slf4j
public class PushRelabelAlgorithm {

    private final FlowNetwork network;
    private final int source;
    private final int sink;
    private final boolean invariantChecks;
    private final ActiveNodeQueue activeNodes;
    private final boolean[] deadEnd;
    private final int deadEndHeight;

    private long pushes;
    private long saturatingPushes;
    private long relabels;
    private long dischargeSteps;
    private long deadEnds;

    public PushRelabelAlgorithm(FlowNetwork network, int source, int sink, boolean invariantChecks) {
        this.network = Objects.requireNonNull(network, "network must not be null");
        if (!network.hasNode(source) || !network.hasNode(sink)) {
            throw new BadRequestException("Source " + source + " and sink " + sink
                    + " must be in range [0, " + network.nodeCount() + ")");
        }
        if (source == sink) {
            throw new BadRequestException("Source and sink must differ, both are " + source);
        }
        this.source = source;
        this.sink = sink;
        this.invariantChecks = invariantChecks;
        this.activeNodes = new ActiveNodeQueue(network.nodeCount());
        this.deadEnd = new boolean[network.nodeCount()];
        this.deadEndHeight = 2 * network.nodeCount();
    }

    /**
     * Computes the maximum flow, leaving the flow assignment on the network's edges.
     *
     * @return the maximum flow value, which is also recorded on the network
     * @throws IllegalStateException if the network was already solved
     */
    public long run() {
        network.seal();
        initPreflow();

        while (!activeNodes.isEmpty()) {
            int u = activeNodes.dequeue();
            dischargeSteps++;

            if (u == source || u == sink) continue;

            FlowNode node = network.getNode(u);
            if (!push(node)) {
                relabel(node);
            }

            if (node.getExcess() > 0 && !deadEnd[u]) {
                activeNodes.enqueue(u);
            }
        }

        long maxFlow = network.getNode(sink).getExcess();
        network.recordMaxFlow(maxFlow);

        if (invariantChecks) {
            FlowInvariants.checkConservation(network, source, sink);
        }
        log.debug("Push-relabel finished: maxFlow={}, pushes={}, relabels={}, dischargeSteps={}, peakQueue={}",
                maxFlow, pushes, relabels, dischargeSteps, activeNodes.getPeakSize());
        return maxFlow;
    }

    /**
     * Lifts the source to height n and saturates every edge leaving it. Each destination other than
     * source and sink is enqueued once, however many parallel edges reach it.
     */
    private void initPreflow() {
        FlowNode s = network.getNode(source);
        s.setHeight(network.nodeCount());
        boolean[] enqueued = new boolean[network.nodeCount()];
        int saturated = 0;

        for (int edgeIndex : s.getAdjacency()) {
            FlowEdge edge = network.getEdge(edgeIndex);
            long send = edge.residualCapacity();
            if (send <= 0) continue;

            network.applyFlow(edgeIndex, send);
            saturated++;
            FlowNode v = network.getNode(edge.getTo());
            v.setExcess(Math.addExact(v.getExcess(), send));

            int to = v.getId();
            if (to != source && to != sink && !enqueued[to]) {
                enqueued[to] = true;
                enqueueActive(to);
            }
        }

        if (invariantChecks) {
            FlowInvariants.verifyPreflow(network, source, sink);
        }
        log.debug("Initial preflow saturated {} edges out of source {}, {} active nodes",
                saturated, source, activeNodes.size());
    }

    /**
     * Pushes along the first admissible edge at or after the current arc of {@code u}.
     *
     * @return false if the scan reached the end of the adjacency without a push
     */
    boolean push(FlowNode u) {
        int degree = u.degree();
        for (int i = u.getCurrentArc(); i < degree; i++) {
            u.setCurrentArc(i);
            FlowEdge edge = network.getEdge(u.edgeAt(i));
            long residual = edge.residualCapacity();
            FlowNode v = network.getNode(edge.getTo());

            if (residual > 0 && u.getHeight() == v.getHeight() + 1) {
                long delta = Math.min(u.getExcess(), residual);
                network.applyFlow(edge.getIndex(), delta);
                u.setExcess(u.getExcess() - delta);
                v.setExcess(Math.addExact(v.getExcess(), delta));

                pushes++;
                if (delta == residual) saturatingPushes++;
                log.trace("push {} -> {} delta={} excess({})={}", u.getId(), v.getId(), delta, v.getId(), v.getExcess());

                int to = v.getId();
                if (v.getExcess() == delta && to != source && to != sink) {
                    enqueueActive(to);
                }
                if (invariantChecks) {
                    FlowInvariants.verifyPreflow(network, source, sink);
                }
                return true;
            }
        }
        u.setCurrentArc(0);
        return false;
    }

    /**
     * Raises {@code u} to one above its lowest residual neighbour, or to the dead-end height when it has none.
     */
    void relabel(FlowNode u) {
        int min = Integer.MAX_VALUE;
        int degree = u.degree();
        for (int i = 0; i < degree; i++) {
            FlowEdge edge = network.getEdge(u.edgeAt(i));
            if (edge.residualCapacity() > 0) {
                min = Math.min(min, network.getNode(edge.getTo()).getHeight());
            }
        }

        relabels++;
        int oldHeight = u.getHeight();
        if (min == Integer.MAX_VALUE) {
            deadEnd[u.getId()] = true;
            deadEnds++;
            u.setHeight(deadEndHeight);
            log.warn("Node {} has no residual edge left; parking it at height {} with excess {}",
                    u.getId(), deadEndHeight, u.getExcess());
        } else {
            u.setHeight(min + 1);
        }
        log.trace("relabel {} {} -> {}", u.getId(), oldHeight, u.getHeight());

        if (invariantChecks) {
            FlowInvariants.verifyPreflow(network, source, sink);
        }
    }

    private void enqueueActive(int nodeId) {
        if (invariantChecks && activeNodes.contains(nodeId)) {
            throw new FlowInvariantViolationException("queue", "node " + nodeId + " enqueued twice");
        }
        activeNodes.enqueue(nodeId);
    }

    public SolverStats stats() {
        return SolverStats.builder()
                .pushes(pushes)
                .saturatingPushes(saturatingPushes)
                .relabels(relabels)
                .dischargeSteps(dischargeSteps)
                .deadEnds(deadEnds)
                .peakQueueSize(activeNodes.getPeakSize())
                .build();
    }
}
