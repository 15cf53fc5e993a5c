package com.flow.x.models;

import com.flow.x.exceptions.BadRequestException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

/**
 * Capacitated directed graph in residual form, shared by the max-flow solvers.
 *
 * <p>Representation:
 * <ul>
 *   <li>All edges live in one arena ({@code edges}) and are addressed by their index.</li>
 *   <li>For every user edge (u -> v) with capacity C the arena holds a forward edge
 *       {@code (u -> v, C)} immediately followed by its twin {@code (v -> u, 0)}.</li>
 *   <li>Each node's adjacency stores arena indices of the edges leaving it.</li>
 * </ul>
 *
 * <p>The network is filled once through {@link #addEdge(int, int, long)} and sealed when a solve
 * begins. It is not thread-safe; a network belongs to the thread that solves it.
 */
@Slf4j
public class FlowNetwork {

    private final List<FlowNode> nodes;
    private final List<FlowEdge> edges;
    private boolean sealed;
    private Long maxFlow;

    public FlowNetwork(int nodeCount) {
        this(nodeCount, 0);
    }

    /**
     * @param nodeCount         number of vertices, indexed {@code 0..nodeCount-1}
     * @param expectedUserEdges number of {@link #addEdge} calls expected; used only to presize storage
     */
    public FlowNetwork(int nodeCount, int expectedUserEdges) {
        if (nodeCount < 1) {
            throw new BadRequestException("Network must have at least one node, got " + nodeCount);
        }
        this.nodes = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            nodes.add(new FlowNode(i));
        }
        this.edges = new ArrayList<>(Math.max(0, expectedUserEdges) * 2);
    }

    /**
     * Adds a user edge {@code u -> v} with capacity {@code capacity} together with its residual twin.
     * Self-loops and parallel edges are kept as independent edges.
     *
     * @return arena index of the forward edge; its twin sits at {@code index + 1}
     * @throws BadRequestException   if an endpoint is out of range or the capacity is negative
     * @throws IllegalStateException if a solve has already started on this network
     */
    public int addEdge(int u, int v, long capacity) {
        if (sealed) {
            throw new IllegalStateException("Edges cannot be added once solving has started");
        }
        requireNode(u, "from");
        requireNode(v, "to");
        if (capacity < 0) {
            throw new BadRequestException("Capacity of edge " + u + " -> " + v + " must not be negative, got " + capacity);
        }

        int forwardIndex = edges.size();
        int twinIndex = forwardIndex + 1;

        FlowEdge forward = FlowEdge.builder()
                .index(forwardIndex).from(u).to(v).capacity(capacity)
                .reverse(false).twinIndex(twinIndex)
                .build();
        FlowEdge twin = FlowEdge.builder()
                .index(twinIndex).from(v).to(u).capacity(0L)
                .reverse(true).twinIndex(forwardIndex)
                .build();

        if (!isPaired(forward, twin) || !isPaired(twin, forward)) {
            throw new IllegalStateException("Twin pairing broken for edge " + u + " -> " + v);
        }

        edges.add(forward);
        edges.add(twin);
        nodes.get(u).attach(forwardIndex);
        nodes.get(v).attach(twinIndex);
        return forwardIndex;
    }

    private static boolean isPaired(FlowEdge edge, FlowEdge twin) {
        return edge.getTwinIndex() == twin.getIndex()
                && edge.getFrom() == twin.getTo()
                && edge.getTo() == twin.getFrom();
    }

    /**
     * Moves {@code delta} units along edge {@code edgeIndex}: the edge gains {@code delta} and its twin
     * loses the same amount, so skew symmetry holds after every call.
     */
    public void applyFlow(int edgeIndex, long delta) {
        FlowEdge edge = edges.get(edgeIndex);
        edge.addFlow(delta);
        edges.get(edge.getTwinIndex()).addFlow(-delta);
    }

    public FlowNode getNode(int id) {
        return nodes.get(id);
    }

    public FlowEdge getEdge(int index) {
        return edges.get(index);
    }

    public FlowEdge twinOf(FlowEdge edge) {
        return edges.get(edge.getTwinIndex());
    }

    public List<FlowNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<FlowEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * @return the user-supplied edges in insertion order, twins excluded
     */
    public List<FlowEdge> forwardEdges() {
        List<FlowEdge> forward = new ArrayList<>(edges.size() / 2);
        for (FlowEdge edge : edges) {
            if (!edge.isReverse()) {
                forward.add(edge);
            }
        }
        return forward;
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * @return number of arena edges, twins included
     */
    public int edgeCount() {
        return edges.size();
    }

    public int forwardEdgeCount() {
        return edges.size() / 2;
    }

    public boolean hasNode(int id) {
        return id >= 0 && id < nodes.size();
    }

    /**
     * Marks the start of a solve. A network can be solved once.
     *
     * @throws IllegalStateException if the network was already sealed by an earlier solve
     */
    public void seal() {
        if (sealed) {
            throw new IllegalStateException("Network has already been solved; build a new network to solve again");
        }
        sealed = true;
        log.debug("Sealed network with {} nodes and {} edges", nodes.size(), edges.size());
    }

    public boolean isSealed() {
        return sealed;
    }

    public void recordMaxFlow(long value) {
        this.maxFlow = value;
    }

    /**
     * @return the computed max-flow value, empty until a solve completes
     */
    public OptionalLong getMaxFlow() {
        return maxFlow == null ? OptionalLong.empty() : OptionalLong.of(maxFlow);
    }

    private void requireNode(int id, String role) {
        if (!hasNode(id)) {
            throw new BadRequestException("Edge " + role + " node " + id + " is out of range [0, " + nodes.size() + ")");
        }
    }
}
