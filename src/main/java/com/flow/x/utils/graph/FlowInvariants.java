package com.flow.x.utils.graph;

import com.flow.x.exceptions.FlowInvariantViolationException;
import com.flow.x.models.FlowEdge;
import com.flow.x.models.FlowNetwork;
import com.flow.x.models.FlowNode;

/**
 * Checks of the preflow properties a push-relabel run maintains.
 *
 * <p>Each check throws {@link FlowInvariantViolationException} naming the first offending edge or node.
 * All checks are linear in the size of the network; the solver only runs them when
 * {@code flow.solver.invariant-checks} is enabled.
 */
public final class FlowInvariants {

    public static final String CAPACITY = "capacity";
    public static final String SKEW_SYMMETRY = "skew-symmetry";
    public static final String EXCESS = "excess";
    public static final String CONSERVATION = "conservation";
    public static final String HEIGHT = "height";

    private FlowInvariants() {
        throw new UnsupportedOperationException("Not supported");
    }

    /**
     * Runs every check that holds for an intermediate preflow.
     */
    public static void verifyPreflow(FlowNetwork network, int source, int sink) {
        checkCapacity(network);
        checkSkewSymmetry(network);
        checkExcess(network, source, sink);
        checkHeights(network, source, sink);
    }

    /**
     * Forward edges carry {@code 0 <= flow <= capacity}; twins carry {@code -capacity(forward) <= flow <= 0}.
     */
    public static void checkCapacity(FlowNetwork network) {
        for (FlowEdge edge : network.getEdges()) {
            long flow = edge.getFlow();
            if (!edge.isReverse()) {
                if (flow < 0 || flow > edge.getCapacity()) {
                    throw new FlowInvariantViolationException(CAPACITY, describe(edge));
                }
            } else {
                long forwardCapacity = network.twinOf(edge).getCapacity();
                if (flow > 0 || flow < -forwardCapacity) {
                    throw new FlowInvariantViolationException(CAPACITY, describe(edge));
                }
            }
        }
    }

    public static void checkSkewSymmetry(FlowNetwork network) {
        for (FlowEdge edge : network.getEdges()) {
            FlowEdge twin = network.twinOf(edge);
            if (twin.getTwinIndex() != edge.getIndex() || edge.getFlow() != -twin.getFlow()) {
                throw new FlowInvariantViolationException(SKEW_SYMMETRY, describe(edge) + " twin " + describe(twin));
            }
        }
    }

    /**
     * Every node but source and sink holds non-negative excess equal to its net inflow.
     */
    public static void checkExcess(FlowNetwork network, int source, int sink) {
        long[] net = netInflow(network);
        for (FlowNode node : network.getNodes()) {
            int id = node.getId();
            if (id == source || id == sink) continue;
            if (node.getExcess() < 0 || node.getExcess() != net[id]) {
                throw new FlowInvariantViolationException(EXCESS,
                        "node " + id + " excess=" + node.getExcess() + " netInflow=" + net[id]);
            }
        }
    }

    /**
     * Net inflow is zero at every node but source and sink. Holds once the run has finished.
     */
    public static void checkConservation(FlowNetwork network, int source, int sink) {
        long[] net = netInflow(network);
        for (int id = 0; id < net.length; id++) {
            if (id == source || id == sink) continue;
            if (net[id] != 0) {
                throw new FlowInvariantViolationException(CONSERVATION, "node " + id + " netInflow=" + net[id]);
            }
        }
    }

    /**
     * Every residual edge (u, v) satisfies {@code height(u) <= height(v) + 1}; the source sits at the
     * node count and the sink at zero.
     */
    public static void checkHeights(FlowNetwork network, int source, int sink) {
        if (network.getNode(source).getHeight() != network.nodeCount()) {
            throw new FlowInvariantViolationException(HEIGHT, "source height " + network.getNode(source).getHeight());
        }
        if (network.getNode(sink).getHeight() != 0) {
            throw new FlowInvariantViolationException(HEIGHT, "sink height " + network.getNode(sink).getHeight());
        }
        for (FlowEdge edge : network.getEdges()) {
            if (edge.residualCapacity() <= 0) continue;
            int hu = network.getNode(edge.getFrom()).getHeight();
            int hv = network.getNode(edge.getTo()).getHeight();
            if (hu > hv + 1) {
                throw new FlowInvariantViolationException(HEIGHT,
                        describe(edge) + " height(from)=" + hu + " height(to)=" + hv);
            }
        }
    }

    private static long[] netInflow(FlowNetwork network) {
        long[] net = new long[network.nodeCount()];
        for (FlowEdge edge : network.getEdges()) {
            if (edge.isReverse()) continue;
            net[edge.getFrom()] -= edge.getFlow();
            net[edge.getTo()] += edge.getFlow();
        }
        return net;
    }

    private static String describe(FlowEdge edge) {
        return "edge#" + edge.getIndex() + " " + edge.getFrom() + "->" + edge.getTo()
                + " flow=" + edge.getFlow() + " capacity=" + edge.getCapacity();
    }
}
