package com.flow.x.utils.graph;

import com.flow.x.models.FlowEdge;
import com.flow.x.models.FlowNetwork;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Minimum s-t cut read off a solved network.
 * <p>
 * After a maximum flow the nodes reachable from the source through edges with positive residual
 * capacity form the source side S of a minimum cut; every forward edge leaving S is saturated.
 * </p>
 */
public final class ResidualCut {

    private ResidualCut() {
        throw new UnsupportedOperationException("Not supported");
    }

    /**
     * Breadth-first search from {@code source} over residual edges.
     *
     * @return reachable node ids in discovery order
     */
    public static Set<Integer> sourceSide(FlowNetwork network, int source) {
        boolean[] visited = new boolean[network.nodeCount()];
        Set<Integer> reached = new LinkedHashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();

        visited[source] = true;
        reached.add(source);
        queue.add(source);

        while (!queue.isEmpty()) {
            int u = queue.poll();
            for (int edgeIndex : network.getNode(u).getAdjacency()) {
                FlowEdge edge = network.getEdge(edgeIndex);
                int v = edge.getTo();
                if (edge.residualCapacity() > 0 && !visited[v]) {
                    visited[v] = true;
                    reached.add(v);
                    queue.add(v);
                }
            }
        }
        return Collections.unmodifiableSet(reached);
    }

    /**
     * Total capacity of forward edges from {@code sourceSide} to the rest of the network.
     */
    public static long capacity(FlowNetwork network, Set<Integer> sourceSide) {
        long total = 0L;
        for (FlowEdge edge : network.getEdges()) {
            if (edge.isReverse()) continue;
            if (sourceSide.contains(edge.getFrom()) && !sourceSide.contains(edge.getTo())) {
                total = Math.addExact(total, edge.getCapacity());
            }
        }
        return total;
    }
}
