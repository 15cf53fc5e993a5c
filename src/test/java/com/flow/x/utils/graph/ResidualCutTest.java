package com.flow.x.utils.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.flow.x.models.FlowNetwork;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class ResidualCutTest {

    @Test
    void sourceSideFollowsOnlyResidualEdges() {
        FlowNetwork network = new FlowNetwork(4);
        int saturated = network.addEdge(0, 1, 3);
        network.addEdge(0, 2, 5);
        network.addEdge(1, 3, 3);
        network.applyFlow(saturated, 3);

        Set<Integer> side = ResidualCut.sourceSide(network, 0);

        assertEquals(List.of(0, 2), List.copyOf(side));
        assertEquals(3L, ResidualCut.capacity(network, side));
    }

    @Test
    void twinsOfUsedEdgesLeadBackwards() {
        FlowNetwork network = new FlowNetwork(3);
        int first = network.addEdge(0, 1, 2);
        int second = network.addEdge(2, 1, 4);
        network.applyFlow(first, 1);
        network.applyFlow(second, 4);

        Set<Integer> side = ResidualCut.sourceSide(network, 0);

        assertEquals(Set.of(0, 1, 2), side);
        assertEquals(0L, ResidualCut.capacity(network, side));
    }
}
