package com.flow.x.solver;

import com.flow.x.config.SolverConfig;
import com.flow.x.dto.EdgeFlow;
import com.flow.x.dto.MaxFlowResult;
import com.flow.x.models.FlowEdge;
import com.flow.x.models.FlowNetwork;
import com.flow.x.utils.graph.ResidualCut;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;


@Slf4j
@Component("pushRelabelSolver")
public class PushRelabelSolver implements MaxFlowSolver {
    public static final String ALGORITHM = "push-relabel";

    private final SolverConfig solverConfig;

    public PushRelabelSolver(SolverConfig solverConfig) {
        this.solverConfig = Objects.requireNonNull(solverConfig, "solverConfig must not be null");
    }

    @Override
    public boolean supports(String algorithm) {
        return ALGORITHM.equalsIgnoreCase(algorithm);
    }

    @Override
    public MaxFlowResult solve(FlowNetwork network, int source, int sink) {
        PushRelabelAlgorithm algorithm = new PushRelabelAlgorithm(network, source, sink, solverConfig.isInvariantChecks());
        long maxFlow = algorithm.run();

        Set<Integer> sourceSide = ResidualCut.sourceSide(network, source);
        long cutCapacity = ResidualCut.capacity(network, sourceSide);
        if (cutCapacity != maxFlow) {
            log.warn("Residual cut capacity {} differs from max flow {} for source={}, sink={}",
                    cutCapacity, maxFlow, source, sink);
        }

        List<FlowEdge> forwardEdges = network.forwardEdges();
        List<EdgeFlow> edgeFlows = new ArrayList<>(forwardEdges.size());
        for (FlowEdge edge : forwardEdges) {
            edgeFlows.add(EdgeFlow.builder()
                    .from(edge.getFrom())
                    .to(edge.getTo())
                    .capacity(edge.getCapacity())
                    .flow(edge.getFlow())
                    .build());
        }

        return MaxFlowResult.builder()
                .algorithm(ALGORITHM)
                .source(source)
                .sink(sink)
                .maxFlow(maxFlow)
                .edgeFlows(edgeFlows)
                .minCutSourceSide(sourceSide)
                .minCutCapacity(cutCapacity)
                .stats(algorithm.stats())
                .build();
    }
}
