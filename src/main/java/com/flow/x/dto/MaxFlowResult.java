package com.flow.x.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Set;

@Builder
@AllArgsConstructor
@Data
public class MaxFlowResult {
    private String algorithm;
    private int source;
    private int sink;
    private long maxFlow;
    private List<EdgeFlow> edgeFlows;
    private Set<Integer> minCutSourceSide;
    private long minCutCapacity;
    private SolverStats stats;
}
