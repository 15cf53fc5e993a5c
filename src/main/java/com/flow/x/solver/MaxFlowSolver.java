package com.flow.x.solver;

import com.flow.x.dto.MaxFlowResult;
import com.flow.x.models.FlowNetwork;

public interface MaxFlowSolver {
    MaxFlowResult solve(FlowNetwork network, int source, int sink);
    boolean supports(String algorithm);
}
