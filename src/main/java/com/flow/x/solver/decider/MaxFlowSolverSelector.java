package com.flow.x.solver.decider;

import com.flow.x.exceptions.BadRequestException;
import com.flow.x.solver.MaxFlowSolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;


@Service
@RequiredArgsConstructor
public class MaxFlowSolverSelector {

    private final List<MaxFlowSolver> solvers;

    public MaxFlowSolver select(String algorithm) {
        for (MaxFlowSolver solver : solvers) {
            if (solver.supports(algorithm)) {
                return solver;
            }
        }
        throw new BadRequestException("No max-flow solver found for algorithm: " + algorithm);
    }
}
