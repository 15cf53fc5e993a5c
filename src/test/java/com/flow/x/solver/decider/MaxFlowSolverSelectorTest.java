package com.flow.x.solver.decider;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.flow.x.config.SolverConfig;
import com.flow.x.exceptions.BadRequestException;
import com.flow.x.solver.PushRelabelSolver;
import java.util.List;
import org.junit.jupiter.api.Test;

final class MaxFlowSolverSelectorTest {

    private final PushRelabelSolver pushRelabel = new PushRelabelSolver(new SolverConfig());
    private final MaxFlowSolverSelector selector = new MaxFlowSolverSelector(List.of(pushRelabel));

    @Test
    void selectsSolverByAlgorithmName() {
        assertSame(pushRelabel, selector.select("Push-Relabel"));
    }

    @Test
    void unknownAlgorithmIsABadRequest() {
        assertThrows(BadRequestException.class, () -> selector.select("simplex"));
    }
}
