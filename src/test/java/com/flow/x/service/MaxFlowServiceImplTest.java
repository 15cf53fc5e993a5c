package com.flow.x.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.flow.x.config.SolverConfig;
import com.flow.x.dto.EdgeSpec;
import com.flow.x.dto.MaxFlowRequest;
import com.flow.x.dto.MaxFlowResult;
import com.flow.x.exceptions.BadRequestException;
import com.flow.x.metrics.MaxFlowMetrics;
import com.flow.x.solver.PushRelabelSolver;
import com.flow.x.solver.decider.MaxFlowSolverSelector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class MaxFlowServiceImplTest {

    private ValidatorFactory validatorFactory;
    private SimpleMeterRegistry registry;
    private SolverConfig config;
    private MaxFlowServiceImpl service;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        registry = new SimpleMeterRegistry();
        config = new SolverConfig();
        config.setInvariantChecks(true);
        service =
                new MaxFlowServiceImpl(
                        new MaxFlowSolverSelector(List.of(new PushRelabelSolver(config))),
                        new FlowNetworkBuilder(),
                        config,
                        new MaxFlowMetrics(registry),
                        validatorFactory.getValidator(),
                        Runnable::run);
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void solvesDiamondAndRecordsMetrics() {
        MaxFlowResult result = service.solve(diamond());

        assertEquals(10L, result.getMaxFlow());
        assertEquals("push-relabel", result.getAlgorithm());
        assertEquals(5, result.getEdgeFlows().size());
        assertEquals(1.0, registry.counter("max_flow_solved", "algorithm", "push-relabel").count());
        assertEquals(1L, registry.timer("max_flow_solve_duration", "algorithm", "push-relabel").count());
    }

    @Test
    void rejectsMalformedRequestBeforeSolving() {
        MaxFlowRequest request = diamond();
        request.getEdges().add(new EdgeSpec(0, 9, 1));

        assertThrows(BadRequestException.class, () -> service.solve(request));
        assertEquals(1.0, registry.counter("max_flow_rejected", "reason", "validation").count());
        assertEquals(0.0, registry.counter("max_flow_solved", "algorithm", "push-relabel").count());
    }

    @Test
    void unknownAlgorithmIsRejected() {
        config.setAlgorithm("dinic");

        assertThrows(BadRequestException.class, () -> service.solve(diamond()));
    }

    @Test
    void solveAsyncCompletesWithResult() throws Exception {
        CompletableFuture<MaxFlowResult> future = service.solveAsync(diamond());

        assertEquals(10L, future.get().getMaxFlow());
    }

    @Test
    void solveAsyncPropagatesValidationFailure() {
        MaxFlowRequest request = diamond();
        request.setSink(request.getSource());

        ExecutionException e = assertThrows(ExecutionException.class, () -> service.solveAsync(request).get());
        assertInstanceOf(BadRequestException.class, e.getCause());
    }

    private static MaxFlowRequest diamond() {
        return MaxFlowRequest.builder()
                .nodeCount(4)
                .source(0)
                .sink(3)
                .edges(
                        new ArrayList<>(
                                List.of(
                                        new EdgeSpec(0, 1, 10),
                                        new EdgeSpec(0, 2, 10),
                                        new EdgeSpec(1, 3, 5),
                                        new EdgeSpec(2, 3, 5),
                                        new EdgeSpec(1, 2, 2))))
                .build();
    }
}
