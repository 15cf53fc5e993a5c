package com.flow.x.service;

import com.flow.x.config.SolverConfig;
import com.flow.x.dto.MaxFlowRequest;
import com.flow.x.dto.MaxFlowResult;
import com.flow.x.exceptions.BadRequestException;
import com.flow.x.metrics.MaxFlowMetrics;
import com.flow.x.models.FlowNetwork;
import com.flow.x.solver.MaxFlowSolver;
import com.flow.x.solver.decider.MaxFlowSolverSelector;
import com.flow.x.validation.FlowNetworkValidator;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class MaxFlowServiceImpl implements MaxFlowService {

    private final MaxFlowSolverSelector solverSelector;
    private final FlowNetworkBuilder networkBuilder;
    private final SolverConfig solverConfig;
    private final MaxFlowMetrics metrics;
    private final Validator validator;
    private final Executor maxFlowExecutor;

    public MaxFlowServiceImpl(
            MaxFlowSolverSelector solverSelector,
            FlowNetworkBuilder networkBuilder,
            SolverConfig solverConfig,
            MaxFlowMetrics metrics,
            Validator validator,
            @Qualifier("maxFlowExecutor") Executor maxFlowExecutor
    ) {
        this.solverSelector = solverSelector;
        this.networkBuilder = networkBuilder;
        this.solverConfig = solverConfig;
        this.metrics = metrics;
        this.validator = validator;
        this.maxFlowExecutor = maxFlowExecutor;
    }

    @Override
    public MaxFlowResult solve(MaxFlowRequest request) {
        String algorithm = solverConfig.getAlgorithm();
        MaxFlowSolver solver;
        FlowNetwork network;
        try {
            FlowNetworkValidator.validate(request, validator, solverConfig.getMaxNodes(), solverConfig.getMaxEdges());
            solver = solverSelector.select(algorithm);
            network = networkBuilder.build(request);
        } catch (BadRequestException e) {
            log.warn("Rejected max-flow request: {}", e.getMessage());
            metrics.recordRejected("validation");
            throw e;
        }

        long start = System.nanoTime();
        MaxFlowResult result;
        try {
            result = solver.solve(network, request.getSource(), request.getSink());
        } catch (RuntimeException e) {
            metrics.recordFailure(algorithm);
            throw e;
        }
        long elapsed = System.nanoTime() - start;

        metrics.recordSolve(algorithm, elapsed, result.getStats());
        log.info("Solved max flow with {}: source={}, sink={}, nodes={}, edges={}, maxFlow={}, pushes={}, relabels={}, took {} ms",
                algorithm, request.getSource(), request.getSink(), request.getNodeCount(), request.getEdges().size(),
                result.getMaxFlow(), result.getStats().getPushes(), result.getStats().getRelabels(), elapsed / 1_000_000);
        return result;
    }

    @Override
    public CompletableFuture<MaxFlowResult> solveAsync(MaxFlowRequest request) {
        return CompletableFuture.supplyAsync(() -> solve(request), maxFlowExecutor)
                .whenComplete((result, throwable) -> {
                    if (throwable != null) {
                        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                                ? throwable.getCause() : throwable;
                        log.error("Async max-flow solve failed: {}", cause.getMessage());
                    }
                });
    }
}
