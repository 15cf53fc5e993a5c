package com.flow.x.metrics;

import com.flow.x.dto.SolverStats;
import com.flow.x.utils.basic.Constant;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MaxFlowMetrics {
    private final MeterRegistry meterRegistry;

    public MaxFlowMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordSolve(String algorithm, long durationNanos, SolverStats stats) {
        meterRegistry.timer("max_flow_solve_duration", Constant.ALGORITHM, algorithm)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        meterRegistry.counter("max_flow_solved", Constant.ALGORITHM, algorithm).increment();
        summary("max_flow_pushes", "Pushes per solve", algorithm).record(stats.getPushes());
        summary("max_flow_relabels", "Relabels per solve", algorithm).record(stats.getRelabels());
        if (stats.getDeadEnds() > 0) {
            meterRegistry.counter("max_flow_dead_ends", Constant.ALGORITHM, algorithm).increment(stats.getDeadEnds());
        }
    }

    public void recordRejected(String reason) {
        meterRegistry.counter("max_flow_rejected", Constant.REASON, reason).increment();
    }

    public void recordFailure(String algorithm) {
        meterRegistry.counter("max_flow_failed", Constant.ALGORITHM, algorithm).increment();
    }

    private DistributionSummary summary(String name, String description, String algorithm) {
        return DistributionSummary.builder(name)
                .description(description)
                .tag(Constant.ALGORITHM, algorithm)
                .register(meterRegistry);
    }
}
