package com.flow.x.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Directed edge of a residual network, stored in the {@link FlowNetwork} edge arena.
 * <p>
 * Every user edge u -> v is created together with a synthetic twin v -> u of capacity 0.
 * The twin is addressed by {@link #getTwinIndex()} and always carries the negated flow.
 * Flow only changes through {@link FlowNetwork#applyFlow(int, long)}, which updates both sides.
 * </p>
 */
@Getter
@ToString
@Builder(access = AccessLevel.PACKAGE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FlowEdge {
    private final int index;
    private final int from;
    private final int to;
    private final long capacity;
    private final boolean reverse;
    private final int twinIndex;
    private long flow;

    public long residualCapacity() {
        return capacity - flow;
    }

    void addFlow(long delta) {
        this.flow = Math.addExact(flow, delta);
    }
}
