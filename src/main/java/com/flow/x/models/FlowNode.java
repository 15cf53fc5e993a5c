package com.flow.x.models;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Vertex of a {@link FlowNetwork}. Adjacency holds arena indices of outgoing edges, never copies.
 * <p>
 * {@code height}, {@code excess} and {@code currentArc} belong to the solver while a run is in
 * progress; {@code currentArc} is the position the next push scan resumes from.
 * </p>
 */
@Getter
@Setter
@ToString(exclude = "adjacency")
public class FlowNode {
    private final int id;
    private int height;
    private long excess;
    private int currentArc;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<Integer> adjacency = new ArrayList<>();

    public FlowNode(int id) {
        this.id = id;
    }

    public List<Integer> getAdjacency() {
        return Collections.unmodifiableList(adjacency);
    }

    public int degree() {
        return adjacency.size();
    }

    public int edgeAt(int position) {
        return adjacency.get(position);
    }

    void attach(int edgeIndex) {
        adjacency.add(edgeIndex);
    }
}
