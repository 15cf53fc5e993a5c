package com.flow.x.processors;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * FIFO of node ids that hold positive excess and still wait for a discharge step.
 * <p>
 * Enqueue does not check membership; the push-relabel loop only enqueues a node when its excess
 * goes from zero to positive, and a queued node always holds positive excess.
 * </p>
 */
public class ActiveNodeQueue {

    private final Deque<Integer> entries;
    private int peakSize;

    public ActiveNodeQueue(int expectedCapacity) {
        this.entries = new ArrayDeque<>(Math.max(1, expectedCapacity));
    }

    public void enqueue(int nodeId) {
        entries.addLast(nodeId);
        if (entries.size() > peakSize) {
            peakSize = entries.size();
        }
    }

    /**
     * Removes and returns the oldest entry.
     *
     * @throws IllegalStateException if the queue is empty; callers check {@link #isEmpty()} first
     */
    public int dequeue() {
        Integer nodeId = entries.pollFirst();
        if (nodeId == null) {
            throw new IllegalStateException("dequeue() called on an empty active-node queue");
        }
        return nodeId;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Linear scan; meant for invariant checks, not for the discharge loop.
     */
    public boolean contains(int nodeId) {
        return entries.contains(nodeId);
    }

    public int getPeakSize() {
        return peakSize;
    }
}
