package com.flow.x.processors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class ActiveNodeQueueTest {

    @Test
    void dequeuesInInsertionOrder() {
        ActiveNodeQueue queue = new ActiveNodeQueue(4);
        queue.enqueue(3);
        queue.enqueue(1);
        queue.enqueue(2);

        assertEquals(3, queue.dequeue());
        assertEquals(1, queue.dequeue());
        queue.enqueue(5);
        assertEquals(2, queue.dequeue());
        assertEquals(5, queue.dequeue());
        assertTrue(queue.isEmpty());
    }

    @Test
    void growsPastInitialCapacity() {
        ActiveNodeQueue queue = new ActiveNodeQueue(2);
        for (int i = 0; i < 50; i++) {
            queue.enqueue(i);
            if (i % 3 == 0) {
                queue.enqueue(queue.dequeue());
            }
        }

        assertEquals(50, queue.size());
        int previous = -1;
        boolean seenRotated = false;
        while (!queue.isEmpty()) {
            int id = queue.dequeue();
            seenRotated |= id < previous;
            previous = id;
        }
        assertTrue(seenRotated);
        assertEquals(50, queue.getPeakSize());
    }

    @Test
    void dequeueOnEmptyQueueIsAProgrammingError() {
        ActiveNodeQueue queue = new ActiveNodeQueue(1);

        assertThrows(IllegalStateException.class, queue::dequeue);
    }

    @Test
    void containsReflectsPendingEntries() {
        ActiveNodeQueue queue = new ActiveNodeQueue(1);
        queue.enqueue(7);

        assertTrue(queue.contains(7));
        queue.dequeue();
        assertFalse(queue.contains(7));
    }
}
