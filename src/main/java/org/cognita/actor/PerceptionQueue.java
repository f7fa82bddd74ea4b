package org.cognita.actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded FIFO of perceptions. When full, the oldest perception is dropped to make room and
 * the drop is counted; offering never blocks and never fails.
 */
public class PerceptionQueue {

    private static final Logger LOG = LoggerFactory.getLogger(PerceptionQueue.class);

    private final int capacity;
    private final Deque<Perception> queue;
    private final AtomicLong dropped = new AtomicLong();

    public PerceptionQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(capacity);
    }

    /**
     * Appends a perception, dropping the oldest one if the queue is full.
     * @return true if an older perception was dropped.
     */
    public synchronized boolean offer(Perception perception) {
        boolean overflow = false;
        if (queue.size() >= capacity) {
            queue.pollFirst();
            long total = dropped.incrementAndGet();
            overflow = true;
            LOG.debug("Perception queue full (capacity {}), dropped oldest ({} dropped in total)", capacity, total);
        }
        queue.addLast(perception);
        return overflow;
    }

    /**
     * Removes and returns all queued perceptions, oldest first.
     */
    public synchronized List<Perception> drain() {
        List<Perception> drained = new ArrayList<>(queue);
        queue.clear();
        return drained;
    }

    public synchronized int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public long getDroppedCount() {
        return dropped.get();
    }
}
