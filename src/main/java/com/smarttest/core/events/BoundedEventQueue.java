package com.smarttest.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Buffers events for a pull-style consumer. When full, the oldest buffered event is dropped
 * so that a slow consumer never blocks the publisher.
 */
public class BoundedEventQueue implements Consumer<PipelineEvent> {

    private static final Logger log = LoggerFactory.getLogger(BoundedEventQueue.class);

    private final LinkedBlockingDeque<PipelineEvent> buffer;
    private final AtomicLong dropped = new AtomicLong();

    public BoundedEventQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.buffer = new LinkedBlockingDeque<>(capacity);
    }

    @Override
    public void accept(PipelineEvent event) {
        while (!buffer.offerLast(event)) {
            PipelineEvent evicted = buffer.pollFirst();
            if (evicted != null) {
                dropped.incrementAndGet();
                log.warn("Event queue full, dropped {} for run {}", evicted.type().wireName(), evicted.runId());
            }
        }
    }

    /**
     * Waits up to {@code timeout} for the next event; null when none arrived.
     */
    public PipelineEvent poll(Duration timeout) throws InterruptedException {
        return buffer.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<PipelineEvent> drain() {
        var events = new ArrayList<PipelineEvent>();
        buffer.drainTo(events);
        return events;
    }

    public int size() {
        return buffer.size();
    }

    public long droppedCount() {
        return dropped.get();
    }
}
