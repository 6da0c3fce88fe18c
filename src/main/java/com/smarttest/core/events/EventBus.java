package com.smarttest.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process {@link EventChannel}: fans pipeline events out to listeners of one run and to
 * listeners of every run, in that order.
 * <p>
 * A run emits nothing after {@code pipeline:completed} or {@code pipeline:error}, so its
 * listeners are released once that event has been delivered. Listener failures are logged and
 * counted, never returned to the publisher.
 */
@Service
public class EventBus implements EventChannel {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final Set<PipelineEventType> ALL_TYPES = EnumSet.allOf(PipelineEventType.class);

    static final int DEFAULT_QUEUE_CAPACITY = 256;

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Listener>> byRun = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Listener> everyRun = new CopyOnWriteArrayList<>();
    private final AtomicLong failedDeliveries = new AtomicLong();
    private final int queueCapacity;

    public EventBus() {
        this(DEFAULT_QUEUE_CAPACITY);
    }

    @Autowired
    public EventBus(@Value("${smarttest.events.queue-capacity:256}") int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    private record Listener(Set<PipelineEventType> types, Consumer<PipelineEvent> consumer) {

        boolean wants(PipelineEvent event) {
            return types.contains(event.type());
        }
    }

    @Override
    public void publish(PipelineEvent event) {
        log.debug("Publishing {} for run {}", event.type().wireName(), event.runId());

        List<Listener> runListeners = byRun.get(event.runId());
        if (runListeners != null) {
            runListeners.stream().filter(l -> l.wants(event)).forEach(l -> deliver(l, event));
        }
        everyRun.stream().filter(l -> l.wants(event)).forEach(l -> deliver(l, event));

        if (event.type().endsPipeline() && byRun.remove(event.runId()) != null) {
            log.debug("Released listeners of finished run {}", event.runId());
        }
    }

    public Subscription subscribe(String runId, Consumer<PipelineEvent> consumer) {
        return subscribe(runId, ALL_TYPES, consumer);
    }

    /**
     * Listens to events of {@code types} for one run until the run finishes or the subscription
     * is cancelled.
     */
    public Subscription subscribe(String runId, Set<PipelineEventType> types, Consumer<PipelineEvent> consumer) {
        var listener = new Listener(EnumSet.copyOf(types), consumer);
        byRun.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> byRun.computeIfPresent(runId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        var listener = new Listener(ALL_TYPES, consumer);
        everyRun.add(listener);
        return () -> everyRun.remove(listener);
    }

    /**
     * Buffers the events of {@code runId} for a pull-style consumer, up to the configured capacity.
     */
    public BoundedEventQueue watch(String runId) {
        return watch(runId, queueCapacity);
    }

    public BoundedEventQueue watch(String runId, int capacity) {
        var queue = new BoundedEventQueue(capacity);
        subscribe(runId, queue);
        return queue;
    }

    public int listenerCount(String runId) {
        List<Listener> listeners = byRun.get(runId);
        return listeners == null ? 0 : listeners.size();
    }

    public long failedDeliveries() {
        return failedDeliveries.get();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Listener listener, PipelineEvent event) {
        try {
            listener.consumer().accept(event);
        } catch (Exception e) {
            failedDeliveries.incrementAndGet();
            log.warn("Listener failed on {} for run {}: {}",
                    event.type().wireName(), event.runId(), e.getMessage(), e);
        }
    }
}
