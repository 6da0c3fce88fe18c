package com.smarttest.core.events;

/**
 * Outbound channel for pipeline events. Delivery is best-effort: implementations must not
 * propagate subscriber failures back to the publisher.
 */
public interface EventChannel {

    void publish(PipelineEvent event);
}
