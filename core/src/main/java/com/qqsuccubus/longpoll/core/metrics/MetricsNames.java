package com.qqsuccubus.longpoll.core.metrics;

/**
 * Micrometer metric names used by the event server.
 * <p>
 * <b>Naming convention:</b> {@code events.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Events pushed into client queues.
     * <p>
     * Tags: nodeId, type (event type)
     * </p>
     */
    public static final String QUEUE_ENQUEUED_TOTAL = "events.queue.enqueued.total";

    /**
     * Counter: Events that replaced a live representative of the same collapsing key.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String QUEUE_COLLAPSED_TOTAL = "events.queue.collapsed.total";

    /**
     * Counter: Completed long-poll calls.
     * <p>
     * Tags: nodeId, outcome (immediate/woken/timeout)
     * </p>
     */
    public static final String POLL_TOTAL = "events.poll.total";

    /**
     * Counter: Client descriptors allocated.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String REGISTRY_ALLOCATED_TOTAL = "events.registry.allocated.total";

    /**
     * Counter: Client descriptors removed, by reason (expired/disconnect).
     * <p>
     * Tags: nodeId, reason
     * </p>
     */
    public static final String REGISTRY_REMOVED_TOTAL = "events.registry.removed.total";

    /**
     * Gauge: Live client descriptors.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String REGISTRY_QUEUES = "events.registry.queues";
}
