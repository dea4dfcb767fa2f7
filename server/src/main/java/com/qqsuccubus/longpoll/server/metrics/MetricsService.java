package com.qqsuccubus.longpoll.server.metrics;

import com.qqsuccubus.longpoll.core.metrics.MetricsNames;
import com.qqsuccubus.longpoll.core.metrics.MetricsTags;
import com.qqsuccubus.longpoll.server.config.ServerConfig;
import com.qqsuccubus.longpoll.server.poll.PollOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.util.EnumMap;
import java.util.Map;

/**
 * Centralized metrics for the event server.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    private final Counter collapsed;
    private final Counter allocated;
    private final Counter removedExpired;
    private final Counter removedDisconnect;
    private final Map<PollOutcome, Counter> polls = new EnumMap<>(PollOutcome.class);

    public MetricsService(MeterRegistry registry, ServerConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        collapsed = Counter.builder(MetricsNames.QUEUE_COLLAPSED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Events that replaced a live event of the same collapsing key")
            .register(registry);

        allocated = Counter.builder(MetricsNames.REGISTRY_ALLOCATED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Client queues allocated")
            .register(registry);

        removedExpired = Counter.builder(MetricsNames.REGISTRY_REMOVED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "expired")
            .description("Client queues garbage collected after idling")
            .register(registry);

        removedDisconnect = Counter.builder(MetricsNames.REGISTRY_REMOVED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "disconnect")
            .description("Client queues removed by the client")
            .register(registry);

        for (PollOutcome outcome : PollOutcome.values()) {
            polls.put(outcome, Counter.builder(MetricsNames.POLL_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.OUTCOME, outcome.getTag())
                .description("Completed long-poll calls")
                .register(registry));
        }
    }

    /**
     * Exposes the number of live client queues as a gauge.
     *
     * @param clients the registry's queue table
     */
    public void registerQueueGauge(Map<?, ?> clients) {
        Gauge.builder(MetricsNames.REGISTRY_QUEUES, clients, Map::size)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Live client queues")
            .register(registry);
    }

    public void recordEnqueued(String eventType) {
        // Tagged per type, so built lazily; Micrometer returns the existing meter on repeat calls.
        Counter.builder(MetricsNames.QUEUE_ENQUEUED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, eventType)
            .register(registry)
            .increment();
    }

    public void recordCollapsed() {
        collapsed.increment();
    }

    public void recordAllocated() {
        allocated.increment();
    }

    public void recordExpired(int count) {
        removedExpired.increment(count);
    }

    public void recordDisconnect() {
        removedDisconnect.increment();
    }

    public void recordPoll(PollOutcome outcome) {
        polls.get(outcome).increment();
    }

    public double getPollCount(PollOutcome outcome) {
        return polls.get(outcome).count();
    }

    public double getCollapsedCount() {
        return collapsed.count();
    }
}
