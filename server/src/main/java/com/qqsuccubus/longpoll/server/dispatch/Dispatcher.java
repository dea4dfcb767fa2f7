package com.qqsuccubus.longpoll.server.dispatch;

import com.qqsuccubus.longpoll.core.model.Event;
import com.qqsuccubus.longpoll.core.model.EventType;
import com.qqsuccubus.longpoll.core.util.JsonUtils;
import com.qqsuccubus.longpoll.server.client.ClientDescriptor;
import com.qqsuccubus.longpoll.server.client.Delivery;
import com.qqsuccubus.longpoll.server.metrics.MetricsService;
import com.qqsuccubus.longpoll.server.registry.IQueueRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fans events out to client descriptors.
 * <p>
 * A batch is first grouped per descriptor, keeping emission order, and each group is pushed
 * under that descriptor's lock in one call. Batches therefore never interleave inside one
 * queue, while different queues are filled independently.
 * </p>
 */
@RequiredArgsConstructor
public class Dispatcher implements EventEmitter {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final IQueueRegistry registry;
    private final MetricsService metricsService;

    @Override
    public void emit(List<Notice> batch) {
        Map<ClientDescriptor, List<Event>> perClient = new LinkedHashMap<>();
        for (Notice notice : batch) {
            for (ClientDescriptor client : targets(notice)) {
                perClient.computeIfAbsent(client, c -> new ArrayList<>())
                    .add(EventProjection.project(notice, client));
            }
        }

        perClient.forEach((client, events) -> {
            List<Delivery> outcomes = client.registerEvents(events);
            for (int i = 0; i < events.size(); i++) {
                record(events.get(i), outcomes.get(i));
            }
        });
        log.debug("Dispatched batch of {} events to {} queues", batch.size(), perClient.size());
    }

    /**
     * Pushes a {@code restart} marker carrying {@code serverGeneration} to every live queue.
     */
    public void broadcastRestart(String serverGeneration) {
        Event restart = Event.of(EventType.RESTART,
            JsonUtils.object().put("server_generation", serverGeneration));
        int notified = 0;
        for (ClientDescriptor client : registry.all()) {
            Delivery outcome = client.registerEvent(restart);
            record(restart, outcome);
            if (outcome != Delivery.FILTERED) {
                notified++;
            }
        }
        log.info("Restart marker for generation {} pushed to {} queues", serverGeneration, notified);
    }

    private Set<ClientDescriptor> targets(Notice notice) {
        Set<ClientDescriptor> targets = new LinkedHashSet<>();
        for (Long principalId : notice.getRecipients()) {
            targets.addAll(registry.clientsFor(principalId));
        }
        if (notice.isPublicStreamMessage()) {
            for (ClientDescriptor client : registry.allPublicStreamsClients(notice.getPublicStreamRealmId())) {
                if (client.wantsMessages()) {
                    targets.add(client);
                }
            }
        }
        return targets;
    }

    private void record(Event event, Delivery outcome) {
        switch (outcome) {
            case ENQUEUED -> metricsService.recordEnqueued(event.getType());
            case COLLAPSED -> {
                metricsService.recordEnqueued(event.getType());
                metricsService.recordCollapsed();
            }
            case FILTERED -> log.trace("Event {} filtered out", event.getType());
        }
    }
}
