package com.qqsuccubus.longpoll.server.registry;

import com.qqsuccubus.longpoll.core.error.InvalidFilterException;
import com.qqsuccubus.longpoll.core.error.QueueNotFoundException;
import com.qqsuccubus.longpoll.server.client.ClientDescriptor;
import com.qqsuccubus.longpoll.server.client.ClientRegistration;
import com.qqsuccubus.longpoll.server.config.ServerConfig;
import com.qqsuccubus.longpoll.server.metrics.MetricsService;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory queue registry.
 * <p>
 * Lookups and fan-out reads are lock-free over concurrent maps; the table lock is taken only
 * while a descriptor is added to or removed from the table and its indexes.
 * </p>
 * <p>
 * Queue ids are {@code <generation>:<counter>}, where the generation is fixed for the life of
 * the process, so ids handed out before a restart are never valid afterwards.
 * </p>
 */
public class QueueRegistry implements IQueueRegistry {
    private static final Logger log = LoggerFactory.getLogger(QueueRegistry.class);

    private final ServerConfig config;
    private final StreamDirectory streams;
    private final MetricsService metricsService;
    private final Clock clock;
    @Getter
    private final String serverGeneration;

    private final AtomicLong nextQueueNumber = new AtomicLong();
    private final Object tableLock = new Object();

    // queueId -> descriptor
    private final Map<String, ClientDescriptor> clients = new ConcurrentHashMap<>();
    // principalId -> that principal's descriptors
    private final Map<Long, Set<ClientDescriptor>> byPrincipal = new ConcurrentHashMap<>();
    // realmId -> descriptors registered with all_public_streams
    private final Map<Long, Set<ClientDescriptor>> allPublicStreamsByRealm = new ConcurrentHashMap<>();

    private Disposable sweeper;

    public QueueRegistry(ServerConfig config, StreamDirectory streams, MetricsService metricsService, Clock clock) {
        this(config, streams, metricsService, clock, Long.toString(clock.millis()));
    }

    public QueueRegistry(ServerConfig config,
                         StreamDirectory streams,
                         MetricsService metricsService,
                         Clock clock,
                         String serverGeneration) {
        this.config = config;
        this.streams = streams;
        this.metricsService = metricsService;
        this.clock = clock;
        this.serverGeneration = serverGeneration;
        metricsService.registerQueueGauge(clients);
    }

    @Override
    public ClientDescriptor allocate(ClientRegistration registration) {
        for (String streamName : registration.getNarrow().streamNames()) {
            if (!streams.streamExists(registration.getRealmId(), streamName)) {
                log.warn("Rejecting registration of principal {}: unknown stream '{}' in narrow",
                    registration.getPrincipalId(), streamName);
                throw new InvalidFilterException("Invalid narrow: stream '" + streamName + "' does not exist");
            }
        }

        String queueId = serverGeneration + ":" + nextQueueNumber.getAndIncrement();
        Duration lifespan = registration.getLifespan() != null
            ? registration.getLifespan()
            : config.getQueueIdleTimeout();
        ClientDescriptor descriptor = new ClientDescriptor(
            queueId, registration, lifespan, config.getMarkerResetScope(), clock.instant());

        synchronized (tableLock) {
            clients.put(queueId, descriptor);
            byPrincipal.computeIfAbsent(descriptor.getPrincipalId(), id -> ConcurrentHashMap.newKeySet())
                .add(descriptor);
            if (descriptor.isAllPublicStreams()) {
                allPublicStreamsByRealm.computeIfAbsent(descriptor.getRealmId(), id -> ConcurrentHashMap.newKeySet())
                    .add(descriptor);
            }
        }

        metricsService.recordAllocated();
        log.info("Allocated queue {} for principal {} (client={}, types={}, narrow={})",
            queueId, descriptor.getPrincipalId(), descriptor.getClientName(),
            descriptor.getEventTypes(), descriptor.getNarrow().toJson());
        return descriptor;
    }

    @Override
    public ClientDescriptor lookup(String queueId, long principalId) {
        ClientDescriptor descriptor = queueId == null ? null : clients.get(queueId);
        if (descriptor == null || descriptor.getPrincipalId() != principalId) {
            // Foreign queues are reported exactly like unknown ones.
            log.warn("Bad event queue id {} for principal {}", queueId, principalId);
            throw new QueueNotFoundException(queueId);
        }
        return descriptor;
    }

    @Override
    public void remove(String queueId, long principalId) {
        ClientDescriptor descriptor = lookup(queueId, principalId);
        if (unindex(descriptor)) {
            metricsService.recordDisconnect();
            log.info("Queue {} disconnected by principal {}", queueId, principalId);
        }
    }

    @Override
    public int sweep(Instant now) {
        // Snapshot of the table; a descriptor may receive a push while it is being removed,
        // which only means the event is dropped with the queue.
        List<ClientDescriptor> expired = clients.values().stream()
            .filter(descriptor -> descriptor.isExpired(now))
            .toList();

        int removed = 0;
        for (ClientDescriptor descriptor : expired) {
            if (unindex(descriptor)) {
                removed++;
            }
        }
        if (removed > 0) {
            metricsService.recordExpired(removed);
            log.info("Garbage collected {} idle queues, {} remaining", removed, clients.size());
        }
        return removed;
    }

    private boolean unindex(ClientDescriptor descriptor) {
        synchronized (tableLock) {
            if (!clients.remove(descriptor.getQueueId(), descriptor)) {
                return false;
            }
            removeFromIndex(byPrincipal, descriptor.getPrincipalId(), descriptor);
            removeFromIndex(allPublicStreamsByRealm, descriptor.getRealmId(), descriptor);
        }
        descriptor.disconnect();
        return true;
    }

    private static void removeFromIndex(Map<Long, Set<ClientDescriptor>> index, long key, ClientDescriptor descriptor) {
        Set<ClientDescriptor> descriptors = index.get(key);
        if (descriptors != null) {
            descriptors.remove(descriptor);
            if (descriptors.isEmpty()) {
                index.remove(key);
            }
        }
    }

    @Override
    public Collection<ClientDescriptor> clientsFor(long principalId) {
        return List.copyOf(byPrincipal.getOrDefault(principalId, Set.of()));
    }

    @Override
    public Collection<ClientDescriptor> allPublicStreamsClients(long realmId) {
        return List.copyOf(allPublicStreamsByRealm.getOrDefault(realmId, Set.of()));
    }

    @Override
    public Collection<ClientDescriptor> all() {
        return new ArrayList<>(clients.values());
    }

    @Override
    public int size() {
        return clients.size();
    }

    /**
     * Starts the periodic idle sweep.
     */
    public Disposable start() {
        Duration interval = config.getQueueGcInterval();
        sweeper = Flux.interval(interval, interval)
            .subscribe(
                tick -> sweep(clock.instant()),
                err -> log.error("Queue sweeper stopped", err)
            );
        log.info("Queue sweeper started, interval={}", interval);
        return sweeper;
    }

    /**
     * Stops the sweeper and disconnects every client.
     */
    public void teardown() {
        if (sweeper != null) {
            sweeper.dispose();
        }
        List<ClientDescriptor> remaining = List.copyOf(clients.values());
        remaining.forEach(this::unindex);
        log.info("Queue registry torn down, {} queues released", remaining.size());
    }
}
