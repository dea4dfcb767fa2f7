package com.qqsuccubus.longpoll.server.client;

import com.qqsuccubus.longpoll.core.model.Event;
import com.qqsuccubus.longpoll.core.model.EventType;
import com.qqsuccubus.longpoll.core.model.Narrow;
import com.qqsuccubus.longpoll.core.queue.EventQueue;
import com.qqsuccubus.longpoll.core.queue.MarkerResetScope;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A registered client: its event queue, its filters and its idle-lifetime bookkeeping.
 * <p>
 * Blocked polls wait on {@link #awaitEvents(long)}. Every push emits the new event id on a
 * multicast sink while the descriptor is locked, so a waiter that subscribed before
 * checking the queue cannot miss an event.
 * </p>
 */
@Getter
public class ClientDescriptor {
    private static final Logger log = LoggerFactory.getLogger(ClientDescriptor.class);

    private final String queueId;
    private final long principalId;
    private final long realmId;
    private final Set<String> eventTypes;
    private final String clientName;
    private final boolean applyMarkdown;
    private final boolean allPublicStreams;
    private final Duration lifespan;
    private final Narrow narrow;
    private final Instant createdAt;
    private final EventQueue eventQueue;

    private volatile Instant lastAccess;
    private volatile boolean closed;

    // Wake signal for pending polls: carries the id of the event just pushed.
    @Getter(lombok.AccessLevel.NONE)
    private final Sinks.Many<Long> wakeups = Sinks.many().multicast().directBestEffort();
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicInteger pendingPolls = new AtomicInteger();

    public ClientDescriptor(String queueId,
                            ClientRegistration registration,
                            Duration lifespan,
                            MarkerResetScope markerResetScope,
                            Instant now) {
        this.queueId = queueId;
        this.principalId = registration.getPrincipalId();
        this.realmId = registration.getRealmId();
        this.eventTypes = Set.copyOf(registration.getEventTypes());
        this.clientName = registration.getClientName();
        this.applyMarkdown = registration.isApplyMarkdown();
        this.allPublicStreams = registration.isAllPublicStreams();
        this.lifespan = lifespan;
        this.narrow = registration.getNarrow();
        this.createdAt = now;
        this.lastAccess = now;
        this.eventQueue = new EventQueue(queueId, markerResetScope);
    }

    /**
     * Whether this client wants {@code event}: its type is in the allow-list (or the list is
     * empty) and, for messages, the message matches the narrow.
     */
    public boolean accepts(Event event) {
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.getType())) {
            return false;
        }
        if (event.is(EventType.MESSAGE)) {
            return narrow.matches(event.get("message"));
        }
        return true;
    }

    public boolean wantsMessages() {
        return eventTypes.isEmpty() || eventTypes.contains(EventType.MESSAGE.getWireName());
    }

    public Delivery registerEvent(Event event) {
        return registerEvents(List.of(event)).get(0);
    }

    /**
     * Offers events in order, with no other push interleaved between them.
     *
     * @return the outcome for each event, in order
     */
    public synchronized List<Delivery> registerEvents(List<Event> events) {
        return events.stream().map(this::push).toList();
    }

    private Delivery push(Event event) {
        if (!accepts(event)) {
            return Delivery.FILTERED;
        }
        long collapsedBefore = eventQueue.getCollapsedCount();
        long id = eventQueue.push(event);
        // Zero subscribers just means nobody is waiting right now.
        Sinks.EmitResult result = wakeups.tryEmitNext(id);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Wakeup for queue {} not delivered: {}", queueId, result);
        }
        return eventQueue.getCollapsedCount() > collapsedBefore ? Delivery.COLLAPSED : Delivery.ENQUEUED;
    }

    public List<Event> eventsAfter(long lastEventId) {
        return eventQueue.eventsAfter(lastEventId);
    }

    public List<Event> contents() {
        return eventQueue.contents();
    }

    public int prune(long throughId) {
        return eventQueue.prune(throughId);
    }

    /**
     * Completes with the events after {@code lastEventId} as soon as there are any.
     * Completes empty when the descriptor is disconnected first; never times out on its own.
     */
    public Mono<List<Event>> awaitEvents(long lastEventId) {
        // Subscribe to wakeups before the first check; every signal triggers a re-check.
        return Flux.merge(wakeups.asFlux(), Mono.just(lastEventId))
            .map(signal -> eventQueue.eventsAfter(lastEventId))
            .filter(events -> !events.isEmpty())
            .next()
            .doOnSubscribe(s -> pendingPolls.incrementAndGet())
            .doFinally(signal -> pendingPolls.decrementAndGet());
    }

    public int getPendingPolls() {
        return pendingPolls.get();
    }

    public void touch(Instant now) {
        lastAccess = now;
    }

    /**
     * Idle for longer than its lifespan, with no poll pending.
     */
    public boolean isExpired(Instant now) {
        return pendingPolls.get() == 0 && Duration.between(lastAccess, now).compareTo(lifespan) > 0;
    }

    /**
     * Releases pending polls; they complete with whatever is queued.
     */
    public void disconnect() {
        closed = true;
        wakeups.tryEmitComplete();
    }
}
