package com.qqsuccubus.longpoll.core.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.model.Event;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-client event log with id assignment and type-aware collapsing.
 * <p>
 * <b>Ids:</b> every push takes the next id from a counter that never goes back, so ids of
 * live events strictly increase in queue order and an id dropped by collapsing or
 * pruning is never handed out again.
 * </p>
 * <p>
 * <b>Collapsing:</b> high-frequency state ({@code pointer}, {@code restart},
 * {@code update_message_flags}) keeps one live representative per {@link CollapseKey}.
 * A new push of the same key retires the old representative and appends the merged
 * event at the tail under the new id. A {@code restart} push ends all collapsing that
 * started before it (see {@link MarkerResetScope}).
 * </p>
 * <p>
 * All methods are serialized on the queue instance.
 * </p>
 */
public class EventQueue {
    private static final String MESSAGES = "messages";

    private final String id;
    private final MarkerResetScope markerResetScope;

    // Live events keyed by id; insertion always uses a fresh, larger id so key order is queue order.
    private final NavigableMap<Long, Event> events = new TreeMap<>();
    private final Map<CollapseKey, Long> representatives = new HashMap<>();

    private long nextEventId;
    private long collapsedCount;

    public EventQueue(String id) {
        this(id, MarkerResetScope.ALL_KEYS);
    }

    public EventQueue(String id, MarkerResetScope markerResetScope) {
        this.id = id;
        this.markerResetScope = markerResetScope;
    }

    public String getId() {
        return id;
    }

    /**
     * Appends an event, collapsing it with the live representative of its key if there is one.
     *
     * @param event event without an id (any id it carries is replaced)
     * @return the id assigned to the pushed event
     */
    public synchronized long push(Event event) {
        long eventId = nextEventId++;
        Event assigned = event.withId(eventId);

        Optional<CollapseKey> key = CollapseKey.of(assigned);
        if (key.isPresent()) {
            Long previousId = representatives.put(key.get(), eventId);
            Event previous = previousId == null ? null : events.remove(previousId);
            if (previous != null) {
                assigned = merge(key.get(), previous, assigned);
                collapsedCount++;
            }
            if (key.get().isMarkerKey()) {
                forgetKeysBefore(key.get());
            }
        }

        events.put(eventId, assigned);
        return eventId;
    }

    /**
     * Live events in queue order.
     */
    public synchronized List<Event> contents() {
        return new ArrayList<>(events.values());
    }

    /**
     * Live events with an id strictly greater than {@code lastEventId}; {@code -1} returns everything.
     */
    public synchronized List<Event> eventsAfter(long lastEventId) {
        return new ArrayList<>(events.tailMap(lastEventId, false).values());
    }

    /**
     * Drops every event the client has acknowledged, i.e. ids up to and including {@code throughId}.
     *
     * @return number of events dropped
     */
    public synchronized int prune(long throughId) {
        NavigableMap<Long, Event> acknowledged = events.headMap(throughId, true);
        int dropped = acknowledged.size();
        acknowledged.clear();
        representatives.values().removeIf(representativeId -> representativeId <= throughId);
        return dropped;
    }

    public synchronized boolean empty() {
        return events.isEmpty();
    }

    public synchronized int size() {
        return events.size();
    }

    /**
     * Id the next push will receive.
     */
    public synchronized long getNextEventId() {
        return nextEventId;
    }

    /**
     * Number of pushes that replaced an existing representative.
     */
    public synchronized long getCollapsedCount() {
        return collapsedCount;
    }

    private void forgetKeysBefore(CollapseKey markerKey) {
        representatives.keySet().removeIf(key -> !key.equals(markerKey)
            && (markerResetScope == MarkerResetScope.ALL_KEYS || !key.isFlagKey()));
    }

    private static Event merge(CollapseKey key, Event previous, Event incoming) {
        if (!key.isFlagKey()) {
            return incoming;
        }
        Set<Long> messageIds = new LinkedHashSet<>();
        addMessageIds(messageIds, previous.get(MESSAGES));
        addMessageIds(messageIds, incoming.get(MESSAGES));

        ObjectNode merged = incoming.fieldsCopy();
        ArrayNode messages = merged.putArray(MESSAGES);
        messageIds.forEach(messages::add);
        return incoming.withFields(merged);
    }

    private static void addMessageIds(Collection<Long> target, JsonNode ids) {
        for (JsonNode messageId : ids) {
            target.add(messageId.asLong());
        }
    }
}
