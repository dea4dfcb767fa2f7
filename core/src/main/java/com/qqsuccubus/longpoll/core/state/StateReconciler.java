package com.qqsuccubus.longpoll.core.state;

import com.qqsuccubus.longpoll.core.error.UnhandledEventTypeException;
import com.qqsuccubus.longpoll.core.model.Event;
import com.qqsuccubus.longpoll.core.model.EventType;
import com.qqsuccubus.longpoll.core.model.Narrow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds initial-state snapshots and replays events onto them.
 * <p>
 * <b>Contract:</b> for any set of actions, applying the events they emitted (in order) to a
 * snapshot taken before the actions yields a snapshot that {@link Snapshot#matches matches}
 * one fetched after them.
 * </p>
 * <p>
 * Transforms are looked up in a table with exactly one entry per {@link EventType}; an event
 * whose type is not a known kind fails with {@link UnhandledEventTypeException}.
 * </p>
 */
public class StateReconciler {
    private static final Logger log = LoggerFactory.getLogger(StateReconciler.class);

    private final SnapshotSource source;
    private final Map<EventType, EventApplier> transforms = new EnumMap<>(EventType.class);

    public StateReconciler(SnapshotSource source) {
        this.source = source;
        for (EventType type : EventType.values()) {
            transforms.put(type, transformFor(type));
        }
    }

    /**
     * Fetches a fresh snapshot with the sections relevant to {@code eventTypes}.
     *
     * @param principalId principal whose view is fetched
     * @param eventTypes  wire names the client registered for, empty for all
     * @param narrow      the client's narrow
     */
    public Snapshot snapshot(long principalId, Collection<String> eventTypes, Narrow narrow) {
        Set<EventType> wanted = wantedTypes(eventTypes);
        log.debug("Fetching snapshot for principal {} with {}", principalId, wanted);
        return new Snapshot(source.fetchSections(principalId, wanted, narrow));
    }

    /**
     * Folds {@code events} into {@code snapshot}, in order.
     *
     * @throws UnhandledEventTypeException for an event this reconciler cannot replay
     */
    public void apply(Snapshot snapshot, List<Event> events) {
        for (Event event : events) {
            EventType kind = event.kind().orElseThrow(() ->
                new UnhandledEventTypeException("No state transform for event type " + event.getType()));
            transforms.get(kind).apply(snapshot.state(), event);
        }
    }

    /**
     * Known kinds among {@code eventTypes}; every kind when the collection is empty or null.
     */
    public static Set<EventType> wantedTypes(Collection<String> eventTypes) {
        if (eventTypes == null || eventTypes.isEmpty()) {
            return EnumSet.allOf(EventType.class);
        }
        Set<EventType> wanted = EnumSet.noneOf(EventType.class);
        eventTypes.forEach(name -> EventType.fromWireName(name).ifPresent(wanted::add));
        return wanted;
    }

    private static EventApplier transformFor(EventType type) {
        return switch (type) {
            case MESSAGE -> StateTransforms::message;
            case POINTER -> StateTransforms::pointer;
            case UPDATE_MESSAGE, UPDATE_MESSAGE_FLAGS, RESTART -> StateTransforms::noStateChange;
            case REALM_USER -> StateTransforms::realmUser;
            case REALM_BOT -> StateTransforms::realmBot;
            case SUBSCRIPTION -> StateTransforms::subscription;
            case STREAM -> StateTransforms::stream;
            case REALM -> StateTransforms::realm;
            case REALM_EMOJI -> StateTransforms::realmEmoji;
            case REALM_FILTERS -> StateTransforms::realmFilters;
            case ALERT_WORDS -> StateTransforms::alertWords;
            case MUTED_TOPICS -> StateTransforms::mutedTopics;
        };
    }
}
