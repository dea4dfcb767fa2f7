package com.qqsuccubus.longpoll.core.state;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.util.JsonUtils;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Point-in-time view of a principal's state, organised in named sections.
 * <p>
 * The reconciler mutates a snapshot in place while replaying events. Two snapshots are
 * compared through {@link #normalized()}, which turns every keyed list section into an
 * object keyed by its identity field, since entry order is not part of the state.
 * </p>
 */
public final class Snapshot {
    private final ObjectNode state;

    public Snapshot(ObjectNode state) {
        this.state = state.deepCopy();
    }

    /**
     * Live state for the reconciler's transforms.
     */
    ObjectNode state() {
        return state;
    }

    public boolean has(String section) {
        return state.has(section);
    }

    public boolean has(SnapshotSection section) {
        return has(section.getKey());
    }

    /**
     * Copy of a section, {@code MissingNode} when the snapshot does not carry it.
     */
    public JsonNode get(String section) {
        return state.path(section).deepCopy();
    }

    public JsonNode get(SnapshotSection section) {
        return get(section.getKey());
    }

    public Set<String> sections() {
        Set<String> names = new LinkedHashSet<>();
        state.fieldNames().forEachRemaining(names::add);
        return names;
    }

    public Snapshot copy() {
        return new Snapshot(state);
    }

    /**
     * State with keyed list sections turned into objects keyed by identity, and numbers
     * in canonical form.
     */
    public ObjectNode normalized() {
        ObjectNode normalized = state.deepCopy();
        for (SnapshotSection section : SnapshotSection.values()) {
            JsonNode list = normalized.get(section.getKey());
            if (section.isKeyed() && list != null && list.isArray()) {
                ObjectNode keyed = JsonUtils.object();
                list.forEach(entry -> keyed.set(entry.path(section.getIdentityField()).asText(), entry));
                normalized.set(section.getKey(), keyed);
            }
        }
        return (ObjectNode) JsonUtils.readTree(normalized.toString());
    }

    /**
     * Equality under {@link #normalized()}.
     */
    public boolean matches(Snapshot other) {
        return normalized().equals(other.normalized());
    }

    @JsonValue
    public ObjectNode toJson() {
        return state.deepCopy();
    }

    @Override
    public String toString() {
        return state.toString();
    }
}
