package com.qqsuccubus.longpoll.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.util.JsonUtils;
import lombok.EqualsAndHashCode;

import java.util.Objects;
import java.util.Optional;

/**
 * One event as delivered to a client: a flat JSON object with a {@code type}, an
 * {@code id} assigned by the owning queue, and type-specific fields.
 * <p>
 * Instances are immutable. The payload is copied on the way in and every accessor
 * hands out copies, so a queue, a snapshot and a serializer can all hold the same
 * event without sharing mutable JSON.
 * </p>
 */
@EqualsAndHashCode
public final class Event {
    public static final String ID = "id";
    public static final String TYPE = "type";

    /**
     * Id of an event that has not been pushed to a queue yet.
     */
    public static final long UNASSIGNED = -1L;

    private final long id;
    private final String type;
    private final ObjectNode fields;

    private Event(long id, String type, ObjectNode fields) {
        this.id = id;
        this.type = type;
        this.fields = fields;
    }

    /**
     * Creates an unassigned event. {@code id} and {@code type} keys in {@code fields} are ignored.
     */
    public static Event of(String type, ObjectNode fields) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Event type is required");
        }
        ObjectNode copy = fields == null ? JsonUtils.object() : fields.deepCopy();
        copy.remove(ID);
        copy.remove(TYPE);
        return new Event(UNASSIGNED, type, copy);
    }

    public static Event of(EventType type, ObjectNode fields) {
        return of(type.getWireName(), fields);
    }

    /**
     * Reads a flat event object, keeping its {@code id} when present.
     */
    public static Event fromJson(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Event must be a JSON object");
        }
        Event event = of(json.path(TYPE).asText(null), (ObjectNode) json);
        JsonNode id = json.get(ID);
        return id != null && id.canConvertToLong() ? event.withId(id.asLong()) : event;
    }

    public long getId() {
        return id;
    }

    public boolean hasId() {
        return id != UNASSIGNED;
    }

    public String getType() {
        return type;
    }

    /**
     * Known kind of this event, empty for types this server does not model.
     */
    public Optional<EventType> kind() {
        return EventType.fromWireName(type);
    }

    public boolean is(EventType kind) {
        return kind.getWireName().equals(type);
    }

    public boolean has(String field) {
        return fields.has(field);
    }

    /**
     * Copy of a payload field, {@code MissingNode} when absent.
     */
    public JsonNode get(String field) {
        return fields.path(field).deepCopy();
    }

    /**
     * Text value of a payload field, {@code null} when absent or JSON null.
     */
    public String text(String field) {
        JsonNode node = fields.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    public ObjectNode fieldsCopy() {
        return fields.deepCopy();
    }

    public Event withId(long newId) {
        return new Event(newId, type, fields);
    }

    /**
     * Same id and type, new payload.
     */
    public Event withFields(ObjectNode newFields) {
        ObjectNode copy = Objects.requireNonNull(newFields, "fields").deepCopy();
        copy.remove(ID);
        copy.remove(TYPE);
        return new Event(id, type, copy);
    }

    /**
     * Wire form: {@code type}, {@code id} (when assigned) and the payload fields, all at the top level.
     */
    @JsonValue
    public ObjectNode toJson() {
        ObjectNode json = JsonUtils.object();
        json.put(TYPE, type);
        if (hasId()) {
            json.put(ID, id);
        }
        json.setAll(fields.deepCopy());
        return json;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
