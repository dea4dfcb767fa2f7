package com.qqsuccubus.longpoll.core.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every event kind the server knows how to emit and replay.
 * <p>
 * Events travel as flat JSON objects keyed by their {@code type} string; this enum is
 * the typed view of that string. Adding a constant forces the collapsing rules and
 * the state reconciler's transform table to handle it (both switch exhaustively).
 * </p>
 */
@Getter
public enum EventType {
    MESSAGE("message"),
    UPDATE_MESSAGE("update_message"),
    POINTER("pointer"),
    UPDATE_MESSAGE_FLAGS("update_message_flags"),
    RESTART("restart"),
    REALM_USER("realm_user"),
    REALM_BOT("realm_bot"),
    SUBSCRIPTION("subscription"),
    STREAM("stream"),
    REALM("realm"),
    REALM_EMOJI("realm_emoji"),
    REALM_FILTERS("realm_filters"),
    ALERT_WORDS("alert_words"),
    MUTED_TOPICS("muted_topics");

    private static final Map<String, EventType> BY_WIRE_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(EventType::getWireName, Function.identity()));

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public static Optional<EventType> fromWireName(String wireName) {
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
