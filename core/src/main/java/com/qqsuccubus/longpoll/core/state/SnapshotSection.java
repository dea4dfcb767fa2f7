package com.qqsuccubus.longpoll.core.state;

import com.qqsuccubus.longpoll.core.model.EventType;
import lombok.Getter;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Named sections of a state snapshot, the event type that keeps each one current, and, for
 * list sections whose order is not meaningful, the field that identifies an entry.
 */
@Getter
public enum SnapshotSection {
    ALERT_WORDS("alert_words", EventType.ALERT_WORDS, null),
    MAX_MESSAGE_ID("max_message_id", EventType.MESSAGE, null),
    MUTED_TOPICS("muted_topics", EventType.MUTED_TOPICS, null),
    POINTER("pointer", EventType.POINTER, null),
    REALM_USERS("realm_users", EventType.REALM_USER, "email"),
    EMAIL("email", EventType.REALM_USER, null),
    FULL_NAME("full_name", EventType.REALM_USER, null),
    IS_ADMIN("is_admin", EventType.REALM_USER, null),
    REALM_BOTS("realm_bots", EventType.REALM_BOT, "email"),
    SUBSCRIPTIONS("subscriptions", EventType.SUBSCRIPTION, "name"),
    UNSUBSCRIBED("unsubscribed", EventType.SUBSCRIPTION, "name"),
    NEVER_SUBSCRIBED("never_subscribed", EventType.SUBSCRIPTION, "name"),
    REALM_NAME("realm_name", EventType.REALM, null),
    REALM_EMOJI("realm_emoji", EventType.REALM_EMOJI, null),
    REALM_FILTERS("realm_filters", EventType.REALM_FILTERS, null);

    private final String key;
    private final EventType source;
    private final String identityField;

    SnapshotSection(String key, EventType source, String identityField) {
        this.key = key;
        this.source = source;
        this.identityField = identityField;
    }

    public boolean isKeyed() {
        return identityField != null;
    }

    /**
     * Sections a client registered for {@code wanted} event types receives.
     */
    public static List<SnapshotSection> wantedBy(Collection<EventType> wanted) {
        return Arrays.stream(values())
            .filter(section -> wanted.contains(section.source))
            .toList();
    }
}
