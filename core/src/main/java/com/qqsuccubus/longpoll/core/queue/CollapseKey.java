package com.qqsuccubus.longpoll.core.queue;

import com.qqsuccubus.longpoll.core.model.Event;
import com.qqsuccubus.longpoll.core.model.EventType;

import java.util.Optional;

/**
 * Identity under which events of a collapsible type replace each other.
 * <p>
 * {@code pointer} and {@code restart} collapse by type alone. Flag updates collapse only
 * when they change the same flag in the same direction with the same {@code all} scope.
 * </p>
 */
record CollapseKey(String type, String flag, String operation, boolean all) {

    static Optional<CollapseKey> of(Event event) {
        Optional<EventType> kind = event.kind();
        if (kind.isEmpty()) {
            return Optional.empty();
        }
        return switch (kind.get()) {
            case POINTER, RESTART -> Optional.of(new CollapseKey(event.getType(), null, null, false));
            case UPDATE_MESSAGE_FLAGS -> Optional.of(new CollapseKey(
                event.getType(),
                event.text("flag"),
                event.text("operation"),
                event.get("all").asBoolean(false)
            ));
            case MESSAGE, UPDATE_MESSAGE, REALM_USER, REALM_BOT, SUBSCRIPTION, STREAM, REALM,
                REALM_EMOJI, REALM_FILTERS, ALERT_WORDS, MUTED_TOPICS -> Optional.empty();
        };
    }

    boolean isFlagKey() {
        return EventType.UPDATE_MESSAGE_FLAGS.getWireName().equals(type);
    }

    boolean isMarkerKey() {
        return EventType.RESTART.getWireName().equals(type);
    }
}
