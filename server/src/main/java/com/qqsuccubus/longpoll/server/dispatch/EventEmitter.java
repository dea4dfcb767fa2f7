package com.qqsuccubus.longpoll.server.dispatch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.model.Event;

import java.util.List;
import java.util.Set;

/**
 * Entry point for domain actions that changed state.
 */
public interface EventEmitter {

    /**
     * Delivers the events of one action. Each recipient sees them in list order, with no
     * event of another batch in between.
     *
     * @param batch notices in emission order
     */
    void emit(List<Notice> batch);

    default void emit(Notice notice) {
        emit(List.of(notice));
    }

    default void emit(String eventType, ObjectNode fields, Set<Long> recipients) {
        emit(Notice.of(Event.of(eventType, fields), recipients));
    }
}
