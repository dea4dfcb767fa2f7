package com.qqsuccubus.longpoll.server.dispatch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.model.Event;
import com.qqsuccubus.longpoll.core.model.EventType;
import com.qqsuccubus.longpoll.server.client.ClientDescriptor;

/**
 * Tailors a message event to one client: markdown or HTML content, and the sender's local id.
 */
final class EventProjection {
    static final String CONTENT = "content";
    static final String RENDERED_CONTENT = "rendered_content";
    static final String CONTENT_TYPE = "content_type";
    static final String LOCAL_MESSAGE_ID = "local_message_id";

    private EventProjection() {
    }

    static Event project(Notice notice, ClientDescriptor client) {
        Event event = notice.getEvent();
        if (!event.is(EventType.MESSAGE)) {
            return event;
        }

        ObjectNode fields = event.fieldsCopy();
        if (!(fields.get("message") instanceof ObjectNode message)) {
            return event;
        }
        if (client.isApplyMarkdown()) {
            message.set(CONTENT, message.path(RENDERED_CONTENT).deepCopy());
            message.put(CONTENT_TYPE, "text/html");
        } else {
            message.put(CONTENT_TYPE, "text/x-markdown");
        }
        message.remove(RENDERED_CONTENT);

        if (notice.getLocalMessageId() != null && client.getQueueId().equals(notice.getSenderQueueId())) {
            fields.put(LOCAL_MESSAGE_ID, notice.getLocalMessageId());
        }
        return event.withFields(fields);
    }
}
