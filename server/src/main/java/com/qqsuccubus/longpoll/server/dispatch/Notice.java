package com.qqsuccubus.longpoll.server.dispatch;

import com.qqsuccubus.longpoll.core.model.Event;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * An event handed over by a domain action together with who should receive it.
 */
@Value
@Builder(toBuilder = true)
public class Notice {
    Event event;

    @Singular
    Set<Long> recipients;

    // Set for messages to public streams; those also reach the realm's all_public_streams clients.
    Long publicStreamRealmId;

    // Queue the sending client polls on, and the id it assigned locally to the message.
    String senderQueueId;
    String localMessageId;

    public static Notice of(Event event, Set<Long> recipients) {
        return Notice.builder().event(event).recipients(recipients).build();
    }

    public boolean isPublicStreamMessage() {
        return publicStreamRealmId != null;
    }
}
