package com.qqsuccubus.longpoll.server.register;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.longpoll.core.state.Snapshot;
import lombok.Value;

/**
 * Answer to a register call: where to poll, and the state to start from.
 */
@Value
public class Registration {
    String queueId;
    long lastEventId;
    Snapshot state;

    public ObjectNode toJson() {
        ObjectNode json = state.toJson().deepCopy();
        json.put("queue_id", queueId);
        json.put("last_event_id", lastEventId);
        return json;
    }
}
