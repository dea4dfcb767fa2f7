package com.qqsuccubus.longpoll.core.error;

import lombok.Getter;

/**
 * The queue id is unknown, already removed, or owned by another principal.
 * <p>
 * Both cases produce the same error so a caller cannot probe for other
 * accounts' queue ids.
 * </p>
 */
@Getter
public class QueueNotFoundException extends EventQueueException {
    private final String queueId;

    public QueueNotFoundException(String queueId) {
        super("Bad event queue id: " + queueId);
        this.queueId = queueId;
    }
}
