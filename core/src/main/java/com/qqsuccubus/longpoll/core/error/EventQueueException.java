package com.qqsuccubus.longpoll.core.error;

/**
 * Base type for failures raised by the event queue subsystem.
 */
public class EventQueueException extends RuntimeException {

    public EventQueueException(String message) {
        super(message);
    }

    public EventQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
