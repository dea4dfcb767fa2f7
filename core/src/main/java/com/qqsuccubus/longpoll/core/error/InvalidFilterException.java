package com.qqsuccubus.longpoll.core.error;

/**
 * A narrow is malformed or references a stream that does not exist.
 */
public class InvalidFilterException extends EventQueueException {

    public InvalidFilterException(String message) {
        super(message);
    }
}
