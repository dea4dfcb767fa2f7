package com.qqsuccubus.longpoll.server.http;

import com.qqsuccubus.longpoll.core.error.EventQueueException;

/**
 * The request does not identify a principal.
 */
public class AuthenticationException extends EventQueueException {

    public AuthenticationException(String message) {
        super(message);
    }
}
