package com.qqsuccubus.longpoll.core.error;

/**
 * The state reconciler met an event it has no transform for.
 * <p>
 * This is a programming error: replaying such an event would silently break
 * the replay-equals-fresh-fetch guarantee, so it must never be caught and ignored.
 * </p>
 */
public class UnhandledEventTypeException extends EventQueueException {

    public UnhandledEventTypeException(String message) {
        super(message);
    }
}
