package com.qqsuccubus.longpoll.server.client;

/**
 * Result of offering an event to a client descriptor.
 */
public enum Delivery {
    /** The descriptor's type allow-list or narrow rejected the event. */
    FILTERED,
    /** Appended as a new live event. */
    ENQUEUED,
    /** Replaced the live representative of its collapsing key. */
    COLLAPSED
}
