package com.qqsuccubus.longpoll.server.poll;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How a poll returned.
 */
@Getter
@RequiredArgsConstructor
public enum PollOutcome {
    /** Events were already queued, or the client asked not to block. */
    IMMEDIATE("immediate"),
    /** A dispatch woke the waiting poll. */
    WOKEN("woken"),
    /** The wait ran out; the result may be empty. */
    TIMEOUT("timeout"),
    /** The queue was disconnected or torn down while the poll waited. */
    CLOSED("closed");

    private final String tag;
}
