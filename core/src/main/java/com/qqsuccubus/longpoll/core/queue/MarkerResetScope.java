package com.qqsuccubus.longpoll.core.queue;

/**
 * Which collapsing keys a {@code restart} (generation marker) push forgets.
 * <p>
 * After a marker, events that were live before it stay frozen in the queue; the
 * forgotten keys start collapsing afresh from the next push.
 * </p>
 */
public enum MarkerResetScope {
    /**
     * Forget every key except the marker's own.
     */
    ALL_KEYS,

    /**
     * Forget pointer-style keys only; message-flag updates keep merging across the marker.
     */
    NON_FLAG_KEYS
}
