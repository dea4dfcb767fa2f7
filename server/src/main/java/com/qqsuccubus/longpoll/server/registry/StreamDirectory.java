package com.qqsuccubus.longpoll.server.registry;

/**
 * Lookup used to validate narrows at allocation time.
 */
public interface StreamDirectory {

    /**
     * @param realmId    realm the client belongs to
     * @param streamName stream name, compared case-insensitively
     * @return true if the realm has a stream with that name
     */
    boolean streamExists(long realmId, String streamName);
}
