package com.qqsuccubus.longpoll.server.registry;

import com.qqsuccubus.longpoll.core.error.InvalidFilterException;
import com.qqsuccubus.longpoll.core.error.QueueNotFoundException;
import com.qqsuccubus.longpoll.server.client.ClientDescriptor;
import com.qqsuccubus.longpoll.server.client.ClientRegistration;

import java.time.Instant;
import java.util.Collection;

/**
 * Process-wide table of client descriptors.
 */
public interface IQueueRegistry {

    /**
     * Creates and indexes a descriptor for a new client.
     *
     * @param registration resolved registration
     * @return the new descriptor
     * @throws InvalidFilterException if the narrow names a stream that does not exist
     */
    ClientDescriptor allocate(ClientRegistration registration);

    /**
     * Finds a descriptor owned by {@code principalId}.
     *
     * @throws QueueNotFoundException if the queue is unknown or belongs to someone else
     */
    ClientDescriptor lookup(String queueId, long principalId);

    /**
     * Explicit disconnect.
     *
     * @throws QueueNotFoundException if the queue is unknown or belongs to someone else
     */
    void remove(String queueId, long principalId);

    /**
     * Removes expired descriptors.
     *
     * @param now current time
     * @return number of descriptors removed
     */
    int sweep(Instant now);

    Collection<ClientDescriptor> clientsFor(long principalId);

    Collection<ClientDescriptor> allPublicStreamsClients(long realmId);

    Collection<ClientDescriptor> all();

    int size();

    String getServerGeneration();
}
